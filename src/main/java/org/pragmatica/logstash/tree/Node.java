package org.pragmatica.logstash.tree;

import java.util.List;
import java.util.Optional;

/**
 * A node of a Logstash configuration tree.
 * <p>
 * Nodes are immutable records. Parsed nodes carry the span of text they were read from,
 * nodes built in code or from a canonical tree carry none. Operations over the tree are
 * expressed as {@link NodeVisitor} implementations so every node type is handled everywhere.
 */
public sealed interface Node
        permits Literal, Literal.Key, Literal.Name, Composite, Expression, Declaration, Statement, Clause, Section,
        Document {

    Optional<SourceSpan> span();

    NodeKind kind();

    /**
     * Owned child nodes in source order.
     */
    List<Node> children();

    <I, O> O accept(NodeVisitor<I, O> visitor, I input);
}
