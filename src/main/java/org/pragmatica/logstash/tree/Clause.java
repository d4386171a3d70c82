package org.pragmatica.logstash.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One arm of a {@link Branch}.
 */
public sealed interface Clause extends Node permits Clause.If, Clause.ElseIf, Clause.Else {

    List<Statement> body();

    private static List<Node> withBody(Node head, List<Statement> body) {
        var children = new ArrayList<Node>(body.size() + 1);
        children.add(head);
        children.addAll(body);
        return List.copyOf(children);
    }

    record If(Node condition, List<Statement> body, Optional<SourceSpan> span) implements Clause {
        public If {
            Objects.requireNonNull(condition, "condition");
            body = List.copyOf(body);
            Objects.requireNonNull(span, "span");
        }

        public If(Node condition, List<Statement> body) {
            this(condition, body, Optional.empty());
        }

        @Override
        public List<Node> children() {
            return withBody(condition, body);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.IF;
        }

        @Override
        public <I, O> O accept(NodeVisitor<I, O> visitor, I input) {
            return visitor.visitIf(this, input);
        }
    }

    record ElseIf(Node condition, List<Statement> body, Optional<SourceSpan> span) implements Clause {
        public ElseIf {
            Objects.requireNonNull(condition, "condition");
            body = List.copyOf(body);
            Objects.requireNonNull(span, "span");
        }

        public ElseIf(Node condition, List<Statement> body) {
            this(condition, body, Optional.empty());
        }

        @Override
        public List<Node> children() {
            return withBody(condition, body);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.ELSE_IF;
        }

        @Override
        public <I, O> O accept(NodeVisitor<I, O> visitor, I input) {
            return visitor.visitElseIf(this, input);
        }
    }

    record Else(List<Statement> body, Optional<SourceSpan> span) implements Clause {
        public Else {
            body = List.copyOf(body);
            Objects.requireNonNull(span, "span");
        }

        public Else(List<Statement> body) {
            this(body, Optional.empty());
        }

        @Override
        public List<Node> children() {
            return List.copyOf(body);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.ELSE;
        }

        @Override
        public <I, O> O accept(NodeVisitor<I, O> visitor, I input) {
            return visitor.visitElse(this, input);
        }
    }
}
