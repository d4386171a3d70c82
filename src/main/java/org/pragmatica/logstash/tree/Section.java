package org.pragmatica.logstash.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code input}, {@code filter} or {@code output} block holding plugins and branches.
 */
public record Section(SectionType type, List<Statement> body, Optional<SourceSpan> span) implements Node {

    public Section {
        Objects.requireNonNull(type, "type");
        body = List.copyOf(body);
        Objects.requireNonNull(span, "span");
    }

    public Section(SectionType type, List<Statement> body) {
        this(type, body, Optional.empty());
    }

    public static Section of(SectionType type, Statement... body) {
        return new Section(type, List.of(body));
    }

    public Section append(Statement statement) {
        var list = new ArrayList<>(body);
        list.add(statement);
        return new Section(type, list);
    }

    public Section remove(int index) {
        var list = new ArrayList<>(body);
        list.remove(index);
        return new Section(type, list);
    }

    public List<Declaration.Plugin> plugins() {
        return body.stream()
                   .filter(Declaration.Plugin.class::isInstance)
                   .map(Declaration.Plugin.class::cast)
                   .toList();
    }

    @Override
    public List<Node> children() {
        return List.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SECTION;
    }

    @Override
    public <I, O> O accept(NodeVisitor<I, O> visitor, I input) {
        return visitor.visitSection(this, input);
    }
}
