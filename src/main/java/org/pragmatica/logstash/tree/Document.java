package org.pragmatica.logstash.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A whole pipeline configuration. Sections of the same type are kept apart in source order.
 */
public record Document(List<Section> sections, Optional<SourceSpan> span) implements Node {

    public Document {
        sections = List.copyOf(sections);
        Objects.requireNonNull(span, "span");
    }

    public Document(List<Section> sections) {
        this(sections, Optional.empty());
    }

    public static Document of(Section... sections) {
        return new Document(List.of(sections));
    }

    public Document append(Section section) {
        var list = new ArrayList<>(sections);
        list.add(section);
        return new Document(list);
    }

    public List<Section> sections(SectionType type) {
        return sections.stream()
                       .filter(section -> section.type() == type)
                       .toList();
    }

    @Override
    public List<Node> children() {
        return List.copyOf(sections);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DOCUMENT;
    }

    @Override
    public <I, O> O accept(NodeVisitor<I, O> visitor, I input) {
        return visitor.visitDocument(this, input);
    }
}
