package org.pragmatica.logstash.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Array and hash values.
 */
public sealed interface Composite extends Node permits Composite.ArrayValue, Composite.MapValue, Composite.MapEntry {

    record ArrayValue(List<Node> elements, Optional<SourceSpan> span) implements Composite {
        public ArrayValue {
            elements = List.copyOf(elements);
            Objects.requireNonNull(span, "span");
        }

        public ArrayValue(List<Node> elements) {
            this(elements, Optional.empty());
        }

        public static ArrayValue of(Node... elements) {
            return new ArrayValue(List.of(elements));
        }

        public ArrayValue append(Node element) {
            var list = new ArrayList<>(elements);
            list.add(element);
            return new ArrayValue(list);
        }

        @Override
        public List<Node> children() {
            return elements;
        }

        @Override
        public NodeKind kind() {
            return NodeKind.ARRAY;
        }

        @Override
        public <I, O> O accept(NodeVisitor<I, O> visitor, I input) {
            return visitor.visitArray(this, input);
        }
    }

    /**
     * Hash literal. Entries keep their source order.
     */
    record MapValue(List<MapEntry> entries, Optional<SourceSpan> span) implements Composite {
        public MapValue {
            entries = List.copyOf(entries);
            Objects.requireNonNull(span, "span");
        }

        public MapValue(List<MapEntry> entries) {
            this(entries, Optional.empty());
        }

        public static MapValue of(MapEntry... entries) {
            return new MapValue(List.of(entries));
        }

        public MapValue put(Literal.Key key, Node value) {
            var list = new ArrayList<>(entries);
            list.add(new MapEntry(key, value));
            return new MapValue(list);
        }

        @Override
        public List<Node> children() {
            return List.copyOf(entries);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.MAP;
        }

        @Override
        public <I, O> O accept(NodeVisitor<I, O> visitor, I input) {
            return visitor.visitMap(this, input);
        }
    }

    record MapEntry(Literal.Key key, Node value, Optional<SourceSpan> span) implements Composite {
        public MapEntry {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(span, "span");
        }

        public MapEntry(Literal.Key key, Node value) {
            this(key, value, Optional.empty());
        }

        @Override
        public List<Node> children() {
            return List.of(key, value);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.MAP_ENTRY;
        }

        @Override
        public <I, O> O accept(NodeVisitor<I, O> visitor, I input) {
            return visitor.visitMapEntry(this, input);
        }
    }
}
