package org.pragmatica.logstash.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Plugin blocks and their attributes.
 */
public sealed interface Declaration extends Node permits Declaration.Attribute, Declaration.Plugin {

    /**
     * {@code name => value}. The value may itself be a plugin (codec style).
     */
    record Attribute(Literal.Name name, Node value, Optional<SourceSpan> span) implements Declaration {
        public Attribute {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(span, "span");
        }

        public Attribute(Literal.Name name, Node value) {
            this(name, value, Optional.empty());
        }

        public static Attribute of(String name, Node value) {
            return new Attribute(new Literal.Bareword(name), value);
        }

        @Override
        public List<Node> children() {
            return List.of(name, value);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.ATTRIBUTE;
        }

        @Override
        public <I, O> O accept(NodeVisitor<I, O> visitor, I input) {
            return visitor.visitAttribute(this, input);
        }
    }

    /**
     * Named block of attributes, e.g. {@code mutate { add_tag => ["x"] }}.
     */
    record Plugin(String name, List<Attribute> attributes, Optional<SourceSpan> span) implements Declaration, Statement {
        public Plugin {
            Objects.requireNonNull(name, "name");
            attributes = List.copyOf(attributes);
            Objects.requireNonNull(span, "span");
            if (name.isEmpty()) {
                throw new IllegalArgumentException("Plugin name must not be empty");
            }
        }

        public Plugin(String name, List<Attribute> attributes) {
            this(name, attributes, Optional.empty());
        }

        public static Plugin of(String name, Attribute... attributes) {
            return new Plugin(name, List.of(attributes));
        }

        public Plugin withAttribute(Attribute attribute) {
            var list = new ArrayList<>(attributes);
            list.add(attribute);
            return new Plugin(name, list);
        }

        public Plugin withoutAttribute(int index) {
            var list = new ArrayList<>(attributes);
            list.remove(index);
            return new Plugin(name, list);
        }

        /**
         * First attribute with the given name, quoted or not.
         */
        public Optional<Attribute> attribute(String attributeName) {
            return attributes.stream()
                             .filter(attribute -> attribute.name().text().equals(attributeName))
                             .findFirst();
        }

        @Override
        public List<Node> children() {
            return List.copyOf(attributes);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.PLUGIN;
        }

        @Override
        public <I, O> O accept(NodeVisitor<I, O> visitor, I input) {
            return visitor.visitPlugin(this, input);
        }
    }
}
