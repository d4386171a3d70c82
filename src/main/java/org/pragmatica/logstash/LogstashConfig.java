package org.pragmatica.logstash;

import com.fasterxml.jackson.databind.JsonNode;
import org.pragmatica.logstash.error.ConfigParseException;
import org.pragmatica.logstash.tree.Document;
import org.pragmatica.logstash.tree.Node;
import org.pragmatica.logstash.tree.NodeKind;
import org.pragmatica.logstash.tree.ValueContext;
import org.pragmatica.logstash.tree.NodeValues;

import java.util.Optional;

/**
 * Main entry point for working with Logstash pipeline configurations.
 * <p>
 * Example usage:
 * <pre>{@code
 * var document = LogstashConfig.parse("""
 *     filter {
 *       mutate { add_tag => ["ok"] }
 *     }
 *     """);
 * var text = LogstashConfig.render(document);
 * var json = LogstashConfig.toJson(document);
 * }</pre>
 * Parse failures of any kind are reported as {@link ConfigParseException}.
 */
public final class LogstashConfig {
    private LogstashConfig() {
    }

    /**
     * Parse a whole configuration: one or more sections.
     */
    public static Document parse(String text) {
        return ConfigProcessor.DEFAULT.parse(text);
    }

    /**
     * Parse a fragment holding exactly one node of the given kind.
     */
    public static Node parse(String text, NodeKind kind) {
        return ConfigProcessor.DEFAULT.parse(text, kind);
    }

    /**
     * Parse a fragment starting with a node of the given kind.
     *
     * @param allowTrailing when true, text after the node is ignored
     */
    public static Node parse(String text, NodeKind kind, boolean allowTrailing) {
        return ConfigProcessor.DEFAULT.parse(text, kind, allowTrailing);
    }

    public static String render(Node node) {
        return ConfigProcessor.DEFAULT.render(node);
    }

    public static Object toValue(Node node) {
        return ConfigProcessor.DEFAULT.toValue(node);
    }

    public static Object toValue(Node node, ValueContext context) {
        return NodeValues.of(node, context);
    }

    public static JsonNode toTree(Node node) {
        return ConfigProcessor.DEFAULT.toTree(node);
    }

    public static Node fromTree(JsonNode tree) {
        return ConfigProcessor.DEFAULT.fromTree(tree);
    }

    public static Node fromTree(JsonNode tree, NodeKind kind) {
        return ConfigProcessor.DEFAULT.fromTree(tree, kind);
    }

    public static String toJson(Node node) {
        return ConfigProcessor.DEFAULT.toJson(node);
    }

    public static Node fromJson(String json) {
        return ConfigProcessor.DEFAULT.fromJson(json);
    }

    /**
     * Exact text a parsed node was read from. Empty for nodes built in code or from a tree.
     */
    public static Optional<String> sourceText(Node node, String text) {
        return node.span()
                   .map(span -> span.extract(text));
    }

    /**
     * Create a builder for a processor with non-default options.
     */
    public static ConfigProcessor.Builder builder() {
        return new ConfigProcessor.Builder();
    }
}
