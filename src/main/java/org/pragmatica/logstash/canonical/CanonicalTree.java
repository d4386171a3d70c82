package org.pragmatica.logstash.canonical;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.pragmatica.logstash.error.TreeShapeException;
import org.pragmatica.logstash.tree.Node;
import org.pragmatica.logstash.tree.NodeKind;

/**
 * JSON text form of the canonical tree.
 */
public final class CanonicalTree {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ObjectWriter writer;

    private CanonicalTree(TreeConfig config) {
        this.writer = config.prettyPrint() ? MAPPER.writerWithDefaultPrettyPrinter() : MAPPER.writer();
    }

    public static CanonicalTree create() {
        return create(TreeConfig.DEFAULT);
    }

    public static CanonicalTree create(TreeConfig config) {
        return new CanonicalTree(config);
    }

    public JsonNode toTree(Node node) {
        return TreeWriter.toTree(node);
    }

    public Node fromTree(JsonNode tree) {
        return TreeReader.fromTree(tree);
    }

    public Node fromTree(JsonNode tree, NodeKind kind) {
        return TreeReader.fromTree(tree, kind);
    }

    public String toJson(Node node) {
        try {
            return writer.writeValueAsString(toTree(node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Canonical tree of " + node.kind() + " could not be serialized", e);
        }
    }

    public Node fromJson(String json) {
        return fromTree(parseJson(json));
    }

    public Node fromJson(String json, NodeKind kind) {
        return fromTree(parseJson(json), kind);
    }

    private static JsonNode parseJson(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new TreeShapeException("Malformed canonical tree JSON: " + e.getOriginalMessage(), e);
        }
    }
}
