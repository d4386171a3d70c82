package org.pragmatica.logstash;

import com.fasterxml.jackson.databind.JsonNode;
import org.pragmatica.logstash.canonical.CanonicalTree;
import org.pragmatica.logstash.canonical.TreeConfig;
import org.pragmatica.logstash.parser.ConfigParser;
import org.pragmatica.logstash.parser.ParserConfig;
import org.pragmatica.logstash.render.RenderConfig;
import org.pragmatica.logstash.render.SourceRenderer;
import org.pragmatica.logstash.tree.Document;
import org.pragmatica.logstash.tree.Node;
import org.pragmatica.logstash.tree.NodeKind;
import org.pragmatica.logstash.tree.NodeValues;

/**
 * Configured parser, renderer and canonical tree converter. Instances are immutable and may be shared.
 */
public final class ConfigProcessor {
    static final ConfigProcessor DEFAULT = new ConfigProcessor(ParserConfig.DEFAULT, RenderConfig.DEFAULT, TreeConfig.DEFAULT);

    private final ConfigParser parser;
    private final SourceRenderer renderer;
    private final CanonicalTree canonicalTree;

    private ConfigProcessor(ParserConfig parserConfig, RenderConfig renderConfig, TreeConfig treeConfig) {
        this.parser = ConfigParser.create(parserConfig);
        this.renderer = SourceRenderer.create(renderConfig);
        this.canonicalTree = CanonicalTree.create(treeConfig);
    }

    public Document parse(String text) {
        return parser.parseDocument(text);
    }

    public Node parse(String text, NodeKind kind) {
        return parse(text, kind, false);
    }

    public Node parse(String text, NodeKind kind, boolean allowTrailing) {
        return parser.parse(text, kind, allowTrailing);
    }

    public String render(Node node) {
        return renderer.render(node);
    }

    public Object toValue(Node node) {
        return NodeValues.of(node);
    }

    public JsonNode toTree(Node node) {
        return canonicalTree.toTree(node);
    }

    public Node fromTree(JsonNode tree) {
        return canonicalTree.fromTree(tree);
    }

    public Node fromTree(JsonNode tree, NodeKind kind) {
        return canonicalTree.fromTree(tree, kind);
    }

    public String toJson(Node node) {
        return canonicalTree.toJson(node);
    }

    public Node fromJson(String json) {
        return canonicalTree.fromJson(json);
    }

    public Node fromJson(String json, NodeKind kind) {
        return canonicalTree.fromJson(json, kind);
    }

    public static final class Builder {
        private boolean packratEnabled = true;
        private int indentWidth = RenderConfig.DEFAULT.indentWidth();
        private boolean prettyJson = false;

        Builder() {
        }

        public Builder packrat(boolean enabled) {
            this.packratEnabled = enabled;
            return this;
        }

        public Builder indentWidth(int width) {
            this.indentWidth = width;
            return this;
        }

        public Builder prettyJson(boolean pretty) {
            this.prettyJson = pretty;
            return this;
        }

        public ConfigProcessor build() {
            return new ConfigProcessor(new ParserConfig(packratEnabled),
                                       new RenderConfig(indentWidth),
                                       new TreeConfig(prettyJson));
        }
    }
}
