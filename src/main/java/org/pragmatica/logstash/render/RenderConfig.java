package org.pragmatica.logstash.render;

/**
 * Source rendering options.
 *
 * @param indentWidth spaces per nesting level
 */
public record RenderConfig(int indentWidth) {
    public static final RenderConfig DEFAULT = new RenderConfig(2);

    public RenderConfig {
        if (indentWidth < 0) {
            throw new IllegalArgumentException("Indent width must not be negative: " + indentWidth);
        }
    }
}
