package org.pragmatica.logstash.canonical;

/**
 * Canonical tree serialization options.
 *
 * @param prettyPrint indent JSON output
 */
public record TreeConfig(boolean prettyPrint) {
    public static final TreeConfig DEFAULT = new TreeConfig(false);
}
