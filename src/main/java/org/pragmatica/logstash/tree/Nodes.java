package org.pragmatica.logstash.tree;

import java.util.stream.Stream;

/**
 * Tree traversal helpers.
 */
public final class Nodes {
    private Nodes() {
    }

    /**
     * Depth-first, pre-order stream of the node and all its descendants.
     */
    public static Stream<Node> walk(Node root) {
        return Stream.concat(Stream.of(root),
                             root.children()
                                 .stream()
                                 .flatMap(Nodes::walk));
    }

    public static <T extends Node> Stream<T> find(Node root, Class<T> type) {
        return walk(root).filter(type::isInstance)
                         .map(type::cast);
    }
}
