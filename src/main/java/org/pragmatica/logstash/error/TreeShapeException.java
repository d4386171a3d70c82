package org.pragmatica.logstash.error;

/**
 * A canonical tree does not have the shape of any configuration node.
 */
public class TreeShapeException extends RuntimeException {
    public TreeShapeException(String message) {
        super(message);
    }

    public TreeShapeException(String message, Throwable cause) {
        super(message, cause);
    }
}
