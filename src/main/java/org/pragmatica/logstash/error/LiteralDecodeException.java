package org.pragmatica.logstash.error;

/**
 * A literal token was well formed for the grammar but its content could not be decoded,
 * e.g. a string with a truncated {@code \x} escape.
 */
public class LiteralDecodeException extends RuntimeException {
    private final String lexeme;
    private final String reason;

    public LiteralDecodeException(String lexeme, String reason) {
        super("Invalid literal " + lexeme + ": " + reason);
        this.lexeme = lexeme;
        this.reason = reason;
    }

    public String lexeme() {
        return lexeme;
    }

    public String reason() {
        return reason;
    }
}
