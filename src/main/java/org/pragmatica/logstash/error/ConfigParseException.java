package org.pragmatica.logstash.error;

/**
 * The single failure type of configuration parsing. The reason is available as a {@link ParseError}.
 */
public class ConfigParseException extends RuntimeException {
    private final ParseError error;

    public ConfigParseException(ParseError error) {
        super(describe(error), error instanceof ParseError.Internal internal ? internal.cause() : null);
        this.error = error;
    }

    public ParseError error() {
        return error;
    }

    private static String describe(ParseError error) {
        if (error instanceof ParseError.EmptyInput) {
            return error.message();
        }
        return "Failed to parse Logstash configuration: " + error.message();
    }
}
