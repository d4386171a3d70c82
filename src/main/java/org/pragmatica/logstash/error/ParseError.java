package org.pragmatica.logstash.error;

import org.pragmatica.logstash.tree.SourceLocation;

import java.util.Optional;

/**
 * Why a configuration text could not be parsed.
 */
public sealed interface ParseError {
    String message();

    /**
     * Where the failure was detected, when it relates to a position in the text.
     */
    Optional<SourceLocation> location();

    /**
     * Text is empty or contains only whitespace.
     */
    record EmptyInput() implements ParseError {
        @Override
        public String message() {
            return "Configuration text is empty";
        }

        @Override
        public Optional<SourceLocation> location() {
            return Optional.empty();
        }
    }

    /**
     * Unexpected input error.
     */
    record UnexpectedInput(SourceLocation at, String found, String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected '" + found + "' at " + at + ", expected " + expected;
        }

        @Override
        public Optional<SourceLocation> location() {
            return Optional.of(at);
        }
    }

    /**
     * Unexpected end of input.
     */
    record UnexpectedEof(SourceLocation at, String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected end of input at " + at + ", expected " + expected;
        }

        @Override
        public Optional<SourceLocation> location() {
            return Optional.of(at);
        }
    }

    /**
     * A string or number token matched but could not be decoded.
     */
    record InvalidLiteral(SourceLocation at, String lexeme, String reason) implements ParseError {
        @Override
        public String message() {
            return "Invalid literal " + lexeme + " at " + at + ": " + reason;
        }

        @Override
        public Optional<SourceLocation> location() {
            return Optional.of(at);
        }
    }

    /**
     * Anything else that went wrong while parsing.
     */
    record Internal(Throwable cause) implements ParseError {
        @Override
        public String message() {
            return "Internal error: " + cause;
        }

        @Override
        public Optional<SourceLocation> location() {
            return Optional.empty();
        }
    }
}
