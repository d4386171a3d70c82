package org.pragmatica.logstash.parser;

import org.pragmatica.logstash.tree.SourceLocation;

import java.util.function.Function;

/**
 * Result of applying a grammar rule - either success with a value or failure.
 */
public sealed interface ParseResult<T> {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * The parsed value; only meaningful on success.
     *
     * @throws IllegalStateException on failure
     */
    T value();

    <R> ParseResult<R> map(Function<? super T, ? extends R> mapper);

    static <T> ParseResult<T> success(T value, SourceLocation endLocation) {
        return new Success<>(value, endLocation);
    }

    static <T> ParseResult<T> failure(SourceLocation location, String expected) {
        return new Failure<>(location, expected);
    }

    /**
     * Results are immutable, so a result of a subtype can stand for a result of the supertype.
     */
    @SuppressWarnings("unchecked")
    static <T> ParseResult<T> covariant(ParseResult<? extends T> result) {
        return (ParseResult<T>) result;
    }

    /**
     * Successful match with the value and the position right after it.
     */
    record Success<T>(T value, SourceLocation endLocation) implements ParseResult<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public <R> ParseResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Success<>(mapper.apply(value), endLocation);
        }
    }

    /**
     * No match. Location and expectation describe the furthest point the parser reached.
     */
    record Failure<T>(SourceLocation location, String expected) implements ParseResult<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T value() {
            throw new IllegalStateException("No value: expected " + expected + " at " + location);
        }

        @Override
        public <R> ParseResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Failure<>(location, expected);
        }
    }
}
