package org.pragmatica.logstash.parser;

/**
 * Parser configuration options.
 *
 * @param packratEnabled memoize operand and expression results per position, trading memory for
 *                       fewer re-parses when alternatives backtrack over the same operand
 */
public record ParserConfig(boolean packratEnabled) {
    public static final ParserConfig DEFAULT = new ParserConfig(true);
}
