package org.pragmatica.logstash.parser;

import org.pragmatica.logstash.tree.SourceLocation;
import org.pragmatica.logstash.tree.SourceSpan;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable parsing context that tracks state during parsing of one text.
 */
public final class ParsingContext {

    private final String input;
    private final Map<Long, ParseResult<?>> packratCache;

    private int pos;
    private int line;
    private int column;
    private int furthestPos;
    private int furthestLine;
    private int furthestColumn;
    private String furthestExpected;

    private ParsingContext(String input, ParserConfig config) {
        this.input = input;
        this.packratCache = config.packratEnabled() ? new HashMap<>() : null;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
        this.furthestPos = 0;
        this.furthestLine = 1;
        this.furthestColumn = 1;
        this.furthestExpected = "";
    }

    public static ParsingContext create(String input, ParserConfig config) {
        return new ParsingContext(input, config);
    }

    // === Position Management ===

    public int pos() {
        return pos;
    }

    public SourceLocation location() {
        return SourceLocation.at(line, column, pos);
    }

    public void restoreLocation(SourceLocation loc) {
        this.pos = loc.offset();
        this.line = loc.line();
        this.column = loc.column();
    }

    public SourceSpan spanFrom(SourceLocation start) {
        return SourceSpan.of(start, location());
    }

    public boolean isAtEnd() {
        return pos >= input.length();
    }

    public int remaining() {
        return input.length() - pos;
    }

    // === Character Access ===

    public char peek() {
        return input.charAt(pos);
    }

    public char peek(int offset) {
        return input.charAt(pos + offset);
    }

    public boolean startsWith(String text) {
        return input.startsWith(text, pos);
    }

    public char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    public void advance(int count) {
        for (int i = 0; i < count; i++) {
            advance();
        }
    }

    public String substring(int start, int end) {
        return input.substring(start, end);
    }

    public String remainingInput() {
        return input.substring(pos);
    }

    /**
     * Skip whitespace and {@code #} comments running to the end of the line.
     */
    public void skipTrivia() {
        while (!isAtEnd()) {
            var c = peek();
            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == '#') {
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else {
                return;
            }
        }
    }

    // === Error Tracking ===

    public void updateFurthest(String expected) {
        if (pos > furthestPos) {
            furthestPos = pos;
            furthestLine = line;
            furthestColumn = column;
            furthestExpected = expected;
        } else if (pos == furthestPos && !furthestExpected.contains(expected)) {
            furthestExpected = furthestExpected.isEmpty()
                               ? expected
                               : furthestExpected + " or " + expected;
        }
    }

    public int furthestPos() {
        return furthestPos;
    }

    public SourceLocation furthestLocation() {
        return SourceLocation.at(furthestLine, furthestColumn, furthestPos);
    }

    public String furthestExpected() {
        return furthestExpected;
    }

    // === Packrat Cache ===

    /**
     * Cached result of the rule at the current position. A cached success moves the position
     * past the match, as a fresh match would.
     */
    @SuppressWarnings("unchecked")
    public <T> Optional<ParseResult<T>> getCached(int ruleId) {
        if (packratCache == null) {
            return Optional.empty();
        }
        var cached = (ParseResult<T>) packratCache.get(key(ruleId, pos));
        if (cached instanceof ParseResult.Success<T> success) {
            restoreLocation(success.endLocation());
        }
        return Optional.ofNullable(cached);
    }

    public void cacheAt(int ruleId, int position, ParseResult<?> result) {
        if (packratCache != null) {
            packratCache.put(key(ruleId, position), result);
        }
    }

    public int cacheSize() {
        return packratCache == null ? 0 : packratCache.size();
    }

    private static long key(int ruleId, int position) {
        return ((long) ruleId << 32) | position;
    }
}
