package org.pragmatica.logstash.tree;

/**
 * The stretch of configuration text a parsed node was read from, start inclusive, end exclusive.
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public int length() {
        return end.offset() - start.offset();
    }

    /**
     * Cut the covered text out of the text the node was parsed from.
     */
    public String extract(String source) {
        return source.substring(start.offset(), end.offset());
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
