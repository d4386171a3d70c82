package org.pragmatica.logstash.tree;

import org.pragmatica.logstash.error.LiteralDecodeException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Leaf nodes. Each keeps the lexeme it renders back to.
 */
public sealed interface Literal extends Node permits Literal.QuotedString, Literal.Bareword, Literal.Numeric,
        Literal.Bool, Literal.Regex, Literal.Selector {

    /**
     * Source form of the literal: the original lexeme when parsed, a canonical one otherwise.
     */
    String toSource();

    @Override
    default List<Node> children() {
        return List.of();
    }

    /**
     * Literals usable as a map key.
     */
    sealed interface Key extends Node permits QuotedString, Bareword, Numeric {
        String toSource();
    }

    /**
     * Literals usable as a plugin or attribute name.
     */
    sealed interface Name extends Node permits QuotedString, Bareword {
        String toSource();

        /**
         * The name as text, without quotes.
         */
        String text();
    }

    /**
     * Quoted string. The lexeme keeps the original quote character.
     */
    record QuotedString(String lexeme, String value, Optional<SourceSpan> span) implements Literal, Key, Name {
        public QuotedString {
            Objects.requireNonNull(lexeme, "lexeme");
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(span, "span");
            if (!StringEscapes.decode(lexeme).equals(value)) {
                throw new IllegalArgumentException("Lexeme " + lexeme + " does not decode to the given value");
            }
        }

        /**
         * Decode a lexeme, quotes included.
         *
         * @throws LiteralDecodeException when the lexeme cannot be decoded
         */
        public static QuotedString parse(String lexeme) {
            return parse(lexeme, Optional.empty());
        }

        public static QuotedString parse(String lexeme, Optional<SourceSpan> span) {
            return new QuotedString(lexeme, StringEscapes.decode(lexeme), span);
        }

        public static QuotedString of(String value) {
            return of(value, '"');
        }

        public static QuotedString of(String value, char quote) {
            return new QuotedString(StringEscapes.encode(value, quote), value, Optional.empty());
        }

        public char quote() {
            return lexeme.charAt(0);
        }

        @Override
        public String text() {
            return value;
        }

        @Override
        public String toSource() {
            return lexeme;
        }

        @Override
        public NodeKind kind() {
            return NodeKind.STRING;
        }

        @Override
        public <I, O> O accept(NodeVisitor<I, O> visitor, I input) {
            return visitor.visitString(this, input);
        }
    }

    /**
     * Unquoted identifier: plugin and attribute names, map keys, method names.
     */
    record Bareword(String value, Optional<SourceSpan> span) implements Literal, Key, Name {
        public Bareword {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(span, "span");
            if (value.isEmpty()) {
                throw new IllegalArgumentException("Bareword must not be empty");
            }
        }

        public Bareword(String value) {
            this(value, Optional.empty());
        }

        @Override
        public String text() {
            return value;
        }

        @Override
        public String toSource() {
            return value;
        }

        @Override
        public NodeKind kind() {
            return NodeKind.BAREWORD;
        }

        @Override
        public <I, O> O accept(NodeVisitor<I, O> visitor, I input) {
            return visitor.visitBareword(this, input);
        }
    }

    /**
     * Number literal. The value is a {@link Long}, a {@link BigInteger} when the integer does not fit
     * a long, or a {@link Double}; integer literals never turn into floating point ones.
     */
    record Numeric(String lexeme, Number value, Optional<SourceSpan> span) implements Literal, Key {
        private static final Pattern LEXEME = Pattern.compile("-?[0-9]+(\\.[0-9]+)?");

        public Numeric {
            Objects.requireNonNull(lexeme, "lexeme");
            Objects.requireNonNull(span, "span");
            value = normalize(Objects.requireNonNull(value, "value"));
        }

        public static Numeric of(long value) {
            return of((Number) value);
        }

        public static Numeric of(double value) {
            return of((Number) value);
        }

        public static Numeric of(Number value) {
            var normalized = normalize(value);
            return new Numeric(canonicalLexeme(normalized), normalized, Optional.empty());
        }

        /**
         * Read a number lexeme such as {@code -12} or {@code 3.50}.
         *
         * @throws LiteralDecodeException when the text is not a number literal
         */
        public static Numeric parse(String lexeme) {
            return parse(lexeme, Optional.empty());
        }

        public static Numeric parse(String lexeme, Optional<SourceSpan> span) {
            if (!LEXEME.matcher(lexeme).matches()) {
                throw new LiteralDecodeException(lexeme, "not a number literal");
            }
            Number value = lexeme.indexOf('.') >= 0
                           ? (Number) Double.parseDouble(lexeme)
                           : new BigInteger(lexeme);
            return new Numeric(lexeme, value, span);
        }

        public boolean isIntegral() {
            return !(value instanceof Double);
        }

        /**
         * Text derived from the value alone, so {@code 1.50} and {@code 1.5} read the same.
         */
        public String canonicalText() {
            return canonicalLexeme(value);
        }

        private static Number normalize(Number value) {
            if (value instanceof Long || value instanceof Double) {
                checkFinite(value);
                return value;
            }
            if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
                return value.longValue();
            }
            if (value instanceof Float) {
                return checkFinite(value.doubleValue());
            }
            if (value instanceof BigInteger big) {
                return big.bitLength() < 64 ? (Number) big.longValue() : big;
            }
            if (value instanceof BigDecimal decimal) {
                return checkFinite(decimal.doubleValue());
            }
            throw new IllegalArgumentException("Unsupported number type " + value.getClass().getName());
        }

        private static Number checkFinite(Number value) {
            if (value instanceof Double d && (d.isNaN() || d.isInfinite())) {
                throw new IllegalArgumentException("Number literal must be finite, got " + d);
            }
            return value;
        }

        private static String canonicalLexeme(Number value) {
            if (!(value instanceof Double d)) {
                return value.toString();
            }
            var text = BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
            return text.indexOf('.') >= 0 ? text : text + ".0";
        }

        @Override
        public String toSource() {
            return lexeme;
        }

        @Override
        public NodeKind kind() {
            return NodeKind.NUMBER;
        }

        @Override
        public <I, O> O accept(NodeVisitor<I, O> visitor, I input) {
            return visitor.visitNumber(this, input);
        }
    }

    record Bool(boolean value, Optional<SourceSpan> span) implements Literal {
        public Bool {
            Objects.requireNonNull(span, "span");
        }

        public Bool(boolean value) {
            this(value, Optional.empty());
        }

        @Override
        public String toSource() {
            return Boolean.toString(value);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.BOOLEAN;
        }

        @Override
        public <I, O> O accept(NodeVisitor<I, O> visitor, I input) {
            return visitor.visitBoolean(this, input);
        }
    }

    /**
     * Regular expression. The pattern is stored without its delimiting slashes; a pattern given
     * with them is stripped once, and a bare {@code /} inside the pattern is escaped as {@code \/}.
     */
    record Regex(String pattern, Optional<SourceSpan> span) implements Literal {
        public Regex {
            Objects.requireNonNull(pattern, "pattern");
            Objects.requireNonNull(span, "span");
            pattern = escapeSlashes(stripDelimiters(pattern));
        }

        public Regex(String pattern) {
            this(pattern, Optional.empty());
        }

        private static String stripDelimiters(String pattern) {
            if (pattern.length() >= 2 && pattern.startsWith("/") && pattern.endsWith("/") && !pattern.endsWith("\\/")) {
                return pattern.substring(1, pattern.length() - 1);
            }
            return pattern;
        }

        private static String escapeSlashes(String pattern) {
            if (pattern.indexOf('/') < 0) {
                return pattern;
            }
            var out = new StringBuilder(pattern.length() + 4);
            for (int i = 0; i < pattern.length(); i++) {
                var c = pattern.charAt(i);
                if (c == '/' && (i == 0 || pattern.charAt(i - 1) != '\\')) {
                    out.append('\\');
                }
                out.append(c);
            }
            return out.toString();
        }

        @Override
        public String toSource() {
            return "/" + pattern + "/";
        }

        @Override
        public NodeKind kind() {
            return NodeKind.REGEX;
        }

        @Override
        public <I, O> O accept(NodeVisitor<I, O> visitor, I input) {
            return visitor.visitRegex(this, input);
        }
    }

    /**
     * Field reference such as {@code [request][status]}, kept as opaque text.
     */
    record Selector(String raw, Optional<SourceSpan> span) implements Literal {
        private static final Pattern SHAPE = Pattern.compile("(\\[[^\\[\\],]+\\])+");

        public Selector {
            Objects.requireNonNull(raw, "raw");
            Objects.requireNonNull(span, "span");
            if (!SHAPE.matcher(raw).matches()) {
                throw new IllegalArgumentException("Not a field selector: " + raw);
            }
        }

        public Selector(String raw) {
            this(raw, Optional.empty());
        }

        @Override
        public String toSource() {
            return raw;
        }

        @Override
        public NodeKind kind() {
            return NodeKind.SELECTOR;
        }

        @Override
        public <I, O> O accept(NodeVisitor<I, O> visitor, I input) {
            return visitor.visitSelector(this, input);
        }
    }
}
