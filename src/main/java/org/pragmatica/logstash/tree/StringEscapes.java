package org.pragmatica.logstash.tree;

import org.pragmatica.logstash.error.LiteralDecodeException;

/**
 * Decoding and encoding of quoted string lexemes.
 * <p>
 * Recognized escapes are {@code \\ \' \" \a \b \f \n \r \t \v}, octal {@code \ooo},
 * {@code \xHH}, <code>&#92;uHHHH</code>, {@code \UHHHHHHHH} and backslash-newline continuation.
 * Any other escape is kept verbatim, backslash included. A raw line break inside the
 * quotes decodes to a single {@code \n}.
 */
public final class StringEscapes {
    private StringEscapes() {
    }

    public static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }

    /**
     * Decode a lexeme, quotes included, into its string value.
     *
     * @throws LiteralDecodeException when the quotes or an escape are malformed
     */
    public static String decode(String lexeme) {
        if (lexeme.length() < 2) {
            throw new LiteralDecodeException(lexeme, "missing quotes");
        }
        var quote = lexeme.charAt(0);
        if (!isQuote(quote) || lexeme.charAt(lexeme.length() - 1) != quote) {
            throw new LiteralDecodeException(lexeme, "mismatched quotes");
        }
        var body = lexeme.substring(1, lexeme.length() - 1);
        var out = new StringBuilder(body.length());
        var i = 0;
        while (i < body.length()) {
            var c = body.charAt(i);
            if (c == quote) {
                throw new LiteralDecodeException(lexeme, "unescaped quote at offset " + (i + 1));
            }
            if (c == '\r' && i + 1 < body.length() && body.charAt(i + 1) == '\n') {
                out.append('\n');
                i += 2;
            } else if (c != '\\') {
                out.append(c);
                i++;
            } else {
                i = decodeEscape(lexeme, body, i + 1, out);
            }
        }
        return out.toString();
    }

    // Returns the index just past the escape starting at 'pos' (the character after the backslash)
    private static int decodeEscape(String lexeme, String body, int pos, StringBuilder out) {
        if (pos >= body.length()) {
            throw new LiteralDecodeException(lexeme, "dangling backslash at end of literal");
        }
        var e = body.charAt(pos);
        switch (e) {
            case '\\', '\'', '"' -> out.append(e);
            case 'a' -> out.append('\u0007');
            case 'b' -> out.append('\b');
            case 'f' -> out.append('\f');
            case 'n' -> out.append('\n');
            case 'r' -> out.append('\r');
            case 't' -> out.append('\t');
            case 'v' -> out.append('\u000B');
            case '\n' -> {
                // line continuation
            }
            case '\r' -> {
                if (pos + 1 < body.length() && body.charAt(pos + 1) == '\n') {
                    return pos + 2;
                }
            }
            case '0', '1', '2', '3', '4', '5', '6', '7' -> {
                return decodeOctal(body, pos, out);
            }
            case 'x' -> {
                return decodeHex(lexeme, body, pos + 1, 2, out);
            }
            case 'u' -> {
                return decodeHex(lexeme, body, pos + 1, 4, out);
            }
            case 'U' -> {
                return decodeHex(lexeme, body, pos + 1, 8, out);
            }
            default -> out.append('\\').append(e);
        }
        return pos + 1;
    }

    private static int decodeOctal(String body, int pos, StringBuilder out) {
        var end = pos;
        while (end < body.length() && end < pos + 3 && body.charAt(end) >= '0' && body.charAt(end) <= '7') {
            end++;
        }
        out.appendCodePoint(Integer.parseInt(body.substring(pos, end), 8));
        return end;
    }

    private static int decodeHex(String lexeme, String body, int pos, int digits, StringBuilder out) {
        var escape = body.charAt(pos - 1);
        if (pos + digits > body.length()) {
            throw truncated(lexeme, escape, digits);
        }
        var codePoint = 0L;
        for (int i = pos; i < pos + digits; i++) {
            var digit = Character.digit(body.charAt(i), 16);
            if (digit < 0) {
                throw truncated(lexeme, escape, digits);
            }
            codePoint = codePoint * 16 + digit;
        }
        if (codePoint > Character.MAX_CODE_POINT) {
            throw new LiteralDecodeException(lexeme, "illegal Unicode character in \\" + escape + " escape");
        }
        out.appendCodePoint((int) codePoint);
        return pos + digits;
    }

    private static LiteralDecodeException truncated(String lexeme, char escape, int digits) {
        return new LiteralDecodeException(lexeme, "truncated \\" + escape + " escape, expected " + digits + " hex digits");
    }

    /**
     * Build a lexeme for the value, using the given quote character.
     * Decoding the result yields the value back.
     */
    public static String encode(String value, char quote) {
        if (!isQuote(quote)) {
            throw new IllegalArgumentException("Not a quote character: " + quote);
        }
        var out = new StringBuilder(value.length() + 2).append(quote);
        for (int i = 0; i < value.length(); i++) {
            var c = value.charAt(i);
            if (c == '\\' || c == quote) {
                out.append('\\').append(c);
            } else if (c == '\n') {
                out.append("\\n");
            } else if (c == '\r') {
                out.append("\\r");
            } else if (c == '\t') {
                out.append("\\t");
            } else if (c < 0x20 || c == 0x7F) {
                out.append(String.format("\\x%02x", (int) c));
            } else {
                out.append(c);
            }
        }
        return out.append(quote).toString();
    }
}
