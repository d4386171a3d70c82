package org.pragmatica.logstash.tree;

import org.junit.jupiter.api.Test;
import org.pragmatica.logstash.error.LiteralDecodeException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StringEscapesTest {

    @Test
    void decode_simpleEscapes() {
        assertThat(StringEscapes.decode("\"a\\nb\\tc\\\\d\"")).isEqualTo("a\nb\tc\\d");
        assertThat(StringEscapes.decode("'it\\'s'")).isEqualTo("it's");
        assertThat(StringEscapes.decode("\"\\a\\b\\f\\v\\r\"")).isEqualTo("\u0007\b\f\u000B\r");
    }

    @Test
    void decode_otherQuoteInside_needsNoEscape() {
        assertThat(StringEscapes.decode("'say \"hi\"'")).isEqualTo("say \"hi\"");
        assertThat(StringEscapes.decode("\"it's\"")).isEqualTo("it's");
    }

    @Test
    void decode_numericEscapes() {
        assertThat(StringEscapes.decode("\"\\101\\x42\\u0043\\U0001F600\"")).isEqualTo("ABC\uD83D\uDE00");
        assertThat(StringEscapes.decode("\"\\0\"")).isEqualTo("\u0000");
    }

    @Test
    void decode_unknownEscape_isKeptVerbatim() {
        assertThat(StringEscapes.decode("\"\\d+\\.\\w\"")).isEqualTo("\\d+\\.\\w");
    }

    @Test
    void decode_lineBreaks() {
        assertThat(StringEscapes.decode("\"one\\\ntwo\"")).isEqualTo("onetwo");
        assertThat(StringEscapes.decode("\"one\r\ntwo\"")).isEqualTo("one\ntwo");
        assertThat(StringEscapes.decode("\"one\ntwo\"")).isEqualTo("one\ntwo");
    }

    @Test
    void decode_malformed_throws() {
        assertThatThrownBy(() -> StringEscapes.decode("\"abc"))
                .isInstanceOf(LiteralDecodeException.class)
                .hasMessageContaining("mismatched quotes");
        assertThatThrownBy(() -> StringEscapes.decode("\"\\x4\""))
                .isInstanceOf(LiteralDecodeException.class)
                .hasMessageContaining("truncated \\x escape");
        assertThatThrownBy(() -> StringEscapes.decode("\"\\U00110000\""))
                .isInstanceOf(LiteralDecodeException.class)
                .hasMessageContaining("illegal Unicode character");
        assertThatThrownBy(() -> StringEscapes.decode("\"a\"b\""))
                .isInstanceOf(LiteralDecodeException.class)
                .hasMessageContaining("unescaped quote");
        assertThatThrownBy(() -> StringEscapes.decode("x"))
                .isInstanceOf(LiteralDecodeException.class);
    }

    @Test
    void encode_escapesQuoteAndControlCharacters() {
        assertThat(StringEscapes.encode("a\"b\\c\n", '"')).isEqualTo("\"a\\\"b\\\\c\\n\"");
        assertThat(StringEscapes.encode("it's \"x\"", '\'')).isEqualTo("'it\\'s \"x\"'");
        assertThat(StringEscapes.encode("\u0001", '"')).isEqualTo("\"\\x01\"");
    }

    @Test
    void encode_thenDecode_givesValueBack() {
        var value = "tab\t quote\" apostrophe' slash\\ bell\u0007 \u00e9";

        assertThat(StringEscapes.decode(StringEscapes.encode(value, '"'))).isEqualTo(value);
        assertThat(StringEscapes.decode(StringEscapes.encode(value, '\''))).isEqualTo(value);
    }
}
