package org.pragmatica.logstash.tree;

import org.junit.jupiter.api.Test;
import org.pragmatica.logstash.error.LiteralDecodeException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LiteralTest {

    @Test
    void quotedString_of_buildsDoubleQuotedLexeme() {
        var string = Literal.QuotedString.of("say \"hi\"");

        assertEquals("\"say \\\"hi\\\"\"", string.lexeme());
        assertEquals("say \"hi\"", string.value());
        assertEquals('"', string.quote());
    }

    @Test
    void quotedString_parse_keepsSingleQuotes() {
        var string = Literal.QuotedString.parse("'abc'");

        assertEquals('\'', string.quote());
        assertEquals("'abc'", string.toSource());
    }

    @Test
    void quotedString_mismatchedValue_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Literal.QuotedString("\"a\"", "b", Optional.empty()));
        assertThrows(LiteralDecodeException.class, () -> Literal.QuotedString.parse("\"\\x\""));
    }

    @Test
    void numeric_normalizesValueTypes() {
        assertEquals(5L, Literal.Numeric.of(5).value());
        assertEquals(5L, Literal.Numeric.of(Integer.valueOf(5)).value());
        assertEquals(7L, Literal.Numeric.of(BigInteger.valueOf(7)).value());
        assertEquals(1.5, Literal.Numeric.of(new BigDecimal("1.5")).value());
        assertEquals(2.5, Literal.Numeric.of(2.5f).value());
    }

    @Test
    void numeric_programmaticDouble_hasFractionAndNoExponent() {
        assertEquals("3.0", Literal.Numeric.of(3.0).lexeme());
        assertEquals("10000000000000000000000.0", Literal.Numeric.of(1e22).lexeme());
        assertEquals("0.0001", Literal.Numeric.of(0.0001).lexeme());
    }

    @Test
    void numeric_integerNeverGainsFraction() {
        var parsed = Literal.Numeric.parse("42");

        assertTrue(parsed.isIntegral());
        assertEquals("42", parsed.toSource());
        assertEquals("42", parsed.canonicalText());
    }

    @Test
    void numeric_canonicalText_ignoresTrailingZeros() {
        assertEquals("1.5", Literal.Numeric.parse("1.50").canonicalText());
        assertEquals("1.50", Literal.Numeric.parse("1.50").lexeme());
    }

    @Test
    void numeric_invalidInput_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> Literal.Numeric.of(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> Literal.Numeric.of(Double.POSITIVE_INFINITY));
        assertThrows(LiteralDecodeException.class, () -> Literal.Numeric.parse("1e5"));
    }

    @Test
    void regex_stripsDelimitersOnce() {
        assertEquals("abc", new Literal.Regex("/abc/").pattern());
        assertEquals("abc", new Literal.Regex("abc").pattern());
        assertEquals("\\/var\\/log\\/.*", new Literal.Regex("/\\/var\\/log\\/.*/").pattern());
        assertEquals("/\\/var\\/log\\/.*/", new Literal.Regex("\\/var\\/log\\/.*").toSource());
    }

    @Test
    void regex_bareSlash_isEscaped() {
        assertEquals("a\\/b", new Literal.Regex("a/b").pattern());
    }

    @Test
    void selector_validatesShape() {
        assertEquals("[a][b]", new Literal.Selector("[a][b]").raw());
        assertThrows(IllegalArgumentException.class, () -> new Literal.Selector("a"));
        assertThrows(IllegalArgumentException.class, () -> new Literal.Selector("[]"));
    }

    @Test
    void bool_rendersLowercase() {
        assertEquals("true", new Literal.Bool(true).toSource());
        assertEquals("false", new Literal.Bool(false).toSource());
    }
}
