package com.textsplit.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.textsplit.text.CharClassMatcher;
import com.textsplit.text.DelimiterTokenizer;
import com.textsplit.text.InvalidLimitException;
import com.textsplit.text.LiteralMatcher;
import com.textsplit.text.PatternMatcher;
import com.textsplit.text.SplitLimit;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class SplitConfigTest {

    @Test
    void testDefaults() {
        SplitConfig config = SplitConfig.defaults();

        assertNotNull(config);
        assertEquals(MatcherType.LITERAL, config.getMatcherType());
        assertEquals(",", config.getDelimiter());
        assertNull(config.getLimit());
        assertEquals("text", config.getFormat());
        assertEquals(StandardCharsets.UTF_8, config.getCharset());
        assertSame(SplitLimit.defaults(), config.toSplitLimit());
        assertInstanceOf(LiteralMatcher.class, config.toMatcher());
    }

    @Test
    void testSetters() {
        SplitConfig config = new SplitConfig();

        config.setMatcherType(MatcherType.REGEX);
        config.setDelimiter("\\|+");
        config.setLimit(2);
        config.setFormat("json");
        config.setCharset(StandardCharsets.ISO_8859_1);

        assertEquals(MatcherType.REGEX, config.getMatcherType());
        assertEquals("\\|+", config.getDelimiter());
        assertEquals(Integer.valueOf(2), config.getLimit());
        assertEquals("json", config.getFormat());
        assertEquals(StandardCharsets.ISO_8859_1, config.getCharset());
        assertInstanceOf(PatternMatcher.class, config.toMatcher());
        assertEquals(SplitLimit.bounded(2), config.toSplitLimit());
        assertEquals(List.of("a", "b||c"), DelimiterTokenizer.tokenize("a||b||c", config.toMatcher(), config.toSplitLimit()));
    }

    @Test
    void testMatcherTypes() {
        SplitConfig config = SplitConfig.defaults();

        config.setMatcherType(MatcherType.ANY_OF);
        config.setDelimiter(";,");
        assertEquals(List.of("a", "b", "c"), DelimiterTokenizer.tokenize("a;b,c", config.toMatcher()));

        config.setMatcherType(MatcherType.WHITESPACE);
        config.setDelimiter(null);
        CharClassMatcher whitespace = assertInstanceOf(CharClassMatcher.class, config.toMatcher());
        assertEquals(List.of("a", "b"), DelimiterTokenizer.tokenize("a \t b", whitespace));
    }

    @Test
    void testInvalidValues() {
        SplitConfig config = SplitConfig.defaults();

        config.setDelimiter("");
        assertThrows(IllegalArgumentException.class, config::toMatcher);

        config.setDelimiter("x".repeat(Constants.MAX_DELIMITER_LENGTH + 1));
        assertThrows(IllegalArgumentException.class, config::toMatcher);

        config.setLimit(0);
        assertThrows(InvalidLimitException.class, config::toSplitLimit);
    }
}
