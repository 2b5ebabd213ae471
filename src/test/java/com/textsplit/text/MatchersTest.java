package com.textsplit.text;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.PatternSyntaxException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MatchersTest {

    @Test
    @DisplayName("LiteralMatcher: 多字符分隔符")
    void testLiteralMultiChar() {
        assertEquals(List.of("a", "b", ":c"), DelimiterTokenizer.tokenize("a::b:::c", Matchers.literal("::")));
    }

    @Test
    @DisplayName("LiteralMatcher: 查找区间")
    void testLiteralFind() {
        LiteralMatcher matcher = new LiteralMatcher("--");
        assertEquals("--", matcher.getDelimiter());

        assertEquals(MatchResult.found(1, 3), matcher.find("a--b--c", 0));
        assertEquals(MatchResult.found(4, 6), matcher.find("a--b--c", 3));
        assertSame(MatchResult.notFound(), matcher.find("a--b--c", 6));
        assertSame(MatchResult.notFound(), matcher.find("a--b--c", 7));
    }

    @Test
    @DisplayName("LiteralMatcher: 空分隔符非法")
    void testLiteralRejectsEmpty() {
        assertThrows(IllegalArgumentException.class, () -> Matchers.literal(""));
        assertThrows(IllegalArgumentException.class, () -> new LiteralMatcher(null));
    }

    @Test
    @DisplayName("CharClassMatcher: 单字符与连续模式")
    void testCharClassFind() {
        CharClassMatcher single = CharClassMatcher.of("-", false);
        CharClassMatcher run = CharClassMatcher.of("-", true);

        assertEquals(MatchResult.found(1, 2), single.find("a--b", 0));
        assertEquals(MatchResult.found(1, 3), run.find("a--b", 0));
        assertSame(MatchResult.notFound(), run.find("a--b", 3));
        assertFalse(single.isRun());
        assertTrue(run.isRun());
    }

    @Test
    @DisplayName("CharClassMatcher: 字符集合切分日期")
    void testAnyOf() {
        assertEquals(List.of("2013", "04", "05", "14:39"),
            DelimiterTokenizer.tokenize("2013-04-05 14:39", Matchers.anyOf("- ")));
        assertEquals(List.of("a", "", "b"), DelimiterTokenizer.tokenize("a,,b", Matchers.anyOf(",")));
    }

    @Test
    @DisplayName("CharClassMatcher: 连续字符合并")
    void testAnyRunOf() {
        assertEquals(List.of("a", "b", "c"), DelimiterTokenizer.tokenize("a, b,,c", Matchers.anyRunOf(", ")));
    }

    @Test
    @DisplayName("CharClassMatcher: 各类空白")
    void testWhitespaceRunMixedWhitespace() {
        assertEquals(List.of("", "a", "b", "c"),
            DelimiterTokenizer.tokenize("\t a \n\tb\r\nc  ", Matchers.whitespaceRun()));
    }

    @Test
    @DisplayName("CharClassMatcher: 空字符集合非法")
    void testCharClassRejectsEmpty() {
        assertThrows(IllegalArgumentException.class, () -> Matchers.anyOf(""));
        assertThrows(IllegalArgumentException.class, () -> new CharClassMatcher(null, true));
    }

    @Test
    @DisplayName("PatternMatcher: 正则分隔符")
    void testRegex() {
        assertEquals(List.of("a", "b", "c"), DelimiterTokenizer.tokenize("a , b,c", Matchers.regex("\\s*,\\s*")));
    }

    @Test
    @DisplayName("PatternMatcher: 跳过游标处空匹配")
    void testRegexSkipsEmptyMatchAtOffset() {
        assertEquals(List.of("a", "b", "c"), DelimiterTokenizer.tokenize("axbxxc", Matchers.regex("x*")));
        assertEquals(List.of("a", "b", "c"), DelimiterTokenizer.tokenize("abc", Matchers.regex("")));
    }

    @Test
    @DisplayName("PatternMatcher: 末尾返回未命中")
    void testRegexAtEnd() {
        PatternMatcher matcher = new PatternMatcher("x*");
        assertEquals("x*", matcher.getPattern().pattern());

        assertSame(MatchResult.notFound(), matcher.find("abc", 3));
        assertSame(MatchResult.notFound(), matcher.find("", 0));
    }

    @Test
    @DisplayName("PatternMatcher: 非法正则")
    void testRegexSyntaxError() {
        assertThrows(PatternSyntaxException.class, () -> Matchers.regex("("));
    }
}
