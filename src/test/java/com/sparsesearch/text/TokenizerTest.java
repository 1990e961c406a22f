package com.sparsesearch.text;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenizerTest {

    @Test
    @DisplayName("UnicodeWordTokenizer: 基本分词与小写归一化")
    void testBasicTokenization() {
        UnicodeWordTokenizer tokenizer = new UnicodeWordTokenizer();

        List<String> terms = tokenizer.terms("Hello World! This is a test.");

        assertEquals(List.of("hello", "world", "this", "is", "test"), terms);
    }

    @Test
    @DisplayName("UnicodeWordTokenizer: 位置与偏移正确")
    void testPositionsAndOffsets() {
        UnicodeWordTokenizer tokenizer = new UnicodeWordTokenizer();

        List<Token> tokens = tokenizer.tokenize("Hello World! This is a test.");

        assertEquals(5, tokens.size());
        assertToken(tokens.get(0), "hello", 0, 0, 5);
        assertToken(tokens.get(1), "world", 1, 6, 11);
        assertToken(tokens.get(2), "this", 2, 13, 17);
        assertToken(tokens.get(3), "is", 3, 18, 20);
        assertToken(tokens.get(4), "test", 4, 23, 27);
    }

    @Test
    @DisplayName("UnicodeWordTokenizer: 自定义最小词长")
    void testMinLength() {
        UnicodeWordTokenizer tokenizer = new UnicodeWordTokenizer(3);

        assertEquals(List.of("ccc", "dddd"), tokenizer.terms("a bb ccc dddd"));
    }

    @Test
    @DisplayName("UnicodeWordTokenizer: 非ASCII字母保持完整")
    void testUnicodeWords() {
        UnicodeWordTokenizer tokenizer = new UnicodeWordTokenizer();

        assertEquals(List.of("café", "résumé", "naïve"), tokenizer.terms("Café résumé naïve"));
        assertEquals(List.of("école", "αβγ"), tokenizer.terms("ÉCOLE ΑΒΓ"));
    }

    @Test
    @DisplayName("UnicodeWordTokenizer: 标点分隔而非仅按空白切分")
    void testPunctuationBoundaries() {
        UnicodeWordTokenizer tokenizer = new UnicodeWordTokenizer();

        assertEquals(List.of("rust", "python", "java"), tokenizer.terms("rust,python;java"));
        assertEquals(List.of("search", "engine"), tokenizer.terms("(search)-[engine]"));
    }

    @Test
    @DisplayName("UnicodeWordTokenizer: 连字符两侧切分为独立词项")
    void testHyphenatedWords() {
        UnicodeWordTokenizer tokenizer = new UnicodeWordTokenizer();

        assertEquals(List.of("state", "of", "the", "art"), tokenizer.terms("state-of-the-art"));
        assertEquals(List.of("rust", "lang", "well", "known"), tokenizer.terms("rust-lang well-known"));
        assertEquals(List.of("mail"), tokenizer.terms("e-mail"));
    }

    @Test
    @DisplayName("UnicodeWordTokenizer: CJK表意文字逐字切分")
    void testIdeographsSplitPerCharacter() {
        UnicodeWordTokenizer tokenizer = new UnicodeWordTokenizer();

        List<Token> tokens = tokenizer.tokenize("中文搜索引擎");

        assertEquals(List.of("中", "文", "搜", "索", "引", "擎"), tokenizer.terms("中文搜索引擎"));
        assertToken(tokens.get(2), "搜", 2, 2, 3);
    }

    @Test
    @DisplayName("UnicodeWordTokenizer: 最小词长按UTF-8字节计算")
    void testMinLengthCountsUtf8Bytes() {
        UnicodeWordTokenizer tokenizer = new UnicodeWordTokenizer();

        assertEquals(List.of("é", "ü", "中"), tokenizer.terms("é ü 中 x"));
        assertEquals(List.of("中"), new UnicodeWordTokenizer(3).terms("é 中"));
    }

    @Test
    @DisplayName("UnicodeWordTokenizer: 数字作为词项，单字符被过滤")
    void testDigits() {
        UnicodeWordTokenizer tokenizer = new UnicodeWordTokenizer();

        assertEquals(List.of("version", "42", "of"), tokenizer.terms("version 42 of 7"));
    }

    @Test
    @DisplayName("UnicodeWordTokenizer: 保留重复词项与顺序")
    void testDuplicatesPreserved() {
        UnicodeWordTokenizer tokenizer = new UnicodeWordTokenizer();

        assertEquals(List.of("the", "cat", "the", "hat"), tokenizer.terms("The cat, the hat"));
    }

    @Test
    @DisplayName("uniqueTerms: 去重并排序")
    void testUniqueTerms() {
        UnicodeWordTokenizer tokenizer = new UnicodeWordTokenizer();

        List<String> terms = tokenizer.uniqueTerms("the quick brown fox jumps over the lazy dog");

        assertEquals(List.of("brown", "dog", "fox", "jumps", "lazy", "over", "quick", "the"), terms);
    }

    @Test
    @DisplayName("UnicodeWordTokenizer: 边界情况")
    void testEdgeCases() {
        UnicodeWordTokenizer tokenizer = new UnicodeWordTokenizer();

        assertTrue(tokenizer.tokenize(null).isEmpty());
        assertTrue(tokenizer.tokenize("").isEmpty());
        assertTrue(tokenizer.tokenize("...,,,!!!   ").isEmpty());
        assertTrue(tokenizer.uniqueTerms("").isEmpty());
        assertEquals(List.of("hi", "there"), tokenizer.terms("hi 👋🏽 there"));
    }

    @Test
    @DisplayName("UnicodeWordTokenizer: 非法最小词长")
    void testInvalidMinLength() {
        assertThrows(IllegalArgumentException.class, () -> new UnicodeWordTokenizer(0));
    }

    private void assertToken(Token token, String term, int position, int startOffset, int endOffset) {
        assertEquals(term, token.term());
        assertEquals(position, token.position());
        assertEquals(startOffset, token.startOffset());
        assertEquals(endOffset, token.endOffset());
    }
}
