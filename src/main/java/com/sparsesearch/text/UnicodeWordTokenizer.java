package com.sparsesearch.text;

import com.sparsesearch.config.Constants;
import org.apache.lucene.analysis.standard.StandardTokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.tokenattributes.OffsetAttribute;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 基于Unicode词边界的分词器
 *
 * 处理流程：按UAX #29词边界切分（Lucene StandardTokenizer）→ 丢弃不含字母或数字的片段（如emoji）
 * → 小写归一化 → 丢弃UTF-8字节数小于最小长度的词项。
 * 连字符两侧视为不同词，CJK表意文字逐字成词。不做词干提取，也不过滤停用词。
 */
public class UnicodeWordTokenizer implements Tokenizer {

    private final int minLength;

    /**
     * 使用默认最小长度创建分词器。
     */
    public UnicodeWordTokenizer() {
        this(Constants.MIN_TOKEN_LENGTH);
    }

    /**
     * 使用指定最小长度创建分词器。
     *
     * @param minLength 词项最小UTF-8字节数（至少为1）
     * @throws IllegalArgumentException 如果minLength小于1
     */
    public UnicodeWordTokenizer(int minLength) {
        if (minLength < 1) {
            throw new IllegalArgumentException("最小词长必须为正数: " + minLength);
        }
        this.minLength = minLength;
    }

    /**
     * 对文本分词，输出词项、序号与原文偏移。
     */
    @Override
    public List<Token> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<Token> tokens = new ArrayList<>();
        try (StandardTokenizer wordBoundary = new StandardTokenizer()) {
            wordBoundary.setMaxTokenLength(StandardTokenizer.MAX_TOKEN_LENGTH_LIMIT);
            CharTermAttribute termAttribute = wordBoundary.addAttribute(CharTermAttribute.class);
            OffsetAttribute offsetAttribute = wordBoundary.addAttribute(OffsetAttribute.class);
            wordBoundary.setReader(new StringReader(text));
            wordBoundary.reset();

            int nextPosition = 0;
            while (wordBoundary.incrementToken()) {
                nextPosition = appendTokenIfValid(termAttribute.toString(),
                        offsetAttribute.startOffset(), offsetAttribute.endOffset(), nextPosition, tokens);
            }
            wordBoundary.end();
        } catch (IOException e) {
            throw new UncheckedIOException("分词失败: " + e.getMessage(), e);
        }

        return List.copyOf(tokens);
    }

    /**
     * 校验并追加有效词项，返回更新后的下一个位置序号。
     */
    private int appendTokenIfValid(String segment, int startOffset, int endOffset, int position, List<Token> tokens) {
        if (!containsWordCharacter(segment)) {
            return position;
        }

        String normalizedTerm = segment.toLowerCase(Locale.ROOT);
        if (normalizedTerm.getBytes(StandardCharsets.UTF_8).length < minLength) {
            return position;
        }

        tokens.add(new Token(normalizedTerm, position, startOffset, endOffset));
        return position + 1;
    }

    private boolean containsWordCharacter(String segment) {
        int index = 0;
        while (index < segment.length()) {
            int codePoint = segment.codePointAt(index);
            if (Character.isLetterOrDigit(codePoint)) {
                return true;
            }
            index += Character.charCount(codePoint);
        }
        return false;
    }
}
