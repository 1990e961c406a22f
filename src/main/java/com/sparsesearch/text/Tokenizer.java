package com.sparsesearch.text;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

public interface Tokenizer {

    /**
     * 将输入文本切分为词项列表。
     */
    List<Token> tokenize(String text);

    /**
     * 按原文顺序返回归一化词项，保留重复项。
     */
    default List<String> terms(String text) {
        List<Token> tokens = tokenize(text);
        List<String> terms = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            terms.add(token.term());
        }
        return List.copyOf(terms);
    }

    /**
     * 返回去重并按字典序排序的词项。
     */
    default List<String> uniqueTerms(String text) {
        return List.copyOf(new TreeSet<>(terms(text)));
    }
}
