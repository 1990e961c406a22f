package com.sparsesearch.text;

public record Token(
    String term,
    int position,
    int startOffset,
    int endOffset
) {
}
