package com.sparsesearch.retrieval;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * bm25_metadata.json 的结构：可选的 k1、b 以及待索引文档列表。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Bm25Metadata(
        @JsonProperty("k1") Float k1,
        @JsonProperty("b") Float b,
        @JsonProperty("docs") List<Doc> docs
) {

    public Bm25Metadata {
        docs = docs == null ? List.of() : List.copyOf(docs);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Doc(
            @JsonProperty("doc_id") Long docId,
            @JsonProperty("text") String text
    ) {
    }
}
