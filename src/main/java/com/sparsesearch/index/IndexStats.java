package com.sparsesearch.index;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 索引统计快照，每次调用 stats() 时重新计算。
 *
 * @param numDocs 已记录的文档数
 * @param numTerms 已构建压缩倒排的词项数
 * @param avgDocLength 平均文档长度，无文档时为0
 */
public record IndexStats(int numDocs, int numTerms, float avgDocLength) {

    public Map<String, Object> toMap() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("num_docs", numDocs);
        view.put("num_terms", numTerms);
        view.put("avg_doc_len", avgDocLength);
        return view;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "BM25Index(num_docs=%d, num_terms=%d, avg_doc_len=%.2f)",
                numDocs, numTerms, avgDocLength);
    }
}
