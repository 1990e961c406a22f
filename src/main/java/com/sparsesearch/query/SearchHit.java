package com.sparsesearch.query;

import com.sparsesearch.config.Constants;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 单条检索结果。
 *
 * @param chunkId 由docId派生的稳定标识，形如 chunk_42
 * @param score BM25得分，原样输出，不做舍入
 * @param rank 截断排序后的零基名次
 */
public record SearchHit(
        String chunkId,
        float score,
        int rank
) {

    public static SearchHit of(int docId, float score, int rank) {
        return new SearchHit(chunkIdOf(docId), score, rank);
    }

    /**
     * docId按无符号数渲染为结果标识。
     */
    public static String chunkIdOf(int docId) {
        return Constants.CHUNK_ID_PREFIX + Integer.toUnsignedString(docId);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("chunk_id", chunkId);
        view.put("score", score);
        view.put("rank", rank);
        return view;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "SearchResult(chunk_id='%s', score=%.4f, rank=%d)", chunkId, score, rank);
    }
}
