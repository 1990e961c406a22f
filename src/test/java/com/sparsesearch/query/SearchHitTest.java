package com.sparsesearch.query;

import com.sparsesearch.index.IndexStats;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SearchHitTest {

    @Test
    void testChunkIdUsesUnsignedDocId() {
        assertEquals("chunk_0", SearchHit.chunkIdOf(0));
        assertEquals("chunk_42", SearchHit.of(42, 1.0f, 0).chunkId());
        assertEquals("chunk_4294967295", SearchHit.chunkIdOf(-1));
    }

    @Test
    void testToMapKeepsScoreUnrounded() {
        SearchHit hit = SearchHit.of(1, 0.123456789f, 0);

        Map<String, Object> view = hit.toMap();

        assertEquals(List.of("chunk_id", "score", "rank"), List.copyOf(view.keySet()));
        assertEquals("chunk_1", view.get("chunk_id"));
        assertEquals(0.123456789f, view.get("score"));
        assertEquals(0, view.get("rank"));
    }

    @Test
    void testToString() {
        assertEquals("SearchResult(chunk_id='chunk_3', score=1.5000, rank=2)",
            SearchHit.of(3, 1.5f, 2).toString());
    }

    @Test
    void testIndexStatsViews() {
        IndexStats stats = new IndexStats(2, 5, 3.5f);

        assertEquals("BM25Index(num_docs=2, num_terms=5, avg_doc_len=3.50)", stats.toString());
        assertEquals(Map.of("num_docs", 2, "num_terms", 5, "avg_doc_len", 3.5f), stats.toMap());
    }
}
