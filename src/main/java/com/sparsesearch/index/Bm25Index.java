package com.sparsesearch.index;

import com.sparsesearch.config.EngineConfig;
import com.sparsesearch.query.SearchHit;
import com.sparsesearch.scoring.BM25Params;
import com.sparsesearch.scoring.BM25Scorer;
import com.sparsesearch.storage.PostingsCodec;
import com.sparsesearch.text.Tokenizer;
import com.sparsesearch.text.UnicodeWordTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 内存BM25倒排索引
 *
 * 写入：addDocument 分词并累计词频表；build 将每个词项的docId集合排序后压缩。
 * 查询：search 从压缩倒排中解码候选文档，按BM25累加得分后取前k个。
 *
 * 非线程安全，多线程访问请使用 {@link ConcurrentBm25Index}。
 */
public class Bm25Index {
    private static final Logger logger = LoggerFactory.getLogger(Bm25Index.class);

    private static final Comparator<ScoredDocument> RESULT_ORDER = (left, right) -> {
        int byScore = Float.compare(right.score(), left.score());
        return byScore != 0 ? byScore : Integer.compareUnsigned(left.docId(), right.docId());
    };

    private final Tokenizer tokenizer;
    private final BM25Params params;

    /** term -> (docId -> 词频) */
    private final Map<String, Map<Integer, Integer>> termFreqs = new HashMap<>();
    /** term -> Delta+VarInt压缩的docId列表，仅在 build 后有效 */
    private final Map<String, byte[]> postings = new HashMap<>();
    private final List<DocumentMeta> documents = new ArrayList<>();
    private final Map<Integer, Integer> docLengths = new HashMap<>();
    private long totalTokenCount;
    private boolean postingsFresh = true;
    /** 每个过期周期仅告警一次，读锁下可能被多个search并发访问 */
    private final AtomicBoolean staleWarningLogged = new AtomicBoolean();

    /**
     * 使用默认参数构造空索引。
     */
    public Bm25Index() {
        this(BM25Params.defaults());
    }

    public Bm25Index(BM25Params params) {
        this(params, new UnicodeWordTokenizer());
    }

    /**
     * 使用 EngineConfig 注入 BM25 参数与最小词长。
     */
    public Bm25Index(EngineConfig config) {
        this(new BM25Params(config.getBm25K1(), config.getBm25B()),
                new UnicodeWordTokenizer(config.getMinTokenLength()));
    }

    public Bm25Index(BM25Params params, Tokenizer tokenizer) {
        if (params == null || tokenizer == null) {
            throw new IllegalArgumentException("params与tokenizer不能为null");
        }
        this.params = params;
        this.tokenizer = tokenizer;
    }

    /**
     * 添加文档。同一docId重复添加时，新文本中出现的词项覆盖旧词频，不做累加。
     *
     * @param docId 外部分配的docId（按32位无符号数解释）
     * @param text 文档文本，null视为空文本
     */
    public void addDocument(int docId, String text) {
        List<String> terms = tokenizer.terms(text);

        Map<String, Integer> termCounts = new HashMap<>();
        for (String term : terms) {
            termCounts.merge(term, 1, Integer::sum);
        }

        documents.add(new DocumentMeta(docId, terms.size()));
        docLengths.put(docId, terms.size());
        totalTokenCount += terms.size();

        for (Map.Entry<String, Integer> entry : termCounts.entrySet()) {
            termFreqs.computeIfAbsent(entry.getKey(), key -> new HashMap<>())
                    .put(docId, entry.getValue());
        }
        postingsFresh = false;
    }

    /**
     * 从词频表全量重建所有词项的压缩倒排列表。
     */
    public void build() {
        postings.clear();
        long compressedBytes = 0;
        for (Map.Entry<String, Map<Integer, Integer>> entry : termFreqs.entrySet()) {
            int[] docIds = sortedDocIds(entry.getValue().keySet());
            byte[] encoded = PostingsCodec.encodePostings(docIds);
            postings.put(entry.getKey(), encoded);
            compressedBytes += encoded.length;
        }
        postingsFresh = true;
        staleWarningLogged.set(false);
        logger.debug("倒排构建完成: terms={}, docs={}, compressedBytes={}",
                postings.size(), documents.size(), compressedBytes);
    }

    /**
     * 检索前k个相关文档。
     *
     * @param query 查询文本，null或无有效词项时返回空结果
     * @param k 返回结果上限
     * @return 按得分降序、docId升序排列的结果
     * @throws IllegalArgumentException 如果k为负数
     */
    public List<SearchHit> search(String query, int k) {
        if (k < 0) {
            throw new IllegalArgumentException("k不能为负数: " + k);
        }
        List<String> queryTerms = tokenizer.terms(query);
        if (queryTerms.isEmpty() || k == 0) {
            return List.of();
        }

        Set<Integer> candidates = collectCandidates(queryTerms);
        if (candidates.isEmpty()) {
            return List.of();
        }

        BM25Scorer scorer = new BM25Scorer(params, averageDocLength(), documents.size());
        List<ScoredDocument> scored = new ArrayList<>(candidates.size());
        for (Integer docId : candidates) {
            scored.add(new ScoredDocument(docId, scoreDocument(docId, queryTerms, scorer)));
        }
        scored.sort(RESULT_ORDER);

        int limit = Math.min(k, scored.size());
        List<SearchHit> hits = new ArrayList<>(limit);
        for (int rank = 0; rank < limit; rank++) {
            ScoredDocument document = scored.get(rank);
            hits.add(SearchHit.of(document.docId(), document.score(), rank));
        }

        logger.debug("查询完成: terms={}, candidates={}, returned={}", queryTerms.size(), candidates.size(), hits.size());
        return List.copyOf(hits);
    }

    public IndexStats stats() {
        return new IndexStats(documents.size(), postings.size(), documents.isEmpty() ? 0.0f : averageDocLength());
    }

    /**
     * 解码指定词项的压缩倒排列表。仅反映最近一次 build 时的状态。
     */
    public Optional<int[]> postings(String term) {
        byte[] encoded = postings.get(term);
        return encoded == null ? Optional.empty() : Optional.of(PostingsCodec.decodePostings(encoded));
    }

    /**
     * 最近一次 build 之后是否没有新增文档。
     */
    public boolean isPostingsFresh() {
        return postingsFresh;
    }

    public int documentFrequency(String term) {
        Map<Integer, Integer> freqs = termFreqs.get(term);
        return freqs == null ? 0 : freqs.size();
    }

    public List<DocumentMeta> documents() {
        return List.copyOf(documents);
    }

    private Set<Integer> collectCandidates(List<String> queryTerms) {
        if (!postingsFresh && staleWarningLogged.compareAndSet(false, true)) {
            logger.warn("压缩倒排已过期，改用词频表收集候选文档；请在添加文档后调用 build()");
        }
        Set<Integer> candidates = new HashSet<>();
        for (String term : new LinkedHashSet<>(queryTerms)) {
            if (postingsFresh) {
                byte[] encoded = postings.get(term);
                if (encoded == null) {
                    continue;
                }
                for (int docId : PostingsCodec.decodePostings(encoded)) {
                    candidates.add(docId);
                }
            } else {
                Map<Integer, Integer> freqs = termFreqs.get(term);
                if (freqs != null) {
                    candidates.addAll(freqs.keySet());
                }
            }
        }
        return candidates;
    }

    private float scoreDocument(int docId, List<String> queryTerms, BM25Scorer scorer) {
        int docLength = docLengths.get(docId);
        float score = 0.0f;
        for (String term : queryTerms) {
            Map<Integer, Integer> freqs = termFreqs.get(term);
            if (freqs == null) {
                continue;
            }
            Integer termFrequency = freqs.get(docId);
            if (termFrequency != null) {
                score += scorer.scoreTerm(termFrequency, docLength, freqs.size());
            }
        }
        return score;
    }

    private float averageDocLength() {
        return (float) totalTokenCount / (float) documents.size();
    }

    private static int[] sortedDocIds(Set<Integer> docIds) {
        return docIds.stream()
                .sorted(Integer::compareUnsigned)
                .mapToInt(Integer::intValue)
                .toArray();
    }

    private record ScoredDocument(int docId, float score) {
    }
}
