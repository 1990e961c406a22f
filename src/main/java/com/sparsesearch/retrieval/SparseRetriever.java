package com.sparsesearch.retrieval;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sparsesearch.config.Constants;
import com.sparsesearch.config.EngineConfig;
import com.sparsesearch.index.Bm25Index;
import com.sparsesearch.index.IndexStats;
import com.sparsesearch.query.SearchHit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 基于BM25的稀疏检索器
 *
 * 从索引目录下的 bm25_metadata.json 读取参数与文档，构建内存索引后提供检索。
 */
public class SparseRetriever {
    private static final Logger logger = LoggerFactory.getLogger(SparseRetriever.class);

    private final Path indexDir;
    private final Bm25Index index;
    private final int defaultTopK;

    public SparseRetriever(Path indexDir) throws IOException {
        this(indexDir, EngineConfig.defaults());
    }

    /**
     * 元数据中的 k1、b 优先于 config 中的值。
     *
     * @throws FileNotFoundException 如果元数据文件不存在
     * @throws IOException 如果元数据无法解析
     */
    public SparseRetriever(Path indexDir, EngineConfig config) throws IOException {
        this.indexDir = indexDir;
        this.defaultTopK = config.getDefaultTopK();

        Path metadataPath = indexDir.resolve(Constants.BM25_METADATA_FILE);
        if (!Files.isRegularFile(metadataPath)) {
            throw new FileNotFoundException("BM25 metadata not found: " + metadataPath);
        }
        Bm25Metadata metadata = new ObjectMapper().readValue(metadataPath.toFile(), Bm25Metadata.class);

        EngineConfig effectiveConfig = new EngineConfig();
        effectiveConfig.setBm25K1(metadata.k1() != null ? metadata.k1() : config.getBm25K1());
        effectiveConfig.setBm25B(metadata.b() != null ? metadata.b() : config.getBm25B());
        effectiveConfig.setMinTokenLength(config.getMinTokenLength());
        this.index = new Bm25Index(effectiveConfig);

        for (Bm25Metadata.Doc doc : metadata.docs()) {
            index.addDocument(toDocId(doc.docId(), metadataPath), doc.text());
        }
        index.build();

        IndexStats stats = index.stats();
        logger.info("BM25索引已加载: {} - docs={}, terms={}", metadataPath, stats.numDocs(), stats.numTerms());
    }

    public List<Map<String, Object>> search(String query) {
        return search(query, defaultTopK);
    }

    /**
     * @return 每条结果包含 chunk_id、score、rank
     */
    public List<Map<String, Object>> search(String query, int k) {
        List<SearchHit> hits = index.search(query, k);
        List<Map<String, Object>> results = new ArrayList<>(hits.size());
        for (SearchHit hit : hits) {
            results.add(hit.toMap());
        }
        return results;
    }

    public IndexStats stats() {
        return index.stats();
    }

    public Path getIndexDir() {
        return indexDir;
    }

    private static int toDocId(Long rawDocId, Path metadataPath) throws IOException {
        if (rawDocId == null) {
            throw new IOException("文档缺少doc_id (" + metadataPath + ")");
        }
        if (rawDocId < 0 || rawDocId > 0xFFFF_FFFFL) {
            throw new IOException("doc_id超出32位无符号范围: " + rawDocId + " (" + metadataPath + ")");
        }
        return (int) rawDocId.longValue();
    }
}
