package com.sparsesearch.scoring;

/**
 * 不可变的BM25评分器，绑定一次查询时刻的语料统计。
 * 全部使用单精度浮点运算。
 */
public class BM25Scorer {
    private final float k1;
    private final float b;
    private final float avgDocLength;
    private final int documentCount;

    /**
     * @param params BM25参数
     * @param avgDocLength 平均文档长度，必须为正
     * @param documentCount 文档总数，必须为正
     * @throws IllegalArgumentException 如果语料为空或平均长度非正
     */
    public BM25Scorer(BM25Params params, float avgDocLength, int documentCount) {
        if (documentCount <= 0) {
            throw new IllegalArgumentException("空语料无法评分: documentCount=" + documentCount);
        }
        if (!(avgDocLength > 0)) {
            throw new IllegalArgumentException("平均文档长度必须为正: " + avgDocLength);
        }
        this.k1 = params.k1();
        this.b = params.b();
        this.avgDocLength = avgDocLength;
        this.documentCount = documentCount;
    }

    /**
     * idf = ln((N - df + 0.5) / (df + 0.5) + 1)，加1平滑保证idf非负。
     */
    public float computeIdf(int docFrequency) {
        float n = documentCount;
        float df = docFrequency;
        return (float) Math.log((n - df + 0.5f) / (df + 0.5f) + 1.0f);
    }

    public float scoreTerm(int termFrequency, int docLength, int docFrequency) {
        float tf = termFrequency;
        float norm = 1.0f - b + b * (docLength / avgDocLength);
        float tfComponent = tf * (k1 + 1.0f) / (tf + k1 * norm);
        return computeIdf(docFrequency) * tfComponent;
    }
}
