package com.sparsesearch.scoring;

import com.sparsesearch.config.Constants;

/**
 * BM25参数。
 *
 * @param k1 词频饱和系数，非负
 * @param b 长度归一化系数，取值[0, 1]
 */
public record BM25Params(float k1, float b) {

    public BM25Params {
        if (!Float.isFinite(k1) || k1 < 0) {
            throw new IllegalArgumentException("k1必须为非负有限数: " + k1);
        }
        if (!Float.isFinite(b) || b < 0 || b > 1) {
            throw new IllegalArgumentException("b必须位于[0, 1]区间: " + b);
        }
    }

    /**
     * 默认参数：k1=1.5，b=0.75。
     */
    public static BM25Params defaults() {
        return new BM25Params(Constants.BM25_K1, Constants.BM25_B);
    }
}
