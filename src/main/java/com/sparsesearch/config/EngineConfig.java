package com.sparsesearch.config;

/**
 * 引擎运行时配置
 * 
 * 支持由调用方或元数据文件注入，覆盖Constants默认值
 */
public class EngineConfig {
    private float bm25K1 = Constants.BM25_K1;
    private float bm25B = Constants.BM25_B;
    private int minTokenLength = Constants.MIN_TOKEN_LENGTH;
    private int defaultTopK = Constants.DEFAULT_TOP_K;
    
    public float getBm25K1() {
        return bm25K1;
    }
    
    public void setBm25K1(float bm25K1) {
        this.bm25K1 = bm25K1;
    }
    
    public float getBm25B() {
        return bm25B;
    }
    
    public void setBm25B(float bm25B) {
        this.bm25B = bm25B;
    }
    
    public int getMinTokenLength() {
        return minTokenLength;
    }
    
    public void setMinTokenLength(int minTokenLength) {
        this.minTokenLength = minTokenLength;
    }
    
    public int getDefaultTopK() {
        return defaultTopK;
    }
    
    public void setDefaultTopK(int defaultTopK) {
        this.defaultTopK = defaultTopK;
    }
    
    /**
     * 使用默认配置创建实例
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }
}
