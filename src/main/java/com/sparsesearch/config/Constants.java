package com.sparsesearch.config;

/**
 * 全局常量定义
 * 
 * 包含BM25参数、分词参数、查询参数和倒排编码参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }
    
    // ==================== BM25参数 ====================
    /** 词频饱和系数 */
    public static final float BM25_K1 = 1.5f;
    /** 长度归一化系数 */
    public static final float BM25_B = 0.75f;
    
    // ==================== 分词参数 ====================
    /** 词项最小长度（按UTF-8字节计），短于此长度的词项被丢弃 */
    public static final int MIN_TOKEN_LENGTH = 2;
    
    // ==================== 查询参数 ====================
    /** 默认返回结果数 */
    public static final int DEFAULT_TOP_K = 10;
    /** 对外结果标识前缀 */
    public static final String CHUNK_ID_PREFIX = "chunk_";
    
    // ==================== 编码参数 ====================
    /** 32位VarInt最多占用的字节数 */
    public static final int MAX_VARINT_BYTES = 5;
    
    // ==================== 检索器参数 ====================
    /** 稀疏检索器元数据文件名 */
    public static final String BM25_METADATA_FILE = "bm25_metadata.json";
}
