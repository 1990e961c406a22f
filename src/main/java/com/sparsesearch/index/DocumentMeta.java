package com.sparsesearch.index;

/**
 * 文档元数据。
 *
 * @param docId 外部分配的docId（按32位无符号数解释）
 * @param docLength 过滤后的词项数，重复词项计入
 */
public record DocumentMeta(int docId, int docLength) {
}
