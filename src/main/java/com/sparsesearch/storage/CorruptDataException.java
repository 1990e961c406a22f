package com.sparsesearch.storage;

/**
 * 编码数据损坏异常，在解码VarInt或倒排列表失败时抛出。
 */
public class CorruptDataException extends RuntimeException {
    private final int offset;

    public CorruptDataException(String message, int offset) {
        super(message + " (offset=" + offset + ")");
        this.offset = offset;
    }

    /**
     * 出错VarInt在字节流中的起始偏移。
     */
    public int getOffset() {
        return offset;
    }
}
