package com.sparsesearch.storage;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * 倒排列表编解码器
 * 
 * 用于压缩严格递增的docId序列。
 * 原理：首个docId记为相对0的差值，其余docId记为相对前一个的差值（delta），
 * 再逐个写成VarInt。docId密集时delta很小，通常每个只占1字节。
 * 
 * 示例：[10, 15, 20, 25] -> deltas [10, 5, 5, 5] -> 4字节
 * 
 * docId按32位无符号数排序与计算。
 */
public final class PostingsCodec {
    
    private PostingsCodec() {
        // 工具类，禁止实例化
    }
    
    /**
     * 对严格递增的docId序列执行Delta+VarInt编码
     * 
     * @param sortedDocIds 按无符号升序排列且无重复的docId
     * @return 编码后的字节数组
     * @throws IllegalArgumentException 如果输入为null、非严格递增或含重复
     */
    public static byte[] encodePostings(int[] sortedDocIds) {
        int size = encodedSize(sortedDocIds);
        ByteBuffer buf = ByteBuffer.allocate(size);
        
        int previous = 0;
        for (int docId : sortedDocIds) {
            VarIntCodec.writeVarInt(docId - previous, buf);
            previous = docId;
        }
        
        return buf.array();
    }
    
    /**
     * 解码Delta+VarInt编码的倒排列表，直到字节流耗尽
     * 
     * 任何损坏都会以异常形式抛出，不会返回被截断的结果。
     * 
     * @param data 编码后的字节数组
     * @return 还原后的docId序列
     * @throws CorruptDataException 如果VarInt损坏、前缀和溢出32位或出现重复docId
     */
    public static int[] decodePostings(byte[] data) {
        if (data == null) {
            throw new IllegalArgumentException("输入数组不能为null");
        }
        
        // 每个docId至少占1字节
        int[] docIds = new int[data.length];
        int count = 0;
        long previous = 0;
        
        ByteBuffer buf = ByteBuffer.wrap(data);
        while (buf.hasRemaining()) {
            int deltaOffset = buf.position();
            long delta = Integer.toUnsignedLong(VarIntCodec.readVarInt(buf));
            if (count > 0 && delta == 0) {
                throw new CorruptDataException("倒排列表出现重复docId", deltaOffset);
            }
            long current = previous + delta;
            if (current > 0xFFFF_FFFFL) {
                throw new CorruptDataException("docId前缀和超出32位范围", deltaOffset);
            }
            docIds[count++] = (int) current;
            previous = current;
        }
        
        return Arrays.copyOf(docIds, count);
    }
    
    /**
     * 计算Delta+VarInt编码后的精确字节数，同时校验输入前置条件
     * 
     * @param sortedDocIds 按无符号升序排列且无重复的docId
     * @return 编码大小（字节）
     * @throws IllegalArgumentException 如果输入为null、非严格递增或含重复
     */
    public static int encodedSize(int[] sortedDocIds) {
        if (sortedDocIds == null) {
            throw new IllegalArgumentException("输入数组不能为null");
        }
        
        int size = 0;
        int previous = 0;
        for (int i = 0; i < sortedDocIds.length; i++) {
            int docId = sortedDocIds[i];
            if (i > 0 && Integer.compareUnsigned(docId, previous) <= 0) {
                throw new IllegalArgumentException(
                    "输入必须是严格递增且无重复的docId序列，在位置 " + i + " 处违反: "
                        + Integer.toUnsignedString(previous) + " -> " + Integer.toUnsignedString(docId)
                );
            }
            size += VarIntCodec.varIntSize(docId - previous);
            previous = docId;
        }
        return size;
    }
}
