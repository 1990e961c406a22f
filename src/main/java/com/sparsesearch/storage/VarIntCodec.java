package com.sparsesearch.storage;

import com.sparsesearch.config.Constants;

import java.nio.ByteBuffer;

/**
 * VarInt变长整数编解码器
 * 
 * 编码规则：小端序，每字节7位有效数据，最高位为续接标志
 * - 最高位为1：表示后续还有字节
 * - 最高位为0：表示这是最后一个字节
 * 
 * 所有int值均按32位无符号数处理，因此最多占用5个字节。
 */
public final class VarIntCodec {
    
    private VarIntCodec() {
        // 工具类，禁止实例化
    }
    
    /**
     * 将无符号int值编码为独立的VarInt字节数组
     * 
     * @param value 要编码的值（按无符号解释）
     * @return 编码结果，长度1~5
     */
    public static byte[] encode(int value) {
        ByteBuffer buf = ByteBuffer.allocate(varIntSize(value));
        writeVarInt(value, buf);
        return buf.array();
    }
    
    /**
     * 解码一个完整的VarInt字节数组
     * 
     * @param bytes 恰好包含一个VarInt的字节数组
     * @return 解码后的值（按无符号解释）
     * @throws CorruptDataException 如果数据截断、超过5字节、超出32位或存在多余字节
     */
    public static int decode(byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("输入数组不能为null");
        }
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        int value = readVarInt(buf);
        if (buf.hasRemaining()) {
            throw new CorruptDataException("VarInt之后存在多余字节", buf.position());
        }
        return value;
    }
    
    /**
     * 将无符号int值编码为VarInt并写入ByteBuffer
     * 
     * @param value 要编码的值（按无符号解释）
     * @param buf 字节缓冲区
     */
    public static void writeVarInt(int value, ByteBuffer buf) {
        // 循环处理，每次取7位
        while ((value & ~0x7F) != 0) {
            // 还有后续字节：当前字节最高位置1
            buf.put((byte) ((value & 0x7F) | 0x80));
            value >>>= 7;
        }
        // 最后一个字节：最高位置0
        buf.put((byte) (value & 0x7F));
    }
    
    /**
     * 从ByteBuffer读取VarInt并解码为无符号int
     * 
     * @param buf 字节缓冲区
     * @return 解码后的值
     * @throws CorruptDataException 如果VarInt被截断、超过5字节或超出32位范围
     */
    public static int readVarInt(ByteBuffer buf) {
        int startOffset = buf.position();
        int result = 0;
        int shift = 0;
        
        for (int byteIndex = 0; byteIndex < Constants.MAX_VARINT_BYTES; byteIndex++) {
            if (!buf.hasRemaining()) {
                throw new CorruptDataException("VarInt在字节流末尾被截断", startOffset);
            }
            
            int b = buf.get() & 0xFF;
            boolean lastByte = (b & 0x80) == 0;
            
            // 第5字节只剩4位有效载荷
            if (byteIndex == Constants.MAX_VARINT_BYTES - 1 && lastByte && (b & 0x70) != 0) {
                throw new CorruptDataException("VarInt超过32位范围", startOffset);
            }
            
            result |= (b & 0x7F) << shift;
            if (lastByte) {
                return result;
            }
            
            shift += 7;
        }
        
        throw new CorruptDataException("VarInt续接字节超过" + Constants.MAX_VARINT_BYTES + "个", startOffset);
    }
    
    /**
     * 计算无符号int值编码为VarInt所需的字节数
     * 
     * @param value 要编码的值（按无符号解释）
     * @return 所需字节数
     */
    public static int varIntSize(int value) {
        int size = 1;
        while ((value & ~0x7F) != 0) {
            size++;
            value >>>= 7;
        }
        return size;
    }
}
