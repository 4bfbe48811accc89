package com.bit.reputation.common;

/**
 * 哈希链摘要（32字节）：N 个事件之后的累计链状态
 */
public class Digest extends ByteHash32 {
    private static final long serialVersionUID = 1L;

    /**
     * 空链的规范摘要（全0）
     */
    public static final Digest ZERO = new Digest(new byte[HASH_LENGTH]);

    private Digest(byte[] value) {
        super(value);
    }

    /**
     * 从字节数组创建Digest实例
     * @param bytes 32字节原始摘要
     */
    public static Digest fromBytes(byte[] bytes) {
        return new Digest(bytes);
    }

    /**
     * 从十六进制字符串创建Digest实例
     * @param hex 64位十六进制字符串（可带0x前缀）
     */
    public static Digest fromHex(String hex) {
        return new Digest(hexToBytes32(hex));
    }
}
