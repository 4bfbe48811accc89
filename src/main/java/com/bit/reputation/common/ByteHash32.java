package com.bit.reputation.common;

import com.bit.reputation.util.ByteUtils;
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;
import java.util.Arrays;

/**
 * 32字节值的通用基类，封装共同逻辑（长度校验、不可变性、十六进制转换）
 * 具体类型（如链摘要）继承此类
 */
public abstract class ByteHash32 implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final int HASH_LENGTH = 32;

    // 存储32字节数据（私有且不可变）
    private final byte[] value;
    // 缓存十六进制字符串（避免重复计算）
    private final String hexValue;

    /**
     * 构造方法，由子类调用，强制校验长度
     * @param value 32字节原始数据
     * @throws IllegalArgumentException 若长度不符
     */
    protected ByteHash32(byte[] value) {
        if (value == null) {
            throw new NullPointerException("Hash value cannot be null");
        }
        if (value.length != HASH_LENGTH) {
            throw new IllegalArgumentException("Hash must be " + HASH_LENGTH + " bytes, got " + value.length);
        }
        this.value = Arrays.copyOf(value, HASH_LENGTH); // 防御性拷贝
        this.hexValue = ByteUtils.bytesToHex(this.value);
    }

    /**
     * 获取原始字节数组（返回拷贝，确保不可变性）
     */
    public byte[] getBytes() {
        return Arrays.copyOf(value, HASH_LENGTH);
    }

    /**
     * 十六进制字符串（使用缓存值）
     */
    public String toHex() {
        return hexValue;
    }

    /**
     * 判断是否为零值（全0字节）
     */
    public boolean isZero() {
        for (byte b : value) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * 十六进制字符串转32字节数组（供子类工厂方法调用）
     */
    protected static byte[] hexToBytes32(String hex) {
        byte[] bytes = ByteUtils.hexToBytes(hex);
        if (bytes.length != HASH_LENGTH) {
            throw new IllegalArgumentException("Invalid hex string length for 32-byte hash: " + hex);
        }
        return bytes;
    }

    /**
     * 基于字节内容比较，不同子类型（摘要/公钥）即使字节相同也不相等
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(value, ((ByteHash32) o).value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @JsonValue
    @Override
    public String toString() {
        return hexValue;
    }
}
