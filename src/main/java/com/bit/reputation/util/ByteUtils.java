package com.bit.reputation.util;

import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;

import java.util.Arrays;

/**
 * 链上程序统一使用小端序（Borsh 兼容），这里的整数编码全部为小端
 */
public class ByteUtils {

    private ByteUtils() {
    }

    /**
     * u64/i64 转 8 字节小端
     */
    public static byte[] longToBytesLE(long value) {
        byte[] bytes = new byte[8];
        for (int i = 0; i < 8; i++) {
            bytes[i] = (byte) (value >>> (8 * i)); // 小端模式（低位在前）
        }
        return bytes;
    }

    /**
     * u16 转 2 字节小端，用于字符串长度前缀
     */
    public static byte[] u16ToBytesLE(int value) {
        if (value < 0 || value > 0xFFFF) {
            throw new IllegalArgumentException("u16超出范围: " + value);
        }
        return new byte[]{(byte) value, (byte) (value >>> 8)};
    }

    /**
     * 字节数组转十六进制字符串（小写）
     */
    public static String bytesToHex(byte[] bytes) {
        return bytes == null ? null : Hex.encodeHexString(bytes);
    }

    /**
     * 十六进制字符串转字节数组，非法字符或奇数长度直接拒绝
     */
    public static byte[] hexToBytes(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("十六进制字符串不能为空");
        }
        String normalized = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        try {
            return Hex.decodeHex(normalized);
        } catch (DecoderException e) {
            throw new IllegalArgumentException("非法十六进制字符串: " + hex, e);
        }
    }

    /**
     * 按顺序拼接多个字节数组
     */
    public static byte[] concat(byte[]... parts) {
        int total = 0;
        for (byte[] part : parts) {
            total += part.length;
        }
        byte[] combined = new byte[total];
        int offset = 0;
        for (byte[] part : parts) {
            System.arraycopy(part, 0, combined, offset, part.length);
            offset += part.length;
        }
        return combined;
    }

    /**
     * 填充固定字节的数组，测试向量里常用（例如 0xAA × 32）
     */
    public static byte[] filled(int length, int value) {
        byte[] bytes = new byte[length];
        Arrays.fill(bytes, (byte) value);
        return bytes;
    }
}
