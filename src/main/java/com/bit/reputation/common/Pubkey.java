package com.bit.reputation.common;

import org.bitcoinj.core.AddressFormatException;
import org.bitcoinj.core.Base58;

/**
 * 公钥封装（32字节），统一 agent 资产 / 客户端 / 响应者的地址表示
 */
public class Pubkey extends ByteHash32 {
    private static final long serialVersionUID = 1L;

    public static final int LENGTH = HASH_LENGTH;

    private Pubkey(byte[] value) {
        super(value);
    }

    public static Pubkey fromBytes(byte[] bytes) {
        return new Pubkey(bytes);
    }

    /**
     * 从Base58字符串解析公钥
     * @throws IllegalArgumentException Base58非法或解码后不是32字节
     */
    public static Pubkey fromBase58(String base58) {
        if (base58 == null || base58.isEmpty()) {
            throw new IllegalArgumentException("公钥不能为空");
        }
        byte[] decoded;
        try {
            decoded = Base58.decode(base58);
        } catch (AddressFormatException e) {
            throw new IllegalArgumentException("非法Base58公钥: " + base58, e);
        }
        if (decoded.length != LENGTH) {
            throw new IllegalArgumentException("公钥必须为32字节, 实际: " + decoded.length);
        }
        return new Pubkey(decoded);
    }

    public String toBase58() {
        return Base58.encode(getBytes());
    }

    @Override
    public String toString() {
        return toBase58();
    }
}
