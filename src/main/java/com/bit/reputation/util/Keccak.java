package com.bit.reputation.util;

import org.bouncycastle.jcajce.provider.digest.Keccak.Digest256;

import java.security.MessageDigest;

/**
 * Keccak-256（以太坊/Solana 程序使用的原始 Keccak，非 NIST SHA3-256）
 * 所有链哈希、叶子哈希、SEAL 哈希共用此原语
 */
public class Keccak {

    public static final int DIGEST_LENGTH = 32;

    // 每个线程独立的Keccak-256实例，MessageDigest本身非线程安全
    private static final ThreadLocal<MessageDigest> KECCAK256_THREAD_LOCAL = ThreadLocal.withInitial(Digest256::new);

    private Keccak() {
    }

    /**
     * 线程安全的Keccak-256计算
     */
    public static byte[] keccak256(byte[] data) {
        // 空输入按空数组处理（哈希空数组是合法的）
        data = data == null ? new byte[0] : data;
        MessageDigest digest = KECCAK256_THREAD_LOCAL.get();
        digest.reset();
        return digest.digest(data);
    }

    /**
     * 按顺序拼接多个片段后计算Keccak-256，避免调用方先手动拷贝成一个大数组
     */
    public static byte[] keccak256(byte[]... parts) {
        MessageDigest digest = KECCAK256_THREAD_LOCAL.get();
        digest.reset();
        for (int i = 0; i < parts.length; i++) {
            if (parts[i] == null) {
                throw new IllegalArgumentException("第" + i + "个哈希输入片段为null");
            }
            digest.update(parts[i]);
        }
        return digest.digest();
    }
}
