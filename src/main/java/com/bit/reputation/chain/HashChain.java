package com.bit.reputation.chain;

import com.bit.reputation.util.Keccak;

/**
 * 链哈希：next = keccak(prev | domain | leaf)
 * 纯函数，没有任何隐藏状态；domain按原样拼接，不限制长度（REVOKE 为14字节）
 */
public final class HashChain {

    private HashChain() {
    }

    public static byte[] chainHash(byte[] prevDigest, byte[] domain, byte[] leaf) {
        LeafHasher.require32("prevDigest", prevDigest);
        LeafHasher.require32("leaf", leaf);
        if (domain == null) {
            throw new ChainException(ErrorType.MISSING_FIELD, "domain不能为空");
        }
        return Keccak.keccak256(prevDigest, domain, leaf);
    }

    public static byte[] chainHash(byte[] prevDigest, ChainType chainType, byte[] leaf) {
        return chainHash(prevDigest, chainType.domain(), leaf);
    }
}
