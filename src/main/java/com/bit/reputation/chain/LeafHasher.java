package com.bit.reputation.chain;

import com.bit.reputation.util.ByteUtils;
import com.bit.reputation.util.Keccak;

/**
 * 三种事件的叶子哈希
 * 只有反馈叶子带 LEAF 前缀；响应/撤销叶子直接拼接字段，与链上程序保持一致
 */
public final class LeafHasher {

    private LeafHasher() {
    }

    /**
     * keccak(LEAF | asset | client | index u64 | sealHash | slot u64)
     */
    public static byte[] feedbackLeaf(byte[] asset, byte[] client, long feedbackIndex, byte[] sealHash, long slot) {
        require32("asset", asset);
        require32("client", client);
        require32("sealHash", sealHash);
        return Keccak.keccak256(
                DomainTags.feedbackLeaf(),
                asset,
                client,
                ByteUtils.longToBytesLE(feedbackIndex),
                sealHash,
                ByteUtils.longToBytesLE(slot));
    }

    /**
     * keccak(asset | client | index u64 | responder | responseHash | feedbackHash | slot u64)
     */
    public static byte[] responseLeaf(byte[] asset, byte[] client, long feedbackIndex, byte[] responder,
                                      byte[] responseHash, byte[] feedbackHash, long slot) {
        require32("asset", asset);
        require32("client", client);
        require32("responder", responder);
        require32("responseHash", responseHash);
        require32("feedbackHash", feedbackHash);
        return Keccak.keccak256(
                asset,
                client,
                ByteUtils.longToBytesLE(feedbackIndex),
                responder,
                responseHash,
                feedbackHash,
                ByteUtils.longToBytesLE(slot));
    }

    /**
     * keccak(asset | client | index u64 | feedbackHash | slot u64)
     */
    public static byte[] revokeLeaf(byte[] asset, byte[] client, long feedbackIndex, byte[] feedbackHash, long slot) {
        require32("asset", asset);
        require32("client", client);
        require32("feedbackHash", feedbackHash);
        return Keccak.keccak256(
                asset,
                client,
                ByteUtils.longToBytesLE(feedbackIndex),
                feedbackHash,
                ByteUtils.longToBytesLE(slot));
    }

    static void require32(String field, byte[] bytes) {
        if (bytes == null) {
            throw new ChainException(ErrorType.MISSING_FIELD, field + "不能为空");
        }
        if (bytes.length != Keccak.DIGEST_LENGTH) {
            throw new ChainException(ErrorType.INVALID_LENGTH, field + "长度=" + bytes.length);
        }
    }
}
