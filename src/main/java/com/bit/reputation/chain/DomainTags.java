package com.bit.reputation.chain;

import java.nio.charset.StandardCharsets;

/**
 * 域分隔标签（必须与链上程序逐字节一致）
 * <p>
 * 链标签见 {@link ChainType}；这里是 SEAL 与反馈叶子使用的16字节前缀。
 * 注意 REVOKE 链标签只有14字节，其余均为16字节，这是已写入链上摘要的历史格式，不能补齐。
 */
public final class DomainTags {

    private static final byte[] SEAL_V1 = "8004_SEAL_V1____".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] LEAF_V1 = "8004_LEAF_V1____".getBytes(StandardCharsets.US_ASCII);

    private DomainTags() {
    }

    /**
     * SEAL 哈希前缀（16字节）
     */
    public static byte[] seal() {
        return SEAL_V1.clone();
    }

    /**
     * 反馈叶子前缀（16字节），响应/撤销叶子不带前缀
     */
    public static byte[] feedbackLeaf() {
        return LEAF_V1.clone();
    }
}
