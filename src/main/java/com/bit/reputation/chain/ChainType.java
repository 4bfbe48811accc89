package com.bit.reputation.chain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.nio.charset.StandardCharsets;

/**
 * 每个 agent 在链上维护的三条独立哈希链，以及各自的链域标签
 */
public enum ChainType {
    FEEDBACK("feedback", "8004_FEEDBACK_V1"),
    RESPONSE("response", "8004_RESPONSE_V1"),
    // 14字节，不是16
    REVOKE("revoke", "8004_REVOKE_V1");

    private final String code;
    private final byte[] domain;

    ChainType(String code, String domain) {
        this.code = code;
        this.domain = domain.getBytes(StandardCharsets.US_ASCII);
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 链域标签（返回拷贝）
     */
    public byte[] domain() {
        return domain.clone();
    }
}
