package com.bit.reputation.structure.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum IntegrityStatus {
    VALID("valid"),
    SYNCING("syncing"),     // 索引器落后于链上，已有部分一致
    CORRUPTED("corrupted"), // 发现篡改、缺失或不可能的状态
    ERROR("error");         // 无法完成校验（I/O失败、agent不存在等）

    private final String code;

    IntegrityStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
