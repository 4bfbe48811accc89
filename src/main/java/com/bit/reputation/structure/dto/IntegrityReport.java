package com.bit.reputation.structure.dto;

import com.bit.reputation.chain.ChainType;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.Map;

/**
 * 基础（O(1)）完整性报告
 */
@Data
@NoArgsConstructor
public class IntegrityReport {
    private String agent;
    private boolean valid;
    private IntegrityStatus status;
    private boolean trustworthy;
    private Map<ChainType, ChainIntegrity> chains = new EnumMap<>(ChainType.class);
    private long totalLag;
    private String error;
    private long durationMs;

    public ChainIntegrity chain(ChainType chainType) {
        return chains.get(chainType);
    }

    public void applyStatus(IntegrityStatus status) {
        this.status = status;
        this.valid = status == IntegrityStatus.VALID;
        this.trustworthy = this.valid;
    }
}
