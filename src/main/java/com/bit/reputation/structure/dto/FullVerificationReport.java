package com.bit.reputation.structure.dto;

import com.bit.reputation.chain.ChainType;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.Map;

/**
 * 全量（确定性）校验报告
 */
@Data
@NoArgsConstructor
public class FullVerificationReport {
    private String agent;
    private boolean valid;
    private IntegrityStatus status;
    private Map<ChainType, ChainReplayReport> chains = new EnumMap<>(ChainType.class);
    private long totalLag;
    private boolean checkpointsUsed;
    private String error;
    private long durationMs;

    public ChainReplayReport chain(ChainType chainType) {
        return chains.get(chainType);
    }

    public void applyStatus(IntegrityStatus status) {
        this.status = status;
        this.valid = status == IntegrityStatus.VALID;
    }
}
