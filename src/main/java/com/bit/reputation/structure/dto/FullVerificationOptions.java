package com.bit.reputation.structure.dto;

import com.bit.reputation.chain.ChainType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 全量校验参数，字段为null时使用配置默认值
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FullVerificationOptions {
    private Integer batchSize;
    private Boolean useCheckpoints;   // false 时忽略索引器与本地检查点，从创世状态重放
    private ProgressListener onProgress;

    /**
     * 每处理完一页回调一次
     */
    @FunctionalInterface
    public interface ProgressListener {
        void onProgress(ChainType chainType, long processed, long total);
    }
}
