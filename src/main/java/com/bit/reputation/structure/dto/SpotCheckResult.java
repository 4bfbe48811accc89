package com.bit.reputation.structure.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单个抽检位置的结果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpotCheckResult {
    private long index;            // 链内位置（从0开始）
    private boolean exists;
    private Boolean contentValid;  // 未校验内容时为null
    private String contentError;

    public static SpotCheckResult missing(long index) {
        return new SpotCheckResult(index, false, null, "missing");
    }
}
