package com.bit.reputation.structure.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 抽样校验参数，字段为null时使用配置默认值
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeepVerificationOptions {
    private Integer spotChecks;
    private Boolean checkBoundaries;
    private Boolean verifyContent;
}
