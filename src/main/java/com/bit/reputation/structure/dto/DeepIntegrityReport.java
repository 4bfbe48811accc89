package com.bit.reputation.structure.dto;

import com.bit.reputation.chain.ChainType;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 抽样校验报告：基础对比 + 每条链的抽检结果
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class DeepIntegrityReport extends IntegrityReport {
    private Map<ChainType, List<SpotCheckResult>> spotChecks = new EnumMap<>(ChainType.class);
    private boolean spotChecksPassed;
    private int missingItems;      // -1 表示抽检未能执行
    private int modifiedItems;

    public List<SpotCheckResult> spotChecks(ChainType chainType) {
        return spotChecks.computeIfAbsent(chainType, k -> new ArrayList<>());
    }
}
