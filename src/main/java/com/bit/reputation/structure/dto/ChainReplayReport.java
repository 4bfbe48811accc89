package com.bit.reputation.structure.dto;

import com.bit.reputation.chain.ChainType;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 全量重放中单条链的结果
 */
@Data
@NoArgsConstructor
public class ChainReplayReport {
    private ChainType chainType;
    private boolean valid;
    private String computedDigest;
    private String expectedDigest;
    private long computedCount;
    private long expectedCount;
    private boolean match;
    private long lag;
    private Long mismatchAt;       // 链内绝对位置
    private long startCount;       // 从哪个检查点开始重放
}
