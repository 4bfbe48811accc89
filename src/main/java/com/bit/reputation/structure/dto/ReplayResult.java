package com.bit.reputation.structure.dto;

import com.bit.reputation.common.Digest;
import com.bit.reputation.structure.chain.ChainState;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 链重放结果
 * 失配时 finalDigest/count 为停止处的进度（包含失配的那条事件），mismatch* 字段指出位置与两侧摘要
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReplayResult {
    private Digest finalDigest;
    private long count;
    private boolean valid;
    private Long mismatchAt;          // 本批次内的下标
    private String mismatchExpected;  // 索引器声称的摘要（hex）
    private String mismatchComputed;  // 本地计算的摘要（hex）

    public static ReplayResult valid(Digest finalDigest, long count) {
        return new ReplayResult(finalDigest, count, true, null, null, null);
    }

    public static ReplayResult mismatch(Digest computed, long count, long at, String expected) {
        return new ReplayResult(computed, count, false, at, expected, computed.toHex());
    }

    /**
     * 作为下一段重放的起点
     */
    public ChainState toState() {
        return ChainState.of(finalDigest, count);
    }
}
