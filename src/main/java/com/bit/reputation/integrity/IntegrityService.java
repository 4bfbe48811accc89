package com.bit.reputation.integrity;

import com.bit.reputation.common.Pubkey;
import com.bit.reputation.structure.dto.DeepIntegrityReport;
import com.bit.reputation.structure.dto.DeepVerificationOptions;
import com.bit.reputation.structure.dto.FullVerificationOptions;
import com.bit.reputation.structure.dto.FullVerificationReport;
import com.bit.reputation.structure.dto.IntegrityReport;

/**
 * 索引器数据完整性校验
 * 三种模式都不抛出异常，所有失败都体现在报告的status/error中
 */
public interface IntegrityService {

    /**
     * 基础校验：只比对三条链的 (digest, count)
     */
    IntegrityReport verify(Pubkey agent);

    /**
     * 抽样校验：基础校验 + 抽检若干位置的记录
     * @param options 为null时使用配置默认值
     */
    DeepIntegrityReport verifyDeep(Pubkey agent, DeepVerificationOptions options);

    default DeepIntegrityReport verifyDeep(Pubkey agent) {
        return verifyDeep(agent, null);
    }

    /**
     * 全量校验：从检查点或创世状态重放全部事件并与链上摘要比对
     * @param options 为null时使用配置默认值
     */
    FullVerificationReport verifyFull(Pubkey agent, FullVerificationOptions options);

    default FullVerificationReport verifyFull(Pubkey agent) {
        return verifyFull(agent, null);
    }
}
