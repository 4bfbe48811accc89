package com.bit.reputation.source;

import com.bit.reputation.common.Pubkey;
import com.bit.reputation.structure.chain.AgentChains;

import java.util.Optional;

/**
 * 链上 agent 注册表（权威来源）
 */
public interface OnChainRegistry {

    /**
     * 读取 agent 的三条链 (digest, count)
     * @return agent 不存在时返回 empty
     * @throws SourceException 读取失败
     */
    Optional<AgentChains> fetchAgentChains(Pubkey agent);
}
