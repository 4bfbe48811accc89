package com.bit.reputation.source.memory;

import com.bit.reputation.chain.ChainType;
import com.bit.reputation.chain.HashChain;
import com.bit.reputation.common.Digest;
import com.bit.reputation.common.Pubkey;
import com.bit.reputation.source.OnChainRegistry;
import com.bit.reputation.source.SourceException;
import com.bit.reputation.structure.chain.AgentChains;
import com.bit.reputation.structure.chain.ChainState;
import com.bit.reputation.structure.event.ChainEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存版链上注册表：提交事件时按链上程序的方式推进摘要，只保留 (digest, count)
 */
@Slf4j
@Component
public class MemoryRegistry implements OnChainRegistry {

    private final Map<Pubkey, AgentChains> agents = new ConcurrentHashMap<>();

    // 模拟RPC不可用
    private volatile boolean unavailable = false;

    @Override
    public Optional<AgentChains> fetchAgentChains(Pubkey agent) {
        if (unavailable) {
            throw new SourceException("链上注册表不可用");
        }
        AgentChains chains = agents.get(agent);
        if (chains == null) {
            return Optional.empty();
        }
        synchronized (chains) {
            return Optional.of(new AgentChains(chains.getFeedback(), chains.getResponse(), chains.getRevoke()));
        }
    }

    /**
     * 注册 agent，三条链均为创世状态；已存在时不做修改
     */
    public void registerAgent(Pubkey agent) {
        agents.putIfAbsent(agent, AgentChains.empty());
    }

    /**
     * 提交一个事件，返回提交后的链状态
     */
    public ChainState commit(Pubkey agent, ChainEvent event) {
        AgentChains chains = agents.get(agent);
        if (chains == null) {
            throw new IllegalStateException("agent未注册: " + agent);
        }
        ChainType chainType = event.chainType();
        synchronized (chains) {
            ChainState current = chains.get(chainType);
            byte[] next = HashChain.chainHash(current.getDigest().getBytes(), chainType, event.computeLeaf());
            ChainState updated = ChainState.of(Digest.fromBytes(next), current.getCount() + 1);
            chains.set(chainType, updated);
            log.debug("agent {} {}链提交第{}条事件", agent, chainType.getCode(), updated.getCount());
            return updated;
        }
    }

    /**
     * 直接覆盖某条链的链上状态（用于模拟重组等异常场景）
     */
    public void overwrite(Pubkey agent, ChainType chainType, ChainState state) {
        AgentChains chains = agents.computeIfAbsent(agent, k -> AgentChains.empty());
        synchronized (chains) {
            chains.set(chainType, state);
        }
    }

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }
}
