package com.bit.reputation.integrity;

import com.bit.reputation.chain.ChainType;
import com.bit.reputation.common.Pubkey;
import com.bit.reputation.config.IntegrityConfig;
import com.bit.reputation.structure.chain.ChainState;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * 本地保存的已验证检查点，全量校验通过后写入，下次从这里续跑
 */
@Slf4j
@Component
public class VerifiedCheckpointStore {

    private final Cache<String, ChainState> checkpoints;

    public VerifiedCheckpointStore(IntegrityConfig config) {
        this.checkpoints = Caffeine.newBuilder()
                .maximumSize(config.getCache().getMaxAgents() * ChainType.values().length)
                .expireAfterWrite(config.getCache().getExpireMinutes(), TimeUnit.MINUTES)
                .build();
    }

    public Optional<ChainState> get(Pubkey agent, ChainType chainType) {
        return Optional.ofNullable(checkpoints.getIfPresent(key(agent, chainType)));
    }

    /**
     * 只向前推进，较旧的检查点不会覆盖较新的
     */
    public void put(Pubkey agent, ChainType chainType, ChainState state) {
        checkpoints.asMap().merge(key(agent, chainType), state,
                (old, latest) -> latest.getCount() >= old.getCount() ? latest : old);
        log.debug("保存已验证检查点 agent={} chain={} count={}", agent, chainType.getCode(), state.getCount());
    }

    private static String key(Pubkey agent, ChainType chainType) {
        return agent.toHex() + ":" + chainType.getCode();
    }
}
