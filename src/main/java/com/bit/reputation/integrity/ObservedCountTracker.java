package com.bit.reputation.integrity;

import com.bit.reputation.chain.ChainType;
import com.bit.reputation.common.Pubkey;
import com.bit.reputation.config.IntegrityConfig;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 记录每个 agent 每条链见过的最大链上计数
 * 链上计数只增不减，出现回退说明读到了重组前后的不一致状态
 */
@Slf4j
@Component
public class ObservedCountTracker {

    private final Cache<String, Long> observed;

    public ObservedCountTracker(IntegrityConfig config) {
        this.observed = Caffeine.newBuilder()
                .maximumSize(config.getCache().getMaxAgents() * ChainType.values().length)
                .expireAfterAccess(config.getCache().getExpireMinutes(), TimeUnit.MINUTES)
                .build();
    }

    /**
     * 记录本次观测到的链上计数
     * @return 计数未回退返回true；回退时返回false，且不降低已记录的最大值
     */
    public boolean observe(Pubkey agent, ChainType chainType, long count) {
        long[] previous = {-1};
        observed.asMap().compute(key(agent, chainType), (k, v) -> {
            if (v == null) {
                return count;
            }
            previous[0] = v;
            return Math.max(v, count);
        });
        if (count < previous[0]) {
            log.warn("agent {} {}链链上计数回退: 之前{}，现在{}", agent, chainType.getCode(), previous[0], count);
            return false;
        }
        return true;
    }

    public Long highest(Pubkey agent, ChainType chainType) {
        return observed.getIfPresent(key(agent, chainType));
    }

    private static String key(Pubkey agent, ChainType chainType) {
        return agent.toHex() + ":" + chainType.getCode();
    }
}
