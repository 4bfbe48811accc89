package com.bit.reputation.source;

import com.bit.reputation.chain.ChainType;
import com.bit.reputation.common.Pubkey;
import com.bit.reputation.structure.chain.ChainState;
import com.bit.reputation.structure.chain.CheckpointSet;
import com.bit.reputation.structure.chain.ReplayPage;
import com.bit.reputation.structure.event.ChainEvent;

import java.util.Collection;
import java.util.Map;

/**
 * 索引器（不可信来源），所有方法失败时抛出 {@link SourceException}
 */
public interface IndexerSource {

    /**
     * 索引器声称的最新摘要与事件数，没有事件时为 (ZERO, 0)
     */
    ChainState lastDigest(Pubkey agent, ChainType chainType);

    /**
     * 索引器保存的最新检查点，不支持时返回空集合
     */
    default CheckpointSet latestCheckpoints(Pubkey agent) {
        return CheckpointSet.empty();
    }

    /**
     * 从第 fromCount 个事件（从0开始）起按顺序返回最多 limit 个事件
     */
    ReplayPage replayPage(Pubkey agent, ChainType chainType, long fromCount, int limit);

    /**
     * 按链内位置（从0开始）取事件，不存在的位置不出现在结果中
     */
    Map<Long, ChainEvent> eventsAt(Pubkey agent, ChainType chainType, Collection<Long> positions);
}
