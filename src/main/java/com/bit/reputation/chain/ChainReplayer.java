package com.bit.reputation.chain;

import com.bit.reputation.structure.chain.ChainState;
import com.bit.reputation.structure.dto.ReplayResult;
import com.bit.reputation.structure.event.ChainEvent;

import java.util.List;

/**
 * 链重放服务
 */
public interface ChainReplayer {

    /**
     * 从给定检查点重放一批有序事件
     * @param start 起点，null表示创世状态
     */
    ReplayResult replay(ChainType chainType, List<? extends ChainEvent> events, ChainState start);

    /**
     * 从创世状态重放
     */
    default ReplayResult replay(ChainType chainType, List<? extends ChainEvent> events) {
        return replay(chainType, events, ChainState.GENESIS);
    }
}
