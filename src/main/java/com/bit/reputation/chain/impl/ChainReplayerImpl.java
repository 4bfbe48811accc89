package com.bit.reputation.chain.impl;

import com.bit.reputation.chain.ChainReplayer;
import com.bit.reputation.chain.ChainType;
import com.bit.reputation.chain.HashChainReplay;
import com.bit.reputation.structure.chain.ChainState;
import com.bit.reputation.structure.dto.ReplayResult;
import com.bit.reputation.structure.event.ChainEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
public class ChainReplayerImpl implements ChainReplayer {

    @Override
    public ReplayResult replay(ChainType chainType, List<? extends ChainEvent> events, ChainState start) {
        int size = events == null ? 0 : events.size();
        long startCount = start == null ? 0 : start.getCount();
        ReplayResult result = HashChainReplay.replay(chainType, events, start);
        if (result.isValid()) {
            log.debug("{}链重放完成：起点{}，本批{}条，累计{}条，摘要{}",
                    chainType.getCode(), startCount, size, result.getCount(), result.getFinalDigest().toHex());
        } else {
            log.warn("{}链重放失配：本批第{}条（链内位置{}），索引器摘要{}，计算摘要{}",
                    chainType.getCode(), result.getMismatchAt(), startCount + result.getMismatchAt(),
                    result.getMismatchExpected(), result.getMismatchComputed());
        }
        return result;
    }
}
