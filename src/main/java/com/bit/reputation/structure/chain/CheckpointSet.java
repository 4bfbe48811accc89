package com.bit.reputation.structure.chain;

import com.bit.reputation.chain.ChainType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * 索引器为每条链保存的最新检查点，可能缺失
 */
public class CheckpointSet {

    private final Map<ChainType, ChainState> checkpoints = new EnumMap<>(ChainType.class);

    public static CheckpointSet empty() {
        return new CheckpointSet();
    }

    public CheckpointSet put(ChainType chainType, ChainState state) {
        if (state != null) {
            checkpoints.put(chainType, state);
        }
        return this;
    }

    public Optional<ChainState> get(ChainType chainType) {
        return Optional.ofNullable(checkpoints.get(chainType));
    }
}
