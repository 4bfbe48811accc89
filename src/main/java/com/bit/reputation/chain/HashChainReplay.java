package com.bit.reputation.chain;

import com.bit.reputation.common.Digest;
import com.bit.reputation.structure.chain.ChainState;
import com.bit.reputation.structure.dto.ReplayResult;
import com.bit.reputation.structure.event.ChainEvent;
import com.bit.reputation.structure.event.FeedbackEvent;
import com.bit.reputation.structure.event.ResponseEvent;
import com.bit.reputation.structure.event.RevokeEvent;
import com.bit.reputation.util.ByteUtils;

import java.util.Arrays;
import java.util.List;

/**
 * 三条链的重放（纯函数，可独立调用）
 * <p>
 * 从起点状态开始依次折叠 next = chainHash(digest, domain, leaf)。
 * 事件带有 storedDigest 时逐条比对，第一次失配立即停止；不带 storedDigest 的事件只参与计算。
 * 分段重放满足：replay(events[0:n]) == replay(events[k:n], replay(events[0:k]))
 */
public final class HashChainReplay {

    private HashChainReplay() {
    }

    public static ReplayResult replayFeedbackChain(List<FeedbackEvent> events) {
        return replay(ChainType.FEEDBACK, events, ChainState.GENESIS);
    }

    public static ReplayResult replayFeedbackChain(List<FeedbackEvent> events, ChainState start) {
        return replay(ChainType.FEEDBACK, events, start);
    }

    public static ReplayResult replayResponseChain(List<ResponseEvent> events) {
        return replay(ChainType.RESPONSE, events, ChainState.GENESIS);
    }

    public static ReplayResult replayResponseChain(List<ResponseEvent> events, ChainState start) {
        return replay(ChainType.RESPONSE, events, start);
    }

    public static ReplayResult replayRevokeChain(List<RevokeEvent> events) {
        return replay(ChainType.REVOKE, events, ChainState.GENESIS);
    }

    public static ReplayResult replayRevokeChain(List<RevokeEvent> events, ChainState start) {
        return replay(ChainType.REVOKE, events, start);
    }

    /**
     * 按链类型重放任意事件列表
     * @param start 起点检查点，null表示创世状态
     * @throws IllegalArgumentException 列表中混入其他链的事件
     * @throws ChainException 事件字段长度非法
     */
    public static ReplayResult replay(ChainType chainType, List<? extends ChainEvent> events, ChainState start) {
        ChainState origin = start == null ? ChainState.GENESIS : start;
        byte[] domain = chainType.domain();
        byte[] digest = origin.getDigest().getBytes();
        long count = origin.getCount();
        if (events == null || events.isEmpty()) {
            return ReplayResult.valid(origin.getDigest(), count);
        }

        for (int i = 0; i < events.size(); i++) {
            ChainEvent event = events.get(i);
            if (event.chainType() != chainType) {
                throw new IllegalArgumentException("第" + i + "个事件属于" + event.chainType().getCode()
                        + "链，期望" + chainType.getCode());
            }
            digest = HashChain.chainHash(digest, domain, event.computeLeaf());
            count++;

            byte[] stored = event.getStoredDigest();
            if (stored != null && !Arrays.equals(stored, digest)) {
                return ReplayResult.mismatch(Digest.fromBytes(digest), count, i, ByteUtils.bytesToHex(stored));
            }
        }
        return ReplayResult.valid(Digest.fromBytes(digest), count);
    }
}
