package com.bit.reputation.source.memory;

import com.bit.reputation.chain.ChainType;
import com.bit.reputation.chain.HashChain;
import com.bit.reputation.common.Digest;
import com.bit.reputation.common.Pubkey;
import com.bit.reputation.config.IntegrityConfig;
import com.bit.reputation.source.IndexerSource;
import com.bit.reputation.source.SourceException;
import com.bit.reputation.structure.chain.ChainState;
import com.bit.reputation.structure.chain.CheckpointSet;
import com.bit.reputation.structure.chain.ReplayPage;
import com.bit.reputation.structure.event.ChainEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存版索引器
 * <p>
 * 按到达顺序保存事件，并在入库时计算 storedDigest；每 checkpointInterval 条事件记录一个检查点。
 * 另外提供丢失记录、篡改记录、服务中断等模拟手段，便于验证校验逻辑。
 */
@Slf4j
@Component
public class MemoryIndexer implements IndexerSource {

    private final long checkpointInterval;
    private final Map<Pubkey, Map<ChainType, ChainLog>> logs = new ConcurrentHashMap<>();

    private volatile boolean unavailable = false;

    @Autowired
    public MemoryIndexer(IntegrityConfig config) {
        this(config.getMemory().getCheckpointInterval());
    }

    public MemoryIndexer(long checkpointInterval) {
        if (checkpointInterval <= 0) {
            throw new IllegalArgumentException("checkpointInterval必须为正数");
        }
        this.checkpointInterval = checkpointInterval;
    }

    /**
     * 入库一个事件：按本地维护的摘要计算并写入 storedDigest
     */
    public ChainState ingest(Pubkey agent, ChainEvent event) {
        ChainLog chainLog = chainLog(agent, event.chainType());
        synchronized (chainLog) {
            ChainState head = chainLog.head;
            byte[] next = HashChain.chainHash(head.getDigest().getBytes(), event.chainType(), event.computeLeaf());
            event.setStoredDigest(next);
            chainLog.events.add(event);
            chainLog.head = ChainState.of(Digest.fromBytes(next), head.getCount() + 1);
            if (chainLog.head.getCount() % checkpointInterval == 0) {
                chainLog.checkpoint = chainLog.head;
                log.debug("agent {} {}链生成检查点 count={}", agent, event.chainType().getCode(), chainLog.head.getCount());
            }
            return chainLog.head;
        }
    }

    /**
     * 丢失某个位置的记录（位置保留，计数不变）
     */
    public void dropAt(Pubkey agent, ChainType chainType, long position) {
        ChainLog chainLog = chainLog(agent, chainType);
        synchronized (chainLog) {
            chainLog.events.set(Math.toIntExact(position), null);
        }
    }

    /**
     * 替换某个位置的记录，不重新计算任何摘要（模拟被篡改的索引器数据）
     */
    public void replaceAt(Pubkey agent, ChainType chainType, long position, ChainEvent event) {
        ChainLog chainLog = chainLog(agent, chainType);
        synchronized (chainLog) {
            chainLog.events.set(Math.toIntExact(position), event);
        }
    }

    /**
     * 直接设置索引器的检查点（模拟不可信的检查点）
     */
    public void putCheckpoint(Pubkey agent, ChainType chainType, ChainState checkpoint) {
        ChainLog chainLog = chainLog(agent, chainType);
        synchronized (chainLog) {
            chainLog.checkpoint = checkpoint;
        }
    }

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    @Override
    public ChainState lastDigest(Pubkey agent, ChainType chainType) {
        checkAvailable();
        ChainLog chainLog = existing(agent, chainType);
        if (chainLog == null) {
            return ChainState.GENESIS;
        }
        synchronized (chainLog) {
            return chainLog.head;
        }
    }

    @Override
    public CheckpointSet latestCheckpoints(Pubkey agent) {
        checkAvailable();
        CheckpointSet set = CheckpointSet.empty();
        for (ChainType chainType : ChainType.values()) {
            ChainLog chainLog = existing(agent, chainType);
            if (chainLog != null) {
                synchronized (chainLog) {
                    set.put(chainType, chainLog.checkpoint);
                }
            }
        }
        return set;
    }

    @Override
    public ReplayPage replayPage(Pubkey agent, ChainType chainType, long fromCount, int limit) {
        checkAvailable();
        if (fromCount < 0 || limit <= 0) {
            throw new IllegalArgumentException("非法分页参数 fromCount=" + fromCount + ", limit=" + limit);
        }
        ChainLog chainLog = existing(agent, chainType);
        if (chainLog == null) {
            return new ReplayPage(new ArrayList<>(), false, fromCount);
        }
        synchronized (chainLog) {
            int size = chainLog.events.size();
            int from = (int) Math.min(fromCount, size);
            int to = (int) Math.min((long) from + limit, size);
            List<ChainEvent> page = new ArrayList<>(to - from);
            for (int i = from; i < to; i++) {
                ChainEvent event = chainLog.events.get(i);
                // 丢失的记录直接跳过，和真实索引器的空洞表现一致
                if (event != null) {
                    page.add(event);
                }
            }
            return new ReplayPage(page, to < size, to);
        }
    }

    @Override
    public Map<Long, ChainEvent> eventsAt(Pubkey agent, ChainType chainType, Collection<Long> positions) {
        checkAvailable();
        Map<Long, ChainEvent> found = new HashMap<>();
        ChainLog chainLog = existing(agent, chainType);
        if (chainLog == null) {
            return found;
        }
        synchronized (chainLog) {
            for (Long position : positions) {
                if (position != null && position >= 0 && position < chainLog.events.size()) {
                    ChainEvent event = chainLog.events.get(position.intValue());
                    if (event != null) {
                        found.put(position, event);
                    }
                }
            }
        }
        return found;
    }

    private void checkAvailable() {
        if (unavailable) {
            throw new SourceException("索引器不可用");
        }
    }

    private ChainLog chainLog(Pubkey agent, ChainType chainType) {
        return logs.computeIfAbsent(agent, k -> new ConcurrentHashMap<>())
                .computeIfAbsent(chainType, k -> new ChainLog());
    }

    private ChainLog existing(Pubkey agent, ChainType chainType) {
        Map<ChainType, ChainLog> chains = logs.get(agent);
        return chains == null ? null : chains.get(chainType);
    }

    private static class ChainLog {
        private final List<ChainEvent> events = new ArrayList<>();
        private ChainState head = ChainState.GENESIS;
        private ChainState checkpoint;
    }
}
