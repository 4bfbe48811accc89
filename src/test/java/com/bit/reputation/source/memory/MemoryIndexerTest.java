package com.bit.reputation.source.memory;

import com.bit.reputation.ChainFixtures;
import com.bit.reputation.chain.ChainType;
import com.bit.reputation.common.Pubkey;
import com.bit.reputation.source.SourceException;
import com.bit.reputation.structure.chain.AgentChains;
import com.bit.reputation.structure.chain.ChainState;
import com.bit.reputation.structure.chain.ReplayPage;
import com.bit.reputation.structure.event.ChainEvent;
import com.bit.reputation.structure.event.FeedbackEvent;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class MemoryIndexerTest {

    private final Pubkey agent = Pubkey.fromBytes(ChainFixtures.ASSET);

    @Test
    void testIndexerAndRegistryAgree() {
        MemoryRegistry registry = new MemoryRegistry();
        MemoryIndexer indexer = new MemoryIndexer(3);
        registry.registerAgent(agent);
        for (FeedbackEvent event : ChainFixtures.feedbacks(7)) {
            ChainState onChain = registry.commit(agent, event);
            ChainState indexed = indexer.ingest(agent, event);
            assertEquals(onChain, indexed, "内存索引器与链上状态应同步推进");
        }
        AgentChains chains = registry.fetchAgentChains(agent).orElseThrow();
        assertEquals(7, chains.getFeedback().getCount());
        assertEquals(ChainState.GENESIS, chains.getRevoke());
        assertEquals(chains.getFeedback(), indexer.lastDigest(agent, ChainType.FEEDBACK));
        assertEquals(6, indexer.latestCheckpoints(agent).get(ChainType.FEEDBACK).orElseThrow().getCount(),
                "每3条生成一个检查点");
        assertTrue(registry.fetchAgentChains(Pubkey.fromBytes(ChainFixtures.CLIENT)).isEmpty());
    }

    @Test
    void testPaging() {
        MemoryIndexer indexer = new MemoryIndexer(1000);
        ChainFixtures.feedbacks(5).forEach(e -> indexer.ingest(agent, e));

        ReplayPage first = indexer.replayPage(agent, ChainType.FEEDBACK, 0, 2);
        assertEquals(2, first.getEvents().size());
        assertTrue(first.isHasMore());
        assertEquals(2, first.getNextFromCount());

        ReplayPage last = indexer.replayPage(agent, ChainType.FEEDBACK, 4, 2);
        assertEquals(1, last.getEvents().size());
        assertFalse(last.isHasMore());

        assertTrue(indexer.replayPage(agent, ChainType.RESPONSE, 0, 2).getEvents().isEmpty());
    }

    @Test
    void testDroppedRecordIsMissing() {
        MemoryIndexer indexer = new MemoryIndexer(1000);
        ChainFixtures.feedbacks(5).forEach(e -> indexer.ingest(agent, e));
        indexer.dropAt(agent, ChainType.FEEDBACK, 2);

        Map<Long, ChainEvent> found = indexer.eventsAt(agent, ChainType.FEEDBACK, List.of(0L, 2L, 4L, 9L));
        assertEquals(2, found.size());
        assertFalse(found.containsKey(2L));
        assertEquals(5, indexer.lastDigest(agent, ChainType.FEEDBACK).getCount(), "丢失记录不影响索引器声称的计数");
        assertEquals(4, indexer.replayPage(agent, ChainType.FEEDBACK, 0, 10).getEvents().size());
    }

    @Test
    void testOutage() {
        MemoryIndexer indexer = new MemoryIndexer(1000);
        indexer.setUnavailable(true);
        assertThrows(SourceException.class, () -> indexer.lastDigest(agent, ChainType.FEEDBACK));
        MemoryRegistry registry = new MemoryRegistry();
        registry.setUnavailable(true);
        assertThrows(SourceException.class, () -> registry.fetchAgentChains(agent));
    }
}
