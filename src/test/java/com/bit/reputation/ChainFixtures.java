package com.bit.reputation;

import com.bit.reputation.chain.HashChain;
import com.bit.reputation.chain.SealHasher;
import com.bit.reputation.common.Digest;
import com.bit.reputation.structure.event.ChainEvent;
import com.bit.reputation.structure.event.FeedbackEvent;
import com.bit.reputation.structure.event.ResponseEvent;
import com.bit.reputation.structure.event.RevokeEvent;
import com.bit.reputation.structure.seal.SealParams;
import com.bit.reputation.util.ByteUtils;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * 测试用事件构造
 */
public final class ChainFixtures {

    public static final byte[] ASSET = ByteUtils.filled(32, 0xAA);
    public static final byte[] CLIENT = ByteUtils.filled(32, 0xBB);
    public static final byte[] RESPONDER = ByteUtils.filled(32, 0xCC);

    private ChainFixtures() {
    }

    public static SealParams seal(int i) {
        return SealParams.builder()
                .value(BigInteger.valueOf(i * 10L))
                .valueDecimals(2)
                .score(i % 101)
                .tag1("uptime")
                .tag2("day")
                .endpoint("")
                .feedbackUri("ipfs://QmFeedback" + i)
                .build();
    }

    public static FeedbackEvent feedback(int i) {
        SealParams content = seal(i);
        return FeedbackEvent.builder()
                .asset(ASSET)
                .client(CLIENT)
                .feedbackIndex(i)
                .sealHash(SealHasher.computeSealHash(content))
                .slot(1000L + i)
                .content(content)
                .build();
    }

    public static ResponseEvent response(int i) {
        return ResponseEvent.builder()
                .asset(ASSET)
                .client(CLIENT)
                .feedbackIndex(i)
                .responder(RESPONDER)
                .responseHash(ByteUtils.filled(32, 0x10 + i))
                .feedbackHash(SealHasher.computeSealHash(seal(i)))
                .slot(2000L + i)
                .build();
    }

    public static RevokeEvent revoke(int i) {
        return RevokeEvent.builder()
                .asset(ASSET)
                .client(CLIENT)
                .feedbackIndex(i)
                .feedbackHash(SealHasher.computeSealHash(seal(i)))
                .slot(3000L + i)
                .build();
    }

    public static List<FeedbackEvent> feedbacks(int n) {
        List<FeedbackEvent> events = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            events.add(feedback(i));
        }
        return events;
    }

    /**
     * 从创世状态依次计算并写入 storedDigest
     */
    public static <T extends ChainEvent> List<T> annotate(List<T> events) {
        byte[] digest = Digest.ZERO.getBytes();
        for (T event : events) {
            digest = HashChain.chainHash(digest, event.chainType(), event.computeLeaf());
            event.setStoredDigest(digest);
        }
        return events;
    }

    public static FeedbackEvent copy(FeedbackEvent e) {
        return new FeedbackEvent(e.getAsset(), e.getClient(), e.getFeedbackIndex(), e.getSealHash(), e.getSlot(),
                e.getStoredDigest(), e.getContent());
    }
}
