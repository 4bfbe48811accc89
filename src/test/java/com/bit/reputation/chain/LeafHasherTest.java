package com.bit.reputation.chain;

import com.bit.reputation.util.ByteUtils;
import com.bit.reputation.util.Keccak;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class LeafHasherTest {

    private static final byte[] ASSET = ByteUtils.filled(32, 0xAA);
    private static final byte[] CLIENT = ByteUtils.filled(32, 0xBB);

    @Test
    void testFeedbackLeafGoldenVector() {
        byte[] sealHash = SealHasher.computeSealHash(SealHasherTest.uptimeSeal());
        byte[] leaf = LeafHasher.feedbackLeaf(ASSET, CLIENT, 0, sealHash, 12345);
        assertEquals("f23e92ed586f8308ea256ecf95772531a89bd75a6782f5ab7cc99bc6c1fb5270",
                ByteUtils.bytesToHex(leaf), "反馈叶子向量不一致");
    }

    @Test
    void testIndexAndSlotChangeLeaf() {
        byte[] sealHash = ByteUtils.filled(32, 0x42);
        String base = ByteUtils.bytesToHex(LeafHasher.feedbackLeaf(ASSET, CLIENT, 7, sealHash, 100));
        assertNotEquals(base, ByteUtils.bytesToHex(LeafHasher.feedbackLeaf(ASSET, CLIENT, 8, sealHash, 100)),
                "feedbackIndex变化必须改变叶子");
        assertNotEquals(base, ByteUtils.bytesToHex(LeafHasher.feedbackLeaf(ASSET, CLIENT, 7, sealHash, 101)),
                "slot变化必须改变叶子");
        assertEquals(base, ByteUtils.bytesToHex(LeafHasher.feedbackLeaf(ASSET, CLIENT, 7, sealHash, 100)));
    }

    @Test
    void testResponseAndRevokeLeavesCarryNoPrefix() {
        byte[] responder = ByteUtils.filled(32, 0xCC);
        byte[] responseHash = ByteUtils.filled(32, 0xDD);
        byte[] feedbackHash = ByteUtils.filled(32, 0xEE);

        byte[] expectedResponse = Keccak.keccak256(ByteUtils.concat(ASSET, CLIENT, ByteUtils.longToBytesLE(3),
                responder, responseHash, feedbackHash, ByteUtils.longToBytesLE(99)));
        assertArrayEquals(expectedResponse,
                LeafHasher.responseLeaf(ASSET, CLIENT, 3, responder, responseHash, feedbackHash, 99));

        byte[] expectedRevoke = Keccak.keccak256(ByteUtils.concat(ASSET, CLIENT, ByteUtils.longToBytesLE(3),
                feedbackHash, ByteUtils.longToBytesLE(99)));
        assertArrayEquals(expectedRevoke, LeafHasher.revokeLeaf(ASSET, CLIENT, 3, feedbackHash, 99));
    }

    @Test
    void testRejectsWrongLengths() {
        ChainException e = assertThrows(ChainException.class,
                () -> LeafHasher.feedbackLeaf(new byte[31], CLIENT, 0, new byte[32], 0));
        assertEquals(ErrorType.INVALID_LENGTH, e.getErrorType());

        assertThrows(ChainException.class,
                () -> LeafHasher.revokeLeaf(ASSET, CLIENT, 0, new byte[33], 0));
        assertEquals(ErrorType.MISSING_FIELD, assertThrows(ChainException.class,
                () -> LeafHasher.responseLeaf(ASSET, CLIENT, 0, null, new byte[32], new byte[32], 0)).getErrorType());
    }
}
