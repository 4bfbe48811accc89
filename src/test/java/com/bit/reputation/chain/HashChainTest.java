package com.bit.reputation.chain;

import com.bit.reputation.util.ByteUtils;
import com.bit.reputation.util.Keccak;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class HashChainTest {

    @Test
    void testDomainTagLengths() {
        assertEquals(16, ChainType.FEEDBACK.domain().length);
        assertEquals(16, ChainType.RESPONSE.domain().length);
        assertEquals(14, ChainType.REVOKE.domain().length, "撤销链标签必须保持14字节");
        assertEquals("8004_REVOKE_V1", new String(ChainType.REVOKE.domain(), StandardCharsets.US_ASCII));
        assertEquals(16, DomainTags.seal().length);
        assertEquals(16, DomainTags.feedbackLeaf().length);
    }

    @Test
    void testChainHashIsPlainConcatenation() {
        byte[] prev = ByteUtils.filled(32, 0x01);
        byte[] leaf = ByteUtils.filled(32, 0x02);
        for (ChainType chainType : ChainType.values()) {
            byte[] expected = Keccak.keccak256(ByteUtils.concat(prev, chainType.domain(), leaf));
            assertArrayEquals(expected, HashChain.chainHash(prev, chainType, leaf), chainType.getCode() + "链哈希不一致");
        }
    }

    @Test
    void testChainsAreDomainSeparated() {
        byte[] prev = new byte[32];
        byte[] leaf = ByteUtils.filled(32, 0x07);
        String feedback = ByteUtils.bytesToHex(HashChain.chainHash(prev, ChainType.FEEDBACK, leaf));
        String response = ByteUtils.bytesToHex(HashChain.chainHash(prev, ChainType.RESPONSE, leaf));
        String revoke = ByteUtils.bytesToHex(HashChain.chainHash(prev, ChainType.REVOKE, leaf));
        assertNotEquals(feedback, response);
        assertNotEquals(feedback, revoke);
        assertNotEquals(response, revoke);
    }

    @Test
    void testAnyDomainLengthIsHashed() {
        byte[] prev = ByteUtils.filled(32, 0x03);
        byte[] leaf = ByteUtils.filled(32, 0x04);
        for (int length : new int[]{0, 1, 15, 32}) {
            byte[] domain = ByteUtils.filled(length, 0x41);
            assertArrayEquals(Keccak.keccak256(ByteUtils.concat(prev, domain, leaf)),
                    HashChain.chainHash(prev, domain, leaf), length + "字节的domain应按原样拼接");
        }
    }

    @Test
    void testRejectsInvalidInputs() {
        byte[] ok = new byte[32];
        assertEquals(ErrorType.MISSING_FIELD, assertThrows(ChainException.class,
                () -> HashChain.chainHash(ok, (byte[]) null, ok)).getErrorType());
        assertEquals(ErrorType.INVALID_LENGTH, assertThrows(ChainException.class,
                () -> HashChain.chainHash(new byte[31], ChainType.FEEDBACK, ok)).getErrorType());
        assertEquals(ErrorType.INVALID_LENGTH, assertThrows(ChainException.class,
                () -> HashChain.chainHash(ok, ChainType.FEEDBACK, new byte[64])).getErrorType());
    }
}
