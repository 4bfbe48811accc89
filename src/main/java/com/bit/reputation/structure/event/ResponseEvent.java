package com.bit.reputation.structure.event;

import com.bit.reputation.chain.ChainType;
import com.bit.reputation.chain.LeafHasher;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 对某条反馈的响应
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResponseEvent implements ChainEvent {
    private byte[] asset;
    private byte[] client;
    private long feedbackIndex;
    private byte[] responder;
    private byte[] responseHash;
    private byte[] feedbackHash;   // 被响应反馈的sealHash
    private long slot;
    private byte[] storedDigest;

    @Override
    public ChainType chainType() {
        return ChainType.RESPONSE;
    }

    @Override
    public byte[] computeLeaf() {
        return LeafHasher.responseLeaf(asset, client, feedbackIndex, responder, responseHash, feedbackHash, slot);
    }
}
