package com.bit.reputation.structure.event;

import com.bit.reputation.chain.ChainType;
import com.bit.reputation.chain.LeafHasher;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RevokeEvent implements ChainEvent {
    private byte[] asset;
    private byte[] client;
    private long feedbackIndex;
    private byte[] feedbackHash;   // 被撤销反馈的sealHash
    private long slot;
    private byte[] storedDigest;

    @Override
    public ChainType chainType() {
        return ChainType.REVOKE;
    }

    @Override
    public byte[] computeLeaf() {
        return LeafHasher.revokeLeaf(asset, client, feedbackIndex, feedbackHash, slot);
    }
}
