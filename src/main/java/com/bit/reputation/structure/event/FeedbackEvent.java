package com.bit.reputation.structure.event;

import com.bit.reputation.chain.ChainType;
import com.bit.reputation.chain.LeafHasher;
import com.bit.reputation.structure.seal.SealParams;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 反馈事件
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackEvent implements ChainEvent {
    private byte[] asset;          // agent资产公钥（32字节）
    private byte[] client;         // 反馈提交者（32字节）
    private long feedbackIndex;    // 每个 asset+client 唯一且递增
    private byte[] sealHash;       // 内容指纹（32字节）
    private long slot;             // 提交时的slot
    private byte[] storedDigest;   // 索引器声称的累计摘要
    private SealParams content;    // 索引器返回的原始内容，仅用于内容校验，不参与叶子

    @Override
    public ChainType chainType() {
        return ChainType.FEEDBACK;
    }

    @Override
    public byte[] computeLeaf() {
        return LeafHasher.feedbackLeaf(asset, client, feedbackIndex, sealHash, slot);
    }
}
