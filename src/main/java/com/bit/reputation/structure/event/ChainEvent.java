package com.bit.reputation.structure.event;

import com.bit.reputation.chain.ChainType;

/**
 * 可被重放的链上事件
 */
public interface ChainEvent {

    ChainType chainType();

    long getFeedbackIndex();

    long getSlot();

    /**
     * 索引器声称的该事件之后的累计摘要，可能为null（索引器未提供）
     */
    byte[] getStoredDigest();

    void setStoredDigest(byte[] storedDigest);

    /**
     * 由事件标识字段计算叶子哈希
     */
    byte[] computeLeaf();
}
