package com.bit.reputation.structure.chain;

import com.bit.reputation.common.Digest;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 可恢复的最小检查点：(摘要, 事件数)
 * 不可变，可以在线程间共享
 */
@Getter
@ToString
@EqualsAndHashCode
public class ChainState {

    public static final ChainState GENESIS = new ChainState(Digest.ZERO, 0);

    private final Digest digest;
    private final long count;

    public ChainState(Digest digest, long count) {
        if (digest == null) {
            throw new IllegalArgumentException("digest不能为空");
        }
        if (count < 0) {
            throw new IllegalArgumentException("count不能为负数: " + count);
        }
        this.digest = digest;
        this.count = count;
    }

    public static ChainState of(Digest digest, long count) {
        return new ChainState(digest, count);
    }
}
