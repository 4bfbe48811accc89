package com.bit.reputation.structure.chain;

import com.bit.reputation.structure.event.ChainEvent;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 索引器分页返回的一批有序事件
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReplayPage {
    private List<ChainEvent> events;
    private boolean hasMore;
    private long nextFromCount;    // 下一页的起始位置（已返回事件数之后）
}
