package com.bit.reputation.structure.dto;

import com.bit.reputation.chain.ChainType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单条链的链上/索引器对比
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChainIntegrity {
    private ChainType chainType;
    private String onChainDigest;
    private String indexerDigest;
    private long countOnChain;
    private long countIndexer;
    private long lag;              // 链上 - 索引器，负数保留原值
    private boolean digestMatch;   // 计数相同且摘要相同
}
