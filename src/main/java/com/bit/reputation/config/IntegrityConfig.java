package com.bit.reputation.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Slf4j
@Data
@Component
@ConfigurationProperties(prefix = "integrity")
public class IntegrityConfig {
    private long fetchTimeoutMs = 10_000;//每次远程查询的最长等待
    private int ioThreads = 8;

    private Deep deep = new Deep();
    private Full full = new Full();
    private Cache cache = new Cache();
    private Memory memory = new Memory();

    @Data
    public static class Deep {
        private int spotChecks = 3;//边界之外额外的随机抽检数
        private boolean checkBoundaries = true;
        private boolean verifyContent = false;
    }

    @Data
    public static class Full {
        private int batchSize = 1000;
        private boolean useCheckpoints = true;
    }

    @Data
    public static class Cache {
        private long maxAgents = 100_000;
        private long expireMinutes = 1440;
    }

    @Data
    public static class Memory {
        private long checkpointInterval = 1000;//内存索引器每N条事件生成一个检查点
    }

    @PostConstruct
    public void init() {
        log.info("完整性校验配置: 超时{}ms, IO线程{}, 抽检{}(边界:{}, 内容:{}), 全量分页{}(检查点:{})",
                fetchTimeoutMs, ioThreads, deep.spotChecks, deep.checkBoundaries, deep.verifyContent,
                full.batchSize, full.useCheckpoints);
    }
}
