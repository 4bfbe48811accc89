package com.bit.reputation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication(scanBasePackages = "com.bit.reputation")
public class ReputationIntegrityApplication {
    public static void main(String[] args) {
        SpringApplication.run(ReputationIntegrityApplication.class, args);
        log.info("信誉哈希链完整性校验服务已启动");
    }
    //链上整数统一小端
}
