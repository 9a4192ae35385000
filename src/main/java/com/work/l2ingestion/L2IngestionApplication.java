package com.work.l2ingestion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot 启动入口：启动后后台线程持续同步 sequencer 区块，REST 接口提供按 index 查询。
 */
@SpringBootApplication
public class L2IngestionApplication {

    public static void main(String[] args) {
        SpringApplication.run(L2IngestionApplication.class, args);
    }
}
