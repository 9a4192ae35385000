package com.work.l2ingestion.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 存储后端配置。
 *
 * backend=postgres: PostgresKeyValueBackend（生产）
 * backend=memory: InMemoryKeyValueBackend（本地调试，进程退出即丢失）
 */
@ConfigurationProperties(prefix = "store")
public class StoreProperties {

    private String backend = "postgres";

    /**
     * 查询侧记录缓存
     */
    private boolean cacheEnabled = true;
    private long cacheSize = 10_000L;
    private Duration cacheTimeout = Duration.ofMinutes(10);

    public String getBackend() {
        return backend;
    }

    public void setBackend(String backend) {
        this.backend = backend;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public void setCacheEnabled(boolean cacheEnabled) {
        this.cacheEnabled = cacheEnabled;
    }

    public long getCacheSize() {
        return cacheSize;
    }

    public void setCacheSize(long cacheSize) {
        this.cacheSize = cacheSize;
    }

    public Duration getCacheTimeout() {
        return cacheTimeout;
    }

    public void setCacheTimeout(Duration cacheTimeout) {
        this.cacheTimeout = cacheTimeout;
    }
}
