package com.work.l2ingestion.ingestion.support.metrics;

/**
 * 可观测性端口（不强依赖 Micrometer/Prometheus）。
 *
 * 设计目标：
 * - engine 只调用接口，不绑定具体 metrics 实现
 * - 业务/平台可通过自定义 Bean 接入 Micrometer 等实现
 */
public interface IngestionMetrics {

    default void iteration(String outcome) {
    }

    default void blocksCommitted(int count) {
    }

    default void syncedHeight(long blockNumber) {
    }

    default void error(String action) {
    }
}
