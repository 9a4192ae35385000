package com.work.l2ingestion.ingestion.support.metrics;

/**
 * 默认 no-op 实现：保证工程在不引入任何 metrics 依赖时仍可运行。
 *
 * 若业务侧提供了自定义 IngestionMetrics Bean，会通过 @ConditionalOnMissingBean 覆盖。
 */
public class NoopIngestionMetrics implements IngestionMetrics {
}
