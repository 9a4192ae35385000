package com.work.l2ingestion.ingestion.engine;

import com.work.l2ingestion.core.exception.ConfigurationException;
import com.work.l2ingestion.ingestion.chain.FetchStrategy;

import java.time.Duration;

/**
 * engine 的不可变运行参数，构造时一次性校验，之后不再检查。
 */
public final class IngestionSettings {

    private final long l2ChainId;
    private final Duration pollingInterval;
    private final int batchSize;
    private final ErrorPolicy errorPolicy;
    private final FetchStrategy fetchStrategy;

    public IngestionSettings(long l2ChainId,
                             Duration pollingInterval,
                             int batchSize,
                             ErrorPolicy errorPolicy,
                             FetchStrategy fetchStrategy) {
        if (l2ChainId <= 0) {
            throw new ConfigurationException("l2ChainId 必须大于0: " + l2ChainId);
        }
        if (pollingInterval == null || pollingInterval.isNegative() || pollingInterval.isZero()) {
            throw new ConfigurationException("pollingInterval 必须大于0: " + pollingInterval);
        }
        if (batchSize <= 0) {
            throw new ConfigurationException("transactionsPerPollingInterval 必须大于0: " + batchSize);
        }
        if (errorPolicy == null) {
            throw new ConfigurationException("errorPolicy 不能为null");
        }
        if (fetchStrategy == null) {
            throw new ConfigurationException("fetchStrategy 不能为null");
        }
        this.l2ChainId = l2ChainId;
        this.pollingInterval = pollingInterval;
        this.batchSize = batchSize;
        this.errorPolicy = errorPolicy;
        this.fetchStrategy = fetchStrategy;
    }

    public long getL2ChainId() {
        return l2ChainId;
    }

    public Duration getPollingInterval() {
        return pollingInterval;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public ErrorPolicy getErrorPolicy() {
        return errorPolicy;
    }

    public FetchStrategy getFetchStrategy() {
        return fetchStrategy;
    }

    @Override
    public String toString() {
        return "IngestionSettings{l2ChainId=" + l2ChainId
                + ", pollingInterval=" + pollingInterval
                + ", batchSize=" + batchSize
                + ", errorPolicy=" + errorPolicy
                + ", fetchStrategy=" + fetchStrategy + "}";
    }
}
