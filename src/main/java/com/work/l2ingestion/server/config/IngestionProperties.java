package com.work.l2ingestion.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 从 application.yml 读取 ingestion 配置，
 * 再由配置类转换为 engine 所需的 {@link com.work.l2ingestion.ingestion.engine.IngestionSettings}。
 */
@ConfigurationProperties(prefix = "ingestion")
public class IngestionProperties {

    /**
     * 是否启动后台同步线程（只读节点可以关闭）
     */
    private boolean enabled = true;

    private long l2ChainId;

    /**
     * 空闲轮询间隔，同时也是出错后的退避时长
     */
    private Duration pollingInterval = Duration.ofMillis(5000);

    /**
     * 每轮最多同步的区块数
     */
    private int transactionsPerPollingInterval = 1000;

    /**
     * true 时吞掉循环内所有异常并退避重试；false 时异常终止 engine
     */
    private boolean dangerouslyCatchAllErrors = false;

    /**
     * 老 sequencer 不支持 eth_getBlockRange 时打开，逐块并行拉取
     */
    private boolean legacySequencerCompatibility = false;

    /**
     * 兼容模式下并行拉取的线程数
     */
    private int fetchWorkers = 16;

    /**
     * engine 因异常终止时关闭应用并以非 0 退出码退出，交给外部 supervisor 重启
     */
    private boolean exitOnFailure = true;

    /**
     * 关闭时等待进行中的一轮同步完成的最长时间，超时后中断 engine 线程。
     */
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getL2ChainId() {
        return l2ChainId;
    }

    public void setL2ChainId(long l2ChainId) {
        this.l2ChainId = l2ChainId;
    }

    public Duration getPollingInterval() {
        return pollingInterval;
    }

    public void setPollingInterval(Duration pollingInterval) {
        this.pollingInterval = pollingInterval;
    }

    public int getTransactionsPerPollingInterval() {
        return transactionsPerPollingInterval;
    }

    public void setTransactionsPerPollingInterval(int transactionsPerPollingInterval) {
        this.transactionsPerPollingInterval = transactionsPerPollingInterval;
    }

    public boolean isDangerouslyCatchAllErrors() {
        return dangerouslyCatchAllErrors;
    }

    public void setDangerouslyCatchAllErrors(boolean dangerouslyCatchAllErrors) {
        this.dangerouslyCatchAllErrors = dangerouslyCatchAllErrors;
    }

    public boolean isLegacySequencerCompatibility() {
        return legacySequencerCompatibility;
    }

    public void setLegacySequencerCompatibility(boolean legacySequencerCompatibility) {
        this.legacySequencerCompatibility = legacySequencerCompatibility;
    }

    public int getFetchWorkers() {
        return fetchWorkers;
    }

    public void setFetchWorkers(int fetchWorkers) {
        this.fetchWorkers = fetchWorkers;
    }

    public boolean isExitOnFailure() {
        return exitOnFailure;
    }

    public void setExitOnFailure(boolean exitOnFailure) {
        this.exitOnFailure = exitOnFailure;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }
}
