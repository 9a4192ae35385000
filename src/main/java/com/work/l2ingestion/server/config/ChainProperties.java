package com.work.l2ingestion.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * L2 节点连接配置。
 *
 * mode=mock: 使用 MockBlockFetcher
 * mode=web3j: 使用 Web3jBlockFetcher
 */
@ConfigurationProperties(prefix = "chain")
public class ChainProperties {

    /**
     * mock 或 web3j
     */
    private String mode = "mock";

    /**
     * L2 sequencer HTTP RPC 地址，例如 http://localhost:8545
     */
    private String rpcUrl = "http://localhost:8545";

    /**
     * 单次 RPC 请求超时（connect / read / write 共用）
     */
    private Duration requestTimeout = Duration.ofSeconds(10);

    /**
     * mock 链的初始高度
     */
    private long mockInitialHeight = 1L;

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public String getRpcUrl() {
        return rpcUrl;
    }

    public void setRpcUrl(String rpcUrl) {
        this.rpcUrl = rpcUrl;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public long getMockInitialHeight() {
        return mockInitialHeight;
    }

    public void setMockInitialHeight(long mockInitialHeight) {
        this.mockInitialHeight = mockInitialHeight;
    }
}
