package com.work.l2ingestion.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.l2ingestion.core.cache.RecordCache;
import com.work.l2ingestion.core.store.KeyValueBackend;
import com.work.l2ingestion.core.store.OrderedStore;
import com.work.l2ingestion.core.store.TransportStore;
import com.work.l2ingestion.core.support.InMemoryKeyValueBackend;
import com.work.l2ingestion.ingestion.chain.BlockFetcher;
import com.work.l2ingestion.ingestion.chain.FetchStrategy;
import com.work.l2ingestion.ingestion.chain.MockBlockFetcher;
import com.work.l2ingestion.ingestion.decoder.SequencerBlockDecoder;
import com.work.l2ingestion.ingestion.decoder.SequencerBlockHandler;
import com.work.l2ingestion.ingestion.engine.ErrorPolicy;
import com.work.l2ingestion.ingestion.engine.IngestionSettings;
import com.work.l2ingestion.ingestion.engine.L2IngestionEngine;
import com.work.l2ingestion.ingestion.support.metrics.IngestionMetrics;
import com.work.l2ingestion.ingestion.support.metrics.NoopIngestionMetrics;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 将存储、decoder、engine 装配为 Spring Bean。
 * 生产环境使用 PostgreSQL（PostgresStoreConfiguration）+ Web3j（Web3jConfiguration）。
 */
@Configuration
@EnableConfigurationProperties({IngestionProperties.class, ChainProperties.class, StoreProperties.class})
public class IngestionComponentConfiguration {

    @Bean
    @ConditionalOnProperty(prefix = "store", name = "backend", havingValue = "memory")
    public KeyValueBackend inMemoryKeyValueBackend() {
        return new InMemoryKeyValueBackend();
    }

    @Bean
    public OrderedStore transportStore(KeyValueBackend keyValueBackend, ObjectMapper objectMapper) {
        return new TransportStore(keyValueBackend, objectMapper);
    }

    @Bean
    public RecordCache recordCache(StoreProperties properties) {
        return new RecordCache(properties.isCacheEnabled(), properties.getCacheSize(), properties.getCacheTimeout());
    }

    /**
     * 参数非法时在这里抛出 ConfigurationException，应用启动失败。
     */
    @Bean
    public IngestionSettings ingestionSettings(IngestionProperties properties) {
        return new IngestionSettings(
                properties.getL2ChainId(),
                properties.getPollingInterval(),
                properties.getTransactionsPerPollingInterval(),
                ErrorPolicy.fromCatchAllFlag(properties.isDangerouslyCatchAllErrors()),
                properties.isLegacySequencerCompatibility() ? FetchStrategy.COMPATIBILITY : FetchStrategy.BULK
        );
    }

    /**
     * 默认使用 mock 链；若设置 chain.mode=web3j，将由 Web3jConfiguration 提供实现
     */
    @Bean
    @ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "mock", matchIfMissing = true)
    public BlockFetcher mockBlockFetcher(ObjectMapper objectMapper,
                                         IngestionSettings settings,
                                         ChainProperties chainProperties) {
        return new MockBlockFetcher(objectMapper, settings.getL2ChainId(), chainProperties.getMockInitialHeight());
    }

    @Bean
    @ConditionalOnMissingBean(SequencerBlockDecoder.class)
    public SequencerBlockDecoder sequencerBlockDecoder() {
        return new SequencerBlockHandler();
    }

    @Bean
    @ConditionalOnMissingBean(IngestionMetrics.class)
    public IngestionMetrics ingestionMetrics() {
        return new NoopIngestionMetrics();
    }

    @Bean
    public L2IngestionEngine l2IngestionEngine(OrderedStore store,
                                               BlockFetcher blockFetcher,
                                               SequencerBlockDecoder decoder,
                                               IngestionSettings settings,
                                               IngestionMetrics metrics) {
        return new L2IngestionEngine(store, blockFetcher, decoder, settings, metrics);
    }
}
