package com.work.l2ingestion.server.config;

import com.work.l2ingestion.ingestion.chain.BlockFetcher;
import com.work.l2ingestion.ingestion.chain.FetchStrategy;
import com.work.l2ingestion.ingestion.chain.Web3jBlockFetcher;
import com.work.l2ingestion.ingestion.engine.IngestionSettings;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3jService;
import org.web3j.protocol.http.HttpService;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Web3j 装配：
 * 当 chain.mode=web3j 时启用。
 */
@Configuration
@ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "web3j")
public class Web3jConfiguration {

    private static final Logger log = LoggerFactory.getLogger(Web3jConfiguration.class);

    @Bean(destroyMethod = "close")
    public HttpService web3jService(ChainProperties properties) {
        OkHttpClient client = new OkHttpClient.Builder()
                .connectTimeout(properties.getRequestTimeout())
                .readTimeout(properties.getRequestTimeout())
                .writeTimeout(properties.getRequestTimeout())
                .build();
        return new HttpService(properties.getRpcUrl(), client);
    }

    /**
     * 兼容模式的 fan-out 线程池；BULK 模式下不会被使用。
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService blockFetchExecutor(IngestionProperties properties) {
        int workers = Math.max(1, properties.getFetchWorkers());
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory tf = r -> {
            Thread t = new Thread(r);
            t.setName("block-fetch-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(workers, tf);
    }

    @Bean
    public BlockFetcher web3jBlockFetcher(Web3jService web3jService,
                                         IngestionSettings settings,
                                         ExecutorService blockFetchExecutor) {
        if (settings.getFetchStrategy() == FetchStrategy.COMPATIBILITY) {
            log.info("Using legacy sync, this will be quite a bit slower than normal");
        }
        return new Web3jBlockFetcher(web3jService, settings.getFetchStrategy(), blockFetchExecutor);
    }
}
