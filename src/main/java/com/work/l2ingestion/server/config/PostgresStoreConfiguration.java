package com.work.l2ingestion.server.config;

import com.work.l2ingestion.core.store.KeyValueBackend;
import com.work.l2ingestion.core.store.impl.PostgresKeyValueBackend;
import com.work.l2ingestion.core.store.mapper.KvEntryMapper;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * store.backend=postgres（默认）时启用，表结构见 schema.sql。
 */
@Configuration
@ConditionalOnProperty(prefix = "store", name = "backend", havingValue = "postgres", matchIfMissing = true)
@MapperScan("com.work.l2ingestion.core.store.mapper")
public class PostgresStoreConfiguration {

    @Bean
    public KeyValueBackend postgresKeyValueBackend(KvEntryMapper kvEntryMapper,
                                                   PlatformTransactionManager transactionManager) {
        return new PostgresKeyValueBackend(kvEntryMapper, transactionManager);
    }
}
