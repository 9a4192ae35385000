package com.work.l2ingestion.core.store.impl;

import com.work.l2ingestion.core.exception.StorageException;
import com.work.l2ingestion.core.store.KeyValueBackend;
import com.work.l2ingestion.core.store.entity.KvEntryEntity;
import com.work.l2ingestion.core.store.mapper.KvEntryMapper;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.work.l2ingestion.core.support.ValidationUtils.requireNonEmpty;
import static com.work.l2ingestion.core.support.ValidationUtils.requireNonNull;

/**
 * 基于 PostgreSQL + MyBatis-Plus 的 KeyValueBackend。
 *
 * 注意：
 * 1. batch 在一个 READ_COMMITTED 事务里逐条 upsert，提交前对读方不可见
 * 2. Spring 的 DataAccessException / TransactionException 统一转换为 StorageException
 */
public class PostgresKeyValueBackend implements KeyValueBackend {

    private final KvEntryMapper mapper;
    private final TransactionTemplate transactionTemplate;

    public PostgresKeyValueBackend(KvEntryMapper mapper, PlatformTransactionManager transactionManager) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.transactionTemplate = new TransactionTemplate(Objects.requireNonNull(transactionManager, "transactionManager"));
        this.transactionTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
    }

    @Override
    public Optional<byte[]> get(String key) {
        requireNonEmpty(key, "key");
        try {
            KvEntryEntity entity = mapper.selectByKey(key);
            return entity == null ? Optional.empty() : Optional.ofNullable(entity.getKvValue());
        } catch (DataAccessException e) {
            throw new StorageException("读取 key 失败: " + key, e);
        }
    }

    @Override
    public void put(String key, byte[] value) {
        requireNonEmpty(key, "key");
        requireNonNull(value, "value");
        try {
            mapper.upsert(key, value, Instant.now());
        } catch (DataAccessException e) {
            throw new StorageException("写入 key 失败: " + key, e);
        }
    }

    @Override
    public void batch(List<Put> puts) {
        requireNonNull(puts, "puts");
        if (puts.isEmpty()) {
            return;
        }
        Instant now = Instant.now();
        try {
            transactionTemplate.executeWithoutResult(status -> {
                for (Put put : puts) {
                    mapper.upsert(put.getKey(), put.getValue(), now);
                }
            });
        } catch (DataAccessException | TransactionException e) {
            throw new StorageException("批量写入失败 (size=" + puts.size() + ")", e);
        }
    }

    @Override
    public List<byte[]> scan(String gte, String lt) {
        requireNonEmpty(gte, "gte");
        requireNonEmpty(lt, "lt");
        try {
            List<KvEntryEntity> rows = mapper.scanRange(gte, lt);
            List<byte[]> values = new ArrayList<>(rows.size());
            for (KvEntryEntity row : rows) {
                values.add(row.getKvValue());
            }
            return values;
        } catch (DataAccessException e) {
            throw new StorageException("区间扫描失败: [" + gte + ", " + lt + ")", e);
        }
    }
}
