package com.work.l2ingestion.core.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.work.l2ingestion.core.model.IndexedRecord;
import com.work.l2ingestion.core.store.RecordKind;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 封装 Caffeine 缓存，缓存按 index 查询到的记录。
 * 记录写入后只会被等值覆盖，所以缓存项不需要主动失效。
 */
public class RecordCache {

    private final Cache<String, IndexedRecord> cache;
    private final boolean cacheEnabled;

    public RecordCache(boolean cacheEnabled, long maximumSize, Duration expireAfterWrite) {
        this.cacheEnabled = cacheEnabled;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(expireAfterWrite)
                .build();
    }

    public <T extends IndexedRecord> Optional<T> getIfPresent(RecordKind<T> kind, long index) {
        if (!cacheEnabled) {
            return Optional.empty();
        }
        IndexedRecord record = cache.getIfPresent(cacheKey(kind, index));
        if (record == null) {
            return Optional.empty();
        }
        return Optional.of(kind.getRecordType().cast(record));
    }

    /**
     * 命中直接返回；未命中时调用 loader，loader 抛出的异常（例如 NotFound）原样透传且不缓存。
     */
    public <T extends IndexedRecord> T get(RecordKind<T> kind, long index, Supplier<T> loader) {
        Optional<T> cached = getIfPresent(kind, index);
        if (cached.isPresent()) {
            return cached.get();
        }
        T loaded = loader.get();
        if (cacheEnabled && loaded != null) {
            cache.put(cacheKey(kind, index), loaded);
        }
        return loaded;
    }

    private static String cacheKey(RecordKind<?> kind, long index) {
        return kind.getName() + "#" + index;
    }
}
