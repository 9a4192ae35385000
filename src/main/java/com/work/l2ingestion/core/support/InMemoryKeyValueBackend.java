package com.work.l2ingestion.core.support;

import com.work.l2ingestion.core.store.KeyValueBackend;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 纯内存实现，方便在没有 Postgres 的环境下运行和测试。
 * 注意：该实现进程退出即丢失数据，不具备持久性。
 */
public class InMemoryKeyValueBackend implements KeyValueBackend {

    private final ConcurrentSkipListMap<String, byte[]> table = new ConcurrentSkipListMap<>();
    /** batch 持写锁、scan 持读锁，保证扫描看不到半个 batch。 */
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public Optional<byte[]> get(String key) {
        lock.readLock().lock();
        try {
            byte[] value = table.get(key);
            return value == null ? Optional.empty() : Optional.of(Arrays.copyOf(value, value.length));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void put(String key, byte[] value) {
        lock.writeLock().lock();
        try {
            table.put(key, Arrays.copyOf(value, value.length));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void batch(List<Put> puts) {
        lock.writeLock().lock();
        try {
            for (Put put : puts) {
                table.put(put.getKey(), Arrays.copyOf(put.getValue(), put.getValue().length));
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<byte[]> scan(String gte, String lt) {
        if (gte.compareTo(lt) >= 0) {
            return new ArrayList<>();
        }
        lock.readLock().lock();
        try {
            NavigableMap<String, byte[]> range = table.subMap(gte, true, lt, false);
            List<byte[]> values = new ArrayList<>(range.size());
            for (byte[] value : range.values()) {
                values.add(Arrays.copyOf(value, value.length));
            }
            return values;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        return table.size();
    }
}
