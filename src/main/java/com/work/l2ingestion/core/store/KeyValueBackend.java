package com.work.l2ingestion.core.store;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 面向字节的有序 KV 后端。key 为 ASCII，按字节序排序。
 *
 * <p>实现需要保证 {@link #batch(List)} 原子生效：要么全部可见，要么全部不可见。</p>
 */
public interface KeyValueBackend {

    Optional<byte[]> get(String key);

    void put(String key, byte[] value);

    void batch(List<Put> puts);

    /**
     * 返回 {@code gte <= key < lt} 的全部 value，按 key 升序。
     */
    List<byte[]> scan(String gte, String lt);

    /**
     * batch 内的一次写入。
     */
    final class Put {

        private final String key;
        private final byte[] value;

        public Put(String key, byte[] value) {
            this.key = Objects.requireNonNull(key, "key");
            this.value = Objects.requireNonNull(value, "value");
        }

        public String getKey() {
            return key;
        }

        public byte[] getValue() {
            return value;
        }
    }
}
