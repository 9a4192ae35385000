package com.work.l2ingestion.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.l2ingestion.core.exception.InvalidArgumentException;
import com.work.l2ingestion.core.exception.NotFoundException;
import com.work.l2ingestion.core.exception.StorageException;
import com.work.l2ingestion.core.model.IndexedRecord;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.work.l2ingestion.core.support.ValidationUtils.requireNonNegative;
import static com.work.l2ingestion.core.support.ValidationUtils.requireNonNull;
import static com.work.l2ingestion.core.support.ValidationUtils.requireValidWatcherName;

/**
 * 基于 {@link KeyValueBackend} 的 OrderedStore 实现，value 为 UTF-8 JSON，指针为 UTF-8 十进制数字。
 *
 * <p>崩溃一致性：成员记录与 latest 指针在同一个 backend batch 里写入，指针不会先于记录可见。</p>
 */
public class TransportStore implements OrderedStore {

    private final KeyValueBackend backend;
    private final ObjectMapper objectMapper;

    public TransportStore(KeyValueBackend backend, ObjectMapper objectMapper) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public <T extends IndexedRecord> void putIndexed(RecordKind<T> kind, List<T> records) {
        requireNonNull(kind, "kind");
        if (records == null || records.isEmpty()) {
            throw new InvalidArgumentException("records 不能为空: kind=" + kind);
        }

        List<KeyValueBackend.Put> puts = new ArrayList<>(records.size() + 1);
        long previous = -1L;
        for (T record : records) {
            requireNonNull(record, "record");
            long index = record.getIndex();
            if (index <= previous) {
                throw new InvalidArgumentException("index 必须严格递增: kind=" + kind
                        + " previous=" + previous + " index=" + index);
            }
            previous = index;
            puts.add(new KeyValueBackend.Put(KeyCodec.indexKey(kind, index), encode(record)));
        }

        // 重放旧区间时指针保持不动
        long latest = previous;
        Optional<Long> current = readNumber(kind.latestKey());
        if (current.isPresent() && current.get() > latest) {
            latest = current.get();
        }
        puts.add(new KeyValueBackend.Put(kind.latestKey(), encodeNumber(latest)));
        backend.batch(puts);
    }

    @Override
    public <T extends IndexedRecord> T getByIndex(RecordKind<T> kind, long index) {
        requireNonNull(kind, "kind");
        String key = KeyCodec.indexKey(kind, index);
        byte[] value = backend.get(key)
                .orElseThrow(() -> new NotFoundException("record not found: " + key));
        return decode(value, kind.getRecordType());
    }

    @Override
    public <T extends IndexedRecord> List<T> getRange(RecordKind<T> kind, long start, long end) {
        requireNonNull(kind, "kind");
        requireNonNegative(start, "start");
        if (end <= start) {
            return Collections.emptyList();
        }
        List<byte[]> values = backend.scan(KeyCodec.indexKey(kind, start), KeyCodec.indexKey(kind, end));
        List<T> out = new ArrayList<>(values.size());
        for (byte[] value : values) {
            out.add(decode(value, kind.getRecordType()));
        }
        return out;
    }

    @Override
    public long getLatest(RecordKind<?> kind) {
        requireNonNull(kind, "kind");
        return readNumber(kind.latestKey())
                .orElseThrow(() -> new NotFoundException("nothing written for kind " + kind));
    }

    @Override
    public <T extends IndexedRecord> T getLatestRecord(RecordKind<T> kind) {
        return getByIndex(kind, getLatest(kind));
    }

    @Override
    public long getHighestSyncedBlock() {
        return readNumber(KeyCodec.SYNCED_HIGHEST_KEY)
                .orElseThrow(() -> new NotFoundException("synchronization cursor not initialized"));
    }

    @Override
    public void putHighestSyncedBlock(long blockNumber) {
        requireNonNegative(blockNumber, "blockNumber");
        Optional<Long> current = readNumber(KeyCodec.SYNCED_HIGHEST_KEY);
        if (current.isPresent() && current.get() > blockNumber) {
            throw new InvalidArgumentException("synchronization cursor cannot move backward: current="
                    + current.get() + " requested=" + blockNumber);
        }
        backend.put(KeyCodec.SYNCED_HIGHEST_KEY, encodeNumber(blockNumber));
    }

    @Override
    public long getScanCursor(String watcherName) {
        String key = KeyCodec.eventCursorKey(requireValidWatcherName(watcherName));
        return readNumber(key)
                .orElseThrow(() -> new NotFoundException("no scan cursor for watcher " + watcherName));
    }

    @Override
    public void putScanCursor(String watcherName, long blockNumber) {
        requireNonNegative(blockNumber, "blockNumber");
        backend.put(KeyCodec.eventCursorKey(requireValidWatcherName(watcherName)), encodeNumber(blockNumber));
    }

    private byte[] encode(Object record) {
        try {
            return objectMapper.writeValueAsBytes(record);
        } catch (JsonProcessingException e) {
            throw new StorageException("序列化记录失败: " + record.getClass().getSimpleName(), e);
        }
    }

    private <T> T decode(byte[] value, Class<T> type) {
        try {
            return objectMapper.readValue(value, type);
        } catch (IOException e) {
            throw new StorageException("反序列化记录失败: " + type.getSimpleName(), e);
        }
    }

    private Optional<Long> readNumber(String key) {
        Optional<byte[]> raw = backend.get(key);
        if (!raw.isPresent()) {
            return Optional.empty();
        }
        String text = new String(raw.get(), StandardCharsets.UTF_8).trim();
        try {
            return Optional.of(Long.parseLong(text));
        } catch (NumberFormatException e) {
            throw new StorageException("corrupt numeric value under key " + key + ": " + text, e);
        }
    }

    private static byte[] encodeNumber(long value) {
        return Long.toString(value).getBytes(StandardCharsets.UTF_8);
    }
}
