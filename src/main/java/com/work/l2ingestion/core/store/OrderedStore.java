package com.work.l2ingestion.core.store;

import com.work.l2ingestion.core.model.IndexedRecord;

import java.util.List;

/**
 * ingestion 使用的有序存储。假定每个 kind 只有一个写入方（单 engine 实例），不做并发写仲裁。
 */
public interface OrderedStore {

    /**
     * 原子写入一批记录并推进 latest 指针到批内最大 index（指针只前进不后退）。
     *
     * @throws com.work.l2ingestion.core.exception.InvalidArgumentException 批次为空或 index 非严格递增
     */
    <T extends IndexedRecord> void putIndexed(RecordKind<T> kind, List<T> records);

    /**
     * @throws com.work.l2ingestion.core.exception.NotFoundException 不存在
     */
    <T extends IndexedRecord> T getByIndex(RecordKind<T> kind, long index);

    /**
     * 半开区间 {@code [start, end)}，升序，可能为空。
     */
    <T extends IndexedRecord> List<T> getRange(RecordKind<T> kind, long start, long end);

    /**
     * @throws com.work.l2ingestion.core.exception.NotFoundException 该 kind 从未写入
     */
    long getLatest(RecordKind<?> kind);

    <T extends IndexedRecord> T getLatestRecord(RecordKind<T> kind);

    /**
     * engine 的同步游标（已提交的最高 L2 区块）。
     *
     * @throws com.work.l2ingestion.core.exception.NotFoundException 从未写入
     */
    long getHighestSyncedBlock();

    /**
     * 只允许前进或保持不变，回退会抛 InvalidArgumentException。
     */
    void putHighestSyncedBlock(long blockNumber);

    /**
     * 事件扫描游标，与 index 记录互不关联。
     *
     * @throws com.work.l2ingestion.core.exception.NotFoundException 从未写入
     */
    long getScanCursor(String watcherName);

    void putScanCursor(String watcherName, long blockNumber);
}
