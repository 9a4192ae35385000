package com.work.l2ingestion.core.store;

import com.work.l2ingestion.core.model.EnqueueEntry;
import com.work.l2ingestion.core.model.IndexedRecord;
import com.work.l2ingestion.core.model.StateRootBatchEntry;
import com.work.l2ingestion.core.model.StateRootEntry;
import com.work.l2ingestion.core.model.TransactionBatchEntry;
import com.work.l2ingestion.core.model.TransactionEntry;

import java.util.Objects;

/**
 * 一类按 index 存储的记录：记录 key 位于 {@code <namespace>:<32 位 index>}，
 * latest 指针位于 {@code <kind>:latest}，二者不在同一个 key 区间内，区间扫描永远看不到指针。
 *
 * @param <T> 记录类型
 */
public final class RecordKind<T extends IndexedRecord> {

    public static final RecordKind<EnqueueEntry> ENQUEUE =
            new RecordKind<>("enqueue", EnqueueEntry.class);
    public static final RecordKind<TransactionEntry> TRANSACTION =
            new RecordKind<>("transaction", TransactionEntry.class);
    public static final RecordKind<TransactionBatchEntry> TRANSACTION_BATCH =
            new RecordKind<>("batch:transaction", TransactionBatchEntry.class);
    public static final RecordKind<StateRootEntry> STATE_ROOT =
            new RecordKind<>("stateroot", StateRootEntry.class);
    public static final RecordKind<StateRootBatchEntry> STATE_ROOT_BATCH =
            new RecordKind<>("batch:stateroot", StateRootBatchEntry.class);
    public static final RecordKind<TransactionEntry> UNCONFIRMED_TRANSACTION =
            new RecordKind<>("unconfirmed:transaction", TransactionEntry.class);
    public static final RecordKind<StateRootEntry> UNCONFIRMED_STATE_ROOT =
            new RecordKind<>("unconfirmed:stateroot", StateRootEntry.class);

    private final String name;
    private final Class<T> recordType;

    private RecordKind(String name, Class<T> recordType) {
        this.name = Objects.requireNonNull(name, "name");
        this.recordType = Objects.requireNonNull(recordType, "recordType");
    }

    public String getName() {
        return name;
    }

    public Class<T> getRecordType() {
        return recordType;
    }

    /**
     * 记录 key 的命名空间，例如 {@code enqueue:index}。
     */
    public String indexNamespace() {
        return name + ":index";
    }

    /**
     * latest 指针 key，例如 {@code enqueue:latest}。
     */
    public String latestKey() {
        return name + ":latest";
    }

    @Override
    public String toString() {
        return name;
    }
}
