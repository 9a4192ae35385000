package com.work.l2ingestion.server.service;

import com.work.l2ingestion.core.cache.RecordCache;
import com.work.l2ingestion.core.exception.InvalidArgumentException;
import com.work.l2ingestion.core.exception.NotFoundException;
import com.work.l2ingestion.core.model.EnqueueEntry;
import com.work.l2ingestion.core.model.IndexedRecord;
import com.work.l2ingestion.core.model.StateRootBatchEntry;
import com.work.l2ingestion.core.model.StateRootEntry;
import com.work.l2ingestion.core.model.TransactionBatchEntry;
import com.work.l2ingestion.core.model.TransactionEntry;
import com.work.l2ingestion.core.store.OrderedStore;
import com.work.l2ingestion.core.store.RecordKind;
import com.work.l2ingestion.core.support.ValidationUtils;
import com.work.l2ingestion.server.web.dto.EventCursorResponse;
import com.work.l2ingestion.server.web.dto.StateRootBatchResponse;
import com.work.l2ingestion.server.web.dto.StateRootResponse;
import com.work.l2ingestion.server.web.dto.SyncStatusResponse;
import com.work.l2ingestion.server.web.dto.TransactionBatchResponse;
import com.work.l2ingestion.server.web.dto.TransactionResponse;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 面向下游消费者的只读查询。按 index 的查询走 RecordCache，latest / range 直接读存储。
 */
@Service
public class TransportQueryService {

    /**
     * 单次 range 查询允许的最大跨度。
     */
    public static final long MAX_RANGE_SIZE = 1000L;

    private final OrderedStore store;
    private final RecordCache cache;

    public TransportQueryService(OrderedStore store, RecordCache cache) {
        this.store = store;
        this.cache = cache;
    }

    /**
     * unconfirmed 交易的最新 index 视为已知最高点，confirmed 交易的最新 index 视为当前进度。
     */
    public SyncStatusResponse getSyncStatus() {
        Long highestKnown = latestOrNull(RecordKind.UNCONFIRMED_TRANSACTION);
        Long current = latestOrNull(RecordKind.TRANSACTION);
        Long highestSynced;
        try {
            highestSynced = store.getHighestSyncedBlock();
        } catch (NotFoundException e) {
            highestSynced = null;
        }
        boolean syncing = highestKnown != null && (current == null || current < highestKnown);
        return new SyncStatusResponse(syncing, highestKnown, current, highestSynced);
    }

    public EnqueueEntry getEnqueue(long index) {
        return lookup(RecordKind.ENQUEUE, index);
    }

    public EnqueueEntry getLatestEnqueue() {
        return lookup(RecordKind.ENQUEUE, store.getLatest(RecordKind.ENQUEUE));
    }

    public TransactionResponse getTransaction(long index) {
        TransactionEntry tx = lookup(RecordKind.TRANSACTION, index);
        return new TransactionResponse(tx, batchOf(RecordKind.TRANSACTION_BATCH, tx.getBatchIndex()));
    }

    public TransactionResponse getLatestTransaction() {
        return getTransaction(store.getLatest(RecordKind.TRANSACTION));
    }

    public TransactionResponse getUnconfirmedTransaction(long index) {
        return new TransactionResponse(lookup(RecordKind.UNCONFIRMED_TRANSACTION, index), null);
    }

    public TransactionResponse getLatestUnconfirmedTransaction() {
        return getUnconfirmedTransaction(store.getLatest(RecordKind.UNCONFIRMED_TRANSACTION));
    }

    /**
     * @param unconfirmed true 时读 sequencer 同步下来的 unconfirmed 交易
     */
    public List<TransactionEntry> getTransactionRange(long start, long end, boolean unconfirmed) {
        checkRange(start, end);
        RecordKind<TransactionEntry> kind = unconfirmed ? RecordKind.UNCONFIRMED_TRANSACTION : RecordKind.TRANSACTION;
        return store.getRange(kind, start, end);
    }

    public TransactionBatchResponse getTransactionBatch(long index) {
        TransactionBatchEntry batch = lookup(RecordKind.TRANSACTION_BATCH, index);
        List<TransactionEntry> members = store.getRange(RecordKind.TRANSACTION,
                batch.firstElementIndex(), batch.endElementIndex());
        return new TransactionBatchResponse(batch, members);
    }

    public TransactionBatchResponse getLatestTransactionBatch() {
        return getTransactionBatch(store.getLatest(RecordKind.TRANSACTION_BATCH));
    }

    public StateRootResponse getStateRoot(long index) {
        StateRootEntry root = lookup(RecordKind.STATE_ROOT, index);
        return new StateRootResponse(root, batchOf(RecordKind.STATE_ROOT_BATCH, root.getBatchIndex()));
    }

    public StateRootResponse getLatestStateRoot() {
        return getStateRoot(store.getLatest(RecordKind.STATE_ROOT));
    }

    public StateRootResponse getUnconfirmedStateRoot(long index) {
        return new StateRootResponse(lookup(RecordKind.UNCONFIRMED_STATE_ROOT, index), null);
    }

    public StateRootResponse getLatestUnconfirmedStateRoot() {
        return getUnconfirmedStateRoot(store.getLatest(RecordKind.UNCONFIRMED_STATE_ROOT));
    }

    public StateRootBatchResponse getStateRootBatch(long index) {
        StateRootBatchEntry batch = lookup(RecordKind.STATE_ROOT_BATCH, index);
        List<StateRootEntry> members = store.getRange(RecordKind.STATE_ROOT,
                batch.firstElementIndex(), batch.endElementIndex());
        return new StateRootBatchResponse(batch, members);
    }

    public StateRootBatchResponse getLatestStateRootBatch() {
        return getStateRootBatch(store.getLatest(RecordKind.STATE_ROOT_BATCH));
    }

    public EventCursorResponse getLastScanned(String watcherName) {
        ValidationUtils.requireValidWatcherName(watcherName);
        return new EventCursorResponse(watcherName, store.getScanCursor(watcherName));
    }

    private <T extends IndexedRecord> T lookup(RecordKind<T> kind, long index) {
        ValidationUtils.requireNonNegative(index, "index");
        return cache.get(kind, index, () -> store.getByIndex(kind, index));
    }

    /**
     * 记录引用的 batch 尚未写入时返回 null。
     */
    private <T extends IndexedRecord> T batchOf(RecordKind<T> kind, Long batchIndex) {
        if (batchIndex == null) {
            return null;
        }
        try {
            return lookup(kind, batchIndex);
        } catch (NotFoundException e) {
            return null;
        }
    }

    private Long latestOrNull(RecordKind<?> kind) {
        try {
            return store.getLatest(kind);
        } catch (NotFoundException e) {
            return null;
        }
    }

    private static void checkRange(long start, long end) {
        ValidationUtils.requireNonNegative(start, "start");
        if (end < start) {
            throw new InvalidArgumentException("end must not be less than start. start=" + start + ", end=" + end);
        }
        if (end - start > MAX_RANGE_SIZE) {
            throw new InvalidArgumentException("range too large, max " + MAX_RANGE_SIZE + ". start=" + start + ", end=" + end);
        }
    }
}
