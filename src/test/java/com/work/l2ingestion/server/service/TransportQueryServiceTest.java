package com.work.l2ingestion.server.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.l2ingestion.core.cache.RecordCache;
import com.work.l2ingestion.core.exception.InvalidArgumentException;
import com.work.l2ingestion.core.exception.NotFoundException;
import com.work.l2ingestion.core.model.StateRootBatchEntry;
import com.work.l2ingestion.core.model.StateRootEntry;
import com.work.l2ingestion.core.model.TransactionBatchEntry;
import com.work.l2ingestion.core.model.TransactionEntry;
import com.work.l2ingestion.core.store.OrderedStore;
import com.work.l2ingestion.core.store.RecordKind;
import com.work.l2ingestion.core.store.TransportStore;
import com.work.l2ingestion.core.support.InMemoryKeyValueBackend;
import com.work.l2ingestion.server.web.dto.StateRootBatchResponse;
import com.work.l2ingestion.server.web.dto.SyncStatusResponse;
import com.work.l2ingestion.server.web.dto.TransactionBatchResponse;
import com.work.l2ingestion.server.web.dto.TransactionResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class TransportQueryServiceTest {

    private OrderedStore store;
    private TransportQueryService service;

    @BeforeEach
    public void setUp() {
        store = spy(new TransportStore(new InMemoryKeyValueBackend(), new ObjectMapper()));
        service = new TransportQueryService(store, new RecordCache(true, 100, Duration.ofMinutes(1)));
    }

    private static TransactionEntry tx(long index, Long batchIndex) {
        TransactionEntry e = new TransactionEntry();
        e.setIndex(index);
        e.setBatchIndex(batchIndex);
        e.setData("0x" + index);
        return e;
    }

    private static List<TransactionEntry> txs(long from, long to, Long batchIndex) {
        List<TransactionEntry> out = new ArrayList<>();
        for (long i = from; i < to; i++) {
            out.add(tx(i, batchIndex));
        }
        return out;
    }

    @Test
    public void confirmed_transaction_comes_with_its_batch() {
        store.putIndexed(RecordKind.TRANSACTION, txs(0, 3, 0L));
        TransactionBatchEntry batch = new TransactionBatchEntry();
        batch.setIndex(0);
        batch.setPrevTotalElements(0);
        batch.setSize(3);
        store.putIndexed(RecordKind.TRANSACTION_BATCH, Collections.singletonList(batch));

        TransactionResponse resp = service.getTransaction(1);

        assertEquals(1L, resp.getTransaction().getIndex());
        assertNotNull(resp.getBatch());
        assertEquals(3L, resp.getBatch().getSize());
        assertEquals(2L, service.getLatestTransaction().getTransaction().getIndex());
    }

    @Test
    public void missing_batch_yields_null_batch() {
        store.putIndexed(RecordKind.TRANSACTION, Collections.singletonList(tx(0, 7L)));

        assertNull(service.getTransaction(0).getBatch());
    }

    @Test
    public void batch_lookup_resolves_member_records() {
        store.putIndexed(RecordKind.TRANSACTION, txs(0, 10, null));
        TransactionBatchEntry batch = new TransactionBatchEntry();
        batch.setIndex(1);
        batch.setPrevTotalElements(4);
        batch.setSize(3);
        store.putIndexed(RecordKind.TRANSACTION_BATCH, Collections.singletonList(batch));

        TransactionBatchResponse resp = service.getTransactionBatch(1);

        assertEquals(3, resp.getTransactions().size());
        assertEquals(4L, resp.getTransactions().get(0).getIndex());
        assertEquals(6L, resp.getTransactions().get(2).getIndex());
        assertEquals(1L, service.getLatestTransactionBatch().getBatch().getIndex());
    }

    @Test
    public void state_root_batch_lookup() {
        StateRootEntry r0 = new StateRootEntry();
        r0.setIndex(0);
        r0.setValue("0xa");
        StateRootEntry r1 = new StateRootEntry();
        r1.setIndex(1);
        r1.setValue("0xb");
        store.putIndexed(RecordKind.STATE_ROOT, Arrays.asList(r0, r1));
        StateRootBatchEntry batch = new StateRootBatchEntry();
        batch.setIndex(0);
        batch.setSize(2);
        store.putIndexed(RecordKind.STATE_ROOT_BATCH, Collections.singletonList(batch));

        StateRootBatchResponse resp = service.getStateRootBatch(0);

        assertEquals(2, resp.getStateRoots().size());
        assertEquals("0xb", service.getLatestStateRoot().getStateRoot().getValue());
    }

    @Test
    public void unconfirmed_reads_use_unconfirmed_namespace() {
        store.putIndexed(RecordKind.UNCONFIRMED_TRANSACTION, txs(5, 8, null));

        assertEquals(7L, service.getLatestUnconfirmedTransaction().getTransaction().getIndex());
        assertNull(service.getUnconfirmedTransaction(6).getBatch());
        assertEquals(2, service.getTransactionRange(5, 7, true).size());
        assertTrue(service.getTransactionRange(5, 7, false).isEmpty());
        assertThrows(NotFoundException.class, () -> service.getTransaction(6));
    }

    @Test
    public void index_lookups_are_cached() {
        store.putIndexed(RecordKind.UNCONFIRMED_TRANSACTION, txs(0, 2, null));

        service.getUnconfirmedTransaction(1);
        service.getUnconfirmedTransaction(1);

        verify(store, times(1)).getByIndex(RecordKind.UNCONFIRMED_TRANSACTION, 1L);
    }

    @Test
    public void range_arguments_are_validated() {
        assertThrows(InvalidArgumentException.class, () -> service.getTransactionRange(5, 4, false));
        assertThrows(InvalidArgumentException.class, () -> service.getTransactionRange(-1, 4, false));
        assertThrows(InvalidArgumentException.class,
                () -> service.getTransactionRange(0, TransportQueryService.MAX_RANGE_SIZE + 1, false));
    }

    @Test
    public void sync_status_compares_confirmed_and_unconfirmed() {
        SyncStatusResponse empty = service.getSyncStatus();
        assertFalse(empty.isSyncing());
        assertNull(empty.getHighestKnownTransactionIndex());

        store.putIndexed(RecordKind.UNCONFIRMED_TRANSACTION, txs(0, 5, null));
        store.putIndexed(RecordKind.TRANSACTION, txs(0, 2, null));
        store.putHighestSyncedBlock(5);

        SyncStatusResponse status = service.getSyncStatus();
        assertTrue(status.isSyncing());
        assertEquals(Long.valueOf(4L), status.getHighestKnownTransactionIndex());
        assertEquals(Long.valueOf(1L), status.getCurrentTransactionIndex());
        assertEquals(Long.valueOf(5L), status.getHighestSyncedBlock());
    }

    @Test
    public void event_cursor_lookup() {
        store.putScanCursor("deposits", 77);

        assertEquals(77L, service.getLastScanned("deposits").getLastScannedBlock());
        assertThrows(NotFoundException.class, () -> service.getLastScanned("batches"));
        assertThrows(InvalidArgumentException.class, () -> service.getLastScanned("bad name"));
    }
}
