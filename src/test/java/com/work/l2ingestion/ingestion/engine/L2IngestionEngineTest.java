package com.work.l2ingestion.ingestion.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.work.l2ingestion.core.exception.DecodeException;
import com.work.l2ingestion.core.exception.NotFoundException;
import com.work.l2ingestion.core.exception.RpcException;
import com.work.l2ingestion.core.exception.StorageException;
import com.work.l2ingestion.core.model.TransactionEntry;
import com.work.l2ingestion.core.store.KeyCodec;
import com.work.l2ingestion.core.store.RecordKind;
import com.work.l2ingestion.core.store.TransportStore;
import com.work.l2ingestion.core.support.InMemoryKeyValueBackend;
import com.work.l2ingestion.ingestion.chain.BlockFetcher;
import com.work.l2ingestion.ingestion.chain.FetchStrategy;
import com.work.l2ingestion.ingestion.chain.RawBlock;
import com.work.l2ingestion.ingestion.chain.RpcHex;
import com.work.l2ingestion.ingestion.decoder.SequencerBlockHandler;
import com.work.l2ingestion.ingestion.support.metrics.IngestionMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.stubbing.Answer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class L2IngestionEngineTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final long CHAIN_ID = 420L;
    private static final Duration INTERVAL = Duration.ofMillis(5000);

    private InMemoryKeyValueBackend backend;
    private TransportStore store;
    private BlockFetcher fetcher;
    private IngestionMetrics metrics;

    @BeforeEach
    public void setUp() {
        backend = new InMemoryKeyValueBackend();
        store = new TransportStore(backend, MAPPER);
        fetcher = mock(BlockFetcher.class);
        metrics = mock(IngestionMetrics.class);
    }

    private L2IngestionEngine engine(int batchSize, ErrorPolicy policy) {
        IngestionSettings settings = new IngestionSettings(CHAIN_ID, INTERVAL, batchSize, policy, FetchStrategy.BULK);
        return new L2IngestionEngine(store, fetcher, new SequencerBlockHandler(), settings, metrics);
    }

    static RawBlock block(long number) {
        ObjectNode tx = MAPPER.createObjectNode();
        tx.put("to", "0x4200000000000000000000000000000000000005");
        tx.put("gas", "0x5208");
        tx.put("gasPrice", "0x0");
        tx.put("nonce", RpcHex.toRpcHexString(number));
        tx.put("input", "0x");
        tx.put("v", RpcHex.toRpcHexString(CHAIN_ID * 2 + 35));
        tx.put("r", "0x1");
        tx.put("s", "0x1");
        tx.put("queueOrigin", "sequencer");
        tx.put("l1BlockNumber", "0x1");
        tx.put("l1Timestamp", "0x1");

        ObjectNode node = MAPPER.createObjectNode();
        node.put("number", RpcHex.toRpcHexString(number));
        node.put("stateRoot", "0xroot" + number);
        node.putArray("transactions").add(tx);
        return new RawBlock(node);
    }

    private void serveBlocks() {
        when(fetcher.fetchRange(anyLong(), anyLong())).thenAnswer(BLOCKS_IN_RANGE);
    }

    private static final Answer<List<RawBlock>> BLOCKS_IN_RANGE = inv -> {
        long start = inv.getArgument(0);
        long end = inv.getArgument(1);
        List<RawBlock> blocks = new ArrayList<>();
        for (long n = start; n <= end; n++) {
            blocks.add(block(n));
        }
        return blocks;
    };

    private static RawBlock blockWithoutTransactions(long number) {
        ObjectNode broken = MAPPER.createObjectNode();
        broken.put("number", RpcHex.toRpcHexString(number));
        return new RawBlock(broken);
    }

    private void failDecoding() {
        when(fetcher.currentHeight()).thenReturn(11L);
        when(fetcher.fetchRange(anyLong(), anyLong()))
                .thenReturn(Collections.singletonList(blockWithoutTransactions(2)));
    }

    private void failCursorWrite() {
        when(fetcher.currentHeight()).thenReturn(11L);
        serveBlocks();
        store = spy(store);
        doThrow(new StorageException("disk full")).when(store).putHighestSyncedBlock(anyLong());
    }

    @Test
    public void catches_up_in_batches_and_sleeps_near_head() {
        when(fetcher.currentHeight()).thenReturn(11L);
        serveBlocks();
        L2IngestionEngine engine = engine(5, ErrorPolicy.FAIL_FAST);
        RecordingCancellationSignal signal = new RecordingCancellationSignal();

        assertEquals(IterationOutcome.SYNCED, engine.syncOnce(signal));
        assertEquals(6L, store.getHighestSyncedBlock());
        assertTrue(signal.getSleeps().isEmpty());
        verify(fetcher).fetchRange(2L, 6L);

        assertEquals(IterationOutcome.SYNCED, engine.syncOnce(signal));
        assertEquals(10L, store.getHighestSyncedBlock());
        assertEquals(Collections.singletonList(INTERVAL), signal.getSleeps());
        verify(fetcher).fetchRange(7L, 10L);

        List<TransactionEntry> txs = store.getRange(RecordKind.UNCONFIRMED_TRANSACTION, 0, 100);
        assertEquals(9, txs.size());
        assertEquals(1L, txs.get(0).getIndex());
        assertEquals(9L, txs.get(8).getIndex());
        assertEquals(9L, store.getLatest(RecordKind.UNCONFIRMED_STATE_ROOT));
        verify(metrics, times(2)).iteration(IterationOutcome.SYNCED.name());
    }

    @Test
    public void idle_iteration_sleeps_once_without_fetching() {
        store.putHighestSyncedBlock(10L);
        when(fetcher.currentHeight()).thenReturn(11L);
        RecordingCancellationSignal signal = new RecordingCancellationSignal();

        assertEquals(IterationOutcome.IDLE, engine(5, ErrorPolicy.FAIL_FAST).syncOnce(signal));

        verify(fetcher, never()).fetchRange(anyLong(), anyLong());
        assertEquals(Collections.singletonList(INTERVAL), signal.getSleeps());
        assertEquals(10L, store.getHighestSyncedBlock());
    }

    @Test
    public void fresh_store_on_empty_chain_reports_cursor_ahead() {
        when(fetcher.currentHeight()).thenReturn(0L);
        RecordingCancellationSignal signal = new RecordingCancellationSignal();

        // head clamps to 0, cursor defaults to 1
        assertEquals(IterationOutcome.CURSOR_AHEAD, engine(5, ErrorPolicy.FAIL_FAST).syncOnce(signal));

        verify(fetcher, never()).fetchRange(anyLong(), anyLong());
        assertThrows(NotFoundException.class, () -> store.getHighestSyncedBlock());
        assertEquals(1, signal.getSleeps().size());
    }

    @Test
    public void cursor_ahead_of_head_does_not_fetch_or_move_cursor() {
        store.putHighestSyncedBlock(12L);
        when(fetcher.currentHeight()).thenReturn(11L);
        RecordingCancellationSignal signal = new RecordingCancellationSignal();

        assertEquals(IterationOutcome.CURSOR_AHEAD, engine(5, ErrorPolicy.FAIL_FAST).syncOnce(signal));

        verify(fetcher, never()).fetchRange(anyLong(), anyLong());
        assertEquals(12L, store.getHighestSyncedBlock());
        assertEquals(Collections.singletonList(INTERVAL), signal.getSleeps());
    }

    @Test
    public void fail_fast_propagates_and_keeps_cursor() {
        store.putHighestSyncedBlock(3L);
        when(fetcher.currentHeight()).thenReturn(20L);
        when(fetcher.fetchRange(anyLong(), anyLong())).thenThrow(new RpcException("node down"));
        RecordingCancellationSignal signal = new RecordingCancellationSignal();

        RpcException e = assertThrows(RpcException.class, () -> engine(5, ErrorPolicy.FAIL_FAST).run(signal));

        assertEquals("node down", e.getMessage());
        assertEquals(3L, store.getHighestSyncedBlock());
        assertTrue(signal.getSleeps().isEmpty());
        verify(metrics).error("propagated");
    }

    @Test
    public void catch_all_absorbs_backs_off_once_and_keeps_syncing() {
        when(fetcher.currentHeight()).thenReturn(11L);
        when(fetcher.fetchRange(anyLong(), anyLong()))
                .thenThrow(new RpcException("node down"))
                .thenAnswer(BLOCKS_IN_RANGE);
        // 第 1 次为错误退避，第 2 次为追到链头后的节奏睡眠
        RecordingCancellationSignal signal = new RecordingCancellationSignal(2);

        engine(10, ErrorPolicy.CATCH_AND_BACKOFF).run(signal);

        assertEquals(Arrays.asList(INTERVAL, INTERVAL), signal.getSleeps());
        assertEquals(10L, store.getHighestSyncedBlock());
        assertEquals(9L, store.getLatest(RecordKind.UNCONFIRMED_TRANSACTION));
        verify(fetcher, times(2)).fetchRange(2L, 10L);
        verify(metrics, times(1)).error("absorbed");
    }

    @Test
    public void fail_fast_propagates_decode_failure() {
        failDecoding();
        RecordingCancellationSignal signal = new RecordingCancellationSignal();

        assertThrows(DecodeException.class, () -> engine(5, ErrorPolicy.FAIL_FAST).run(signal));

        assertTrue(signal.getSleeps().isEmpty());
        assertThrows(NotFoundException.class, () -> store.getHighestSyncedBlock());
    }

    @Test
    public void catch_all_absorbs_decode_failure_and_retries_window() {
        failDecoding();
        RecordingCancellationSignal signal = new RecordingCancellationSignal(2);

        engine(5, ErrorPolicy.CATCH_AND_BACKOFF).run(signal);

        assertEquals(Arrays.asList(INTERVAL, INTERVAL), signal.getSleeps());
        verify(fetcher, times(2)).fetchRange(2L, 6L);
        verify(metrics, times(2)).error("absorbed");
        assertThrows(NotFoundException.class, () -> store.getHighestSyncedBlock());
    }

    @Test
    public void fail_fast_propagates_storage_failure() {
        failCursorWrite();
        RecordingCancellationSignal signal = new RecordingCancellationSignal();

        StorageException e = assertThrows(StorageException.class, () -> engine(5, ErrorPolicy.FAIL_FAST).run(signal));

        assertEquals("disk full", e.getMessage());
        assertTrue(signal.getSleeps().isEmpty());
        verify(metrics).error("propagated");
    }

    @Test
    public void catch_all_absorbs_storage_failure_and_retries_window() {
        failCursorWrite();
        RecordingCancellationSignal signal = new RecordingCancellationSignal(2);

        engine(5, ErrorPolicy.CATCH_AND_BACKOFF).run(signal);

        assertEquals(Arrays.asList(INTERVAL, INTERVAL), signal.getSleeps());
        verify(fetcher, times(2)).fetchRange(2L, 6L);
        verify(metrics, times(2)).error("absorbed");
        assertThrows(NotFoundException.class, () -> store.getHighestSyncedBlock());
    }

    @Test
    public void failure_mid_window_leaves_cursor_and_earlier_blocks() {
        when(fetcher.currentHeight()).thenReturn(11L);
        when(fetcher.fetchRange(2L, 6L)).thenReturn(Arrays.asList(
                block(2), block(3), blockWithoutTransactions(4), block(5), block(6)));

        assertThrows(DecodeException.class,
                () -> engine(5, ErrorPolicy.FAIL_FAST).syncOnce(new RecordingCancellationSignal()));

        assertThrows(NotFoundException.class, () -> store.getHighestSyncedBlock());
        assertEquals(2L, store.getLatest(RecordKind.UNCONFIRMED_TRANSACTION));
        assertThrows(NotFoundException.class, () -> store.getByIndex(RecordKind.UNCONFIRMED_TRANSACTION, 4L));
    }

    @Test
    public void replayed_window_after_restart_is_idempotent() {
        when(fetcher.currentHeight()).thenReturn(7L);
        serveBlocks();
        engine(10, ErrorPolicy.FAIL_FAST).syncOnce(new RecordingCancellationSignal());
        assertEquals(6L, store.getHighestSyncedBlock());
        List<byte[]> transactionsBefore = storedBytes(RecordKind.UNCONFIRMED_TRANSACTION, 1, 5);
        List<byte[]> rootsBefore = storedBytes(RecordKind.UNCONFIRMED_STATE_ROOT, 1, 5);
        int keysBefore = backend.size();

        // 重启后重放已同步过的整个窗口
        SequencerBlockHandler handler = new SequencerBlockHandler();
        for (long n = 2; n <= 6; n++) {
            handler.storeBlock(handler.parseBlock(block(n), CHAIN_ID), store);
        }

        assertBytesEqual(transactionsBefore, storedBytes(RecordKind.UNCONFIRMED_TRANSACTION, 1, 5));
        assertBytesEqual(rootsBefore, storedBytes(RecordKind.UNCONFIRMED_STATE_ROOT, 1, 5));
        assertEquals(keysBefore, backend.size());
        assertEquals(5L, store.getLatest(RecordKind.UNCONFIRMED_TRANSACTION));
    }

    @Test
    public void error_after_stop_request_is_swallowed_even_when_failing_fast() {
        RecordingCancellationSignal signal = new RecordingCancellationSignal();
        when(fetcher.currentHeight()).thenAnswer(inv -> {
            signal.cancel();
            throw new RpcException("closing");
        });

        engine(5, ErrorPolicy.FAIL_FAST).run(signal);

        assertTrue(signal.isCancelled());
    }

    @Test
    public void run_exits_when_already_cancelled() {
        RecordingCancellationSignal signal = new RecordingCancellationSignal();
        signal.cancel();

        engine(5, ErrorPolicy.FAIL_FAST).run(signal);

        verifyNoInteractions(fetcher);
    }

    private List<byte[]> storedBytes(RecordKind<?> kind, long first, long last) {
        List<byte[]> out = new ArrayList<>();
        for (long i = first; i <= last; i++) {
            out.add(backend.get(KeyCodec.indexKey(kind, i)).orElseThrow(AssertionError::new));
        }
        return out;
    }

    private static void assertBytesEqual(List<byte[]> expected, List<byte[]> actual) {
        assertEquals(expected.size(), actual.size());
        for (int i = 0; i < expected.size(); i++) {
            assertArrayEquals(expected.get(i), actual.get(i));
        }
    }
}
