package com.work.l2ingestion.ingestion.engine;

import com.work.l2ingestion.core.exception.NotFoundException;
import com.work.l2ingestion.core.store.OrderedStore;
import com.work.l2ingestion.ingestion.chain.BlockFetcher;
import com.work.l2ingestion.ingestion.chain.RawBlock;
import com.work.l2ingestion.ingestion.decoder.SequencerBlockDecoder;
import com.work.l2ingestion.ingestion.decoder.SequencerBlockEntry;
import com.work.l2ingestion.ingestion.support.metrics.IngestionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * 从 sequencer 同步 unconfirmed 交易的单线程轮询循环。
 *
 * <p>每一轮：确定窗口 → 拉取 → 按升序逐块 decode + commit → 推进同步游标 → 控制节奏。</p>
 *
 * <p>游标在整个窗口提交完成后才前进一次。窗口中途崩溃时，重启会重新拉取并覆盖同一区间，
 * 依赖记录写入的幂等覆盖（at-least-once 重放）。</p>
 */
public class L2IngestionEngine {

    private static final Logger log = LoggerFactory.getLogger(L2IngestionEngine.class);

    /**
     * 游标不存在时的起点，index 0 保留。
     */
    static final long DEFAULT_HIGHEST_SYNCED = 1L;

    private final OrderedStore store;
    private final BlockFetcher fetcher;
    private final SequencerBlockDecoder decoder;
    private final IngestionSettings settings;
    private final IngestionMetrics metrics;

    public L2IngestionEngine(OrderedStore store,
                             BlockFetcher fetcher,
                             SequencerBlockDecoder decoder,
                             IngestionSettings settings,
                             IngestionMetrics metrics) {
        this.store = Objects.requireNonNull(store, "store");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * 运行直到 signal 被取消；FAIL_FAST 策略下第一个异常会从这里抛出。
     * 停止信号只在循环顶部和错误处理分支中观察，进行中的一轮总会完整执行。
     */
    public void run(CancellationSignal signal) {
        log.info("L2 ingestion engine started. settings={}", settings);
        while (!signal.isCancelled()) {
            try {
                syncOnce(signal);
            } catch (RuntimeException e) {
                if (!settings.getErrorPolicy().absorbs(signal.isCancelled())) {
                    metrics.error("propagated");
                    throw e;
                }
                log.error("Caught an unhandled error, backing off {}ms. err={}",
                        settings.getPollingInterval().toMillis(), e.toString(), e);
                metrics.error("absorbed");
                signal.sleep(settings.getPollingInterval());
            }
        }
        log.info("L2 ingestion engine stopped");
    }

    /**
     * 执行一轮同步（含本轮的节奏睡眠）。
     */
    public IterationOutcome syncOnce(CancellationSignal signal) {
        long highestSynced = readHighestSynced();
        SyncWindow window = SyncWindow.compute(highestSynced, fetcher.currentHeight(), settings.getBatchSize());

        if (window.isIdle()) {
            metrics.iteration(IterationOutcome.IDLE.name());
            signal.sleep(settings.getPollingInterval());
            return IterationOutcome.IDLE;
        }

        IterationOutcome outcome;
        if (window.isCursorAhead()) {
            log.info("Cannot query with start block number {} larger than end block number {}",
                    window.getHighestSynced(), window.getTarget());
            outcome = IterationOutcome.CURSOR_AHEAD;
        } else {
            log.info("Synchronizing unconfirmed transactions from Layer 2 from block {} to block {}",
                    window.getHighestSynced(), window.getTarget());
            int committed = syncBlocks(window.firstBlock(), window.getTarget());
            store.putHighestSyncedBlock(window.getTarget());
            metrics.blocksCommitted(committed);
            metrics.syncedHeight(window.getTarget());
            outcome = IterationOutcome.SYNCED;
        }
        metrics.iteration(outcome.name());

        if (window.isNearHead()) {
            signal.sleep(settings.getPollingInterval());
        }
        return outcome;
    }

    private long readHighestSynced() {
        try {
            return store.getHighestSyncedBlock();
        } catch (NotFoundException e) {
            return DEFAULT_HIGHEST_SYNCED;
        }
    }

    /**
     * 拉取 {@code [start, end]} 并严格按升序逐块解码、提交。
     *
     * @return 提交的区块数
     */
    private int syncBlocks(long start, long end) {
        List<RawBlock> blocks = fetcher.fetchRange(start, end);
        for (RawBlock block : blocks) {
            SequencerBlockEntry entry = decoder.parseBlock(block, settings.getL2ChainId());
            decoder.storeBlock(entry, store);
        }
        log.debug("Committed {} blocks in [{}, {}]", blocks.size(), start, end);
        return blocks.size();
    }
}
