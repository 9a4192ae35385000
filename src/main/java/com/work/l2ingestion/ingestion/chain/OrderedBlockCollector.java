package com.work.l2ingestion.ingestion.chain;

import com.work.l2ingestion.core.exception.IngestionException;
import com.work.l2ingestion.core.exception.RpcException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * 并行拉取的 fan-in 屏障：等待全部请求完成，再按 {@link RawBlock#BY_NUMBER} 排序。
 * 排序只发生在这里，之后的 decode / commit 只看到有序数据。
 */
public final class OrderedBlockCollector {

    private OrderedBlockCollector() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static List<RawBlock> collect(List<CompletableFuture<RawBlock>> pending) {
        try {
            CompletableFuture.allOf(pending.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException | CancellationException e) {
            pending.forEach(f -> f.cancel(true));
            throw unwrap(e);
        }
        List<RawBlock> blocks = new ArrayList<>(pending.size());
        for (CompletableFuture<RawBlock> future : pending) {
            blocks.add(future.join());
        }
        blocks.sort(RawBlock.BY_NUMBER);
        return blocks;
    }

    private static IngestionException unwrap(RuntimeException e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        if (cause instanceof IngestionException) {
            return (IngestionException) cause;
        }
        return new RpcException("parallel block fetch failed: " + cause, cause);
    }
}
