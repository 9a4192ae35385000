package com.work.l2ingestion.ingestion.engine;

/**
 * 一轮同步要处理的区块窗口 {@code (highestSynced, target]}。
 */
public final class SyncWindow {

    /**
     * 节点的区块编号比逻辑 index 空间超前 1，协议常量，不可配置。
     */
    static final long HEAD_OFFSET = 1L;

    private final long highestSynced;
    private final long head;
    private final long target;
    private final int batchSize;

    private SyncWindow(long highestSynced, long head, long target, int batchSize) {
        this.highestSynced = highestSynced;
        this.head = head;
        this.target = target;
        this.batchSize = batchSize;
    }

    public static SyncWindow compute(long highestSynced, long currentHeight, int batchSize) {
        long head = Math.max(currentHeight - HEAD_OFFSET, 0L);
        long target = Math.min(highestSynced + batchSize, head);
        return new SyncWindow(highestSynced, head, target, batchSize);
    }

    public long getHighestSynced() {
        return highestSynced;
    }

    public long getHead() {
        return head;
    }

    public long getTarget() {
        return target;
    }

    /**
     * 已追到链头，没有新区块。
     */
    public boolean isIdle() {
        return highestSynced == target;
    }

    /**
     * 游标在链头之前（链高回退等异常情况），本轮不拉取。
     */
    public boolean isCursorAhead() {
        return highestSynced > target;
    }

    public long firstBlock() {
        return highestSynced + 1;
    }

    /**
     * 距链头不足一个 batch 时需要在下一轮前睡眠；否则立即继续追赶。
     */
    public boolean isNearHead() {
        return head - highestSynced < batchSize;
    }

    @Override
    public String toString() {
        return "SyncWindow{highestSynced=" + highestSynced + ", head=" + head + ", target=" + target + "}";
    }
}
