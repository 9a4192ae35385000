package com.work.l2ingestion.server.web.dto;

/**
 * /eth/syncing 的返回体；从未写入过的 index 为 null。
 */
public class SyncStatusResponse {

    private boolean syncing;
    private Long highestKnownTransactionIndex;
    private Long currentTransactionIndex;
    private Long highestSyncedBlock;

    public SyncStatusResponse() {
    }

    public SyncStatusResponse(boolean syncing,
                              Long highestKnownTransactionIndex,
                              Long currentTransactionIndex,
                              Long highestSyncedBlock) {
        this.syncing = syncing;
        this.highestKnownTransactionIndex = highestKnownTransactionIndex;
        this.currentTransactionIndex = currentTransactionIndex;
        this.highestSyncedBlock = highestSyncedBlock;
    }

    public boolean isSyncing() {
        return syncing;
    }

    public Long getHighestKnownTransactionIndex() {
        return highestKnownTransactionIndex;
    }

    public Long getCurrentTransactionIndex() {
        return currentTransactionIndex;
    }

    public Long getHighestSyncedBlock() {
        return highestSyncedBlock;
    }
}
