package com.work.l2ingestion.ingestion.decoder;

import com.work.l2ingestion.core.model.StateRootEntry;
import com.work.l2ingestion.core.model.TransactionEntry;

import java.util.Objects;

/**
 * 单个 L2 区块解析后的领域记录。
 */
public class SequencerBlockEntry {

    private final long blockNumber;
    private final TransactionEntry transactionEntry;
    private final StateRootEntry stateRootEntry;

    public SequencerBlockEntry(long blockNumber, TransactionEntry transactionEntry, StateRootEntry stateRootEntry) {
        this.blockNumber = blockNumber;
        this.transactionEntry = Objects.requireNonNull(transactionEntry, "transactionEntry");
        this.stateRootEntry = Objects.requireNonNull(stateRootEntry, "stateRootEntry");
    }

    public long getBlockNumber() {
        return blockNumber;
    }

    public TransactionEntry getTransactionEntry() {
        return transactionEntry;
    }

    public StateRootEntry getStateRootEntry() {
        return stateRootEntry;
    }
}
