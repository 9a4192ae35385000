package com.work.l2ingestion.server.web.dto;

import com.work.l2ingestion.core.model.TransactionBatchEntry;
import com.work.l2ingestion.core.model.TransactionEntry;

import java.util.List;

public class TransactionBatchResponse {

    private TransactionBatchEntry batch;
    private List<TransactionEntry> transactions;

    public TransactionBatchResponse() {
    }

    public TransactionBatchResponse(TransactionBatchEntry batch, List<TransactionEntry> transactions) {
        this.batch = batch;
        this.transactions = transactions;
    }

    public TransactionBatchEntry getBatch() {
        return batch;
    }

    public List<TransactionEntry> getTransactions() {
        return transactions;
    }
}
