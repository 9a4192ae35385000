package com.work.l2ingestion.server.web.dto;

import com.work.l2ingestion.core.model.TransactionBatchEntry;
import com.work.l2ingestion.core.model.TransactionEntry;

public class TransactionResponse {

    private TransactionEntry transaction;
    private TransactionBatchEntry batch;

    public TransactionResponse() {
    }

    public TransactionResponse(TransactionEntry transaction, TransactionBatchEntry batch) {
        this.transaction = transaction;
        this.batch = batch;
    }

    public TransactionEntry getTransaction() {
        return transaction;
    }

    public TransactionBatchEntry getBatch() {
        return batch;
    }
}
