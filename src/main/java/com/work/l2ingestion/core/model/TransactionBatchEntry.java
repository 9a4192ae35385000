package com.work.l2ingestion.core.model;

public class TransactionBatchEntry extends BatchEntry {
}
