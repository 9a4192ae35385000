package com.work.l2ingestion.core.model;

public enum TransactionType {
    EIP155,
    ETH_SIGN
}
