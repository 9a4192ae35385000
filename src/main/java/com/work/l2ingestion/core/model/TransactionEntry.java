package com.work.l2ingestion.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * 一笔 L2 交易。confirmed / unconfirmed 两个 kind 共用该结构。
 */
@JsonPropertyOrder({"index", "batchIndex", "data", "blockNumber", "timestamp", "gasLimit",
        "target", "origin", "queueOrigin", "queueIndex", "type", "decoded"})
public class TransactionEntry implements IndexedRecord {

    private long index;
    /**
     * unconfirmed 交易尚未进入 L1 batch，为 null。
     */
    private Long batchIndex;
    private String data;
    private long blockNumber;
    private long timestamp;
    private long gasLimit;
    private String target;
    private String origin;
    private QueueOrigin queueOrigin;
    private Long queueIndex;
    private TransactionType type;
    private DecodedTransaction decoded;

    @Override
    public long getIndex() {
        return index;
    }

    public void setIndex(long index) {
        this.index = index;
    }

    public Long getBatchIndex() {
        return batchIndex;
    }

    public void setBatchIndex(Long batchIndex) {
        this.batchIndex = batchIndex;
    }

    public String getData() {
        return data;
    }

    public void setData(String data) {
        this.data = data;
    }

    public long getBlockNumber() {
        return blockNumber;
    }

    public void setBlockNumber(long blockNumber) {
        this.blockNumber = blockNumber;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(long timestamp) {
        this.timestamp = timestamp;
    }

    public long getGasLimit() {
        return gasLimit;
    }

    public void setGasLimit(long gasLimit) {
        this.gasLimit = gasLimit;
    }

    public String getTarget() {
        return target;
    }

    public void setTarget(String target) {
        this.target = target;
    }

    public String getOrigin() {
        return origin;
    }

    public void setOrigin(String origin) {
        this.origin = origin;
    }

    public QueueOrigin getQueueOrigin() {
        return queueOrigin;
    }

    public void setQueueOrigin(QueueOrigin queueOrigin) {
        this.queueOrigin = queueOrigin;
    }

    public Long getQueueIndex() {
        return queueIndex;
    }

    public void setQueueIndex(Long queueIndex) {
        this.queueIndex = queueIndex;
    }

    public TransactionType getType() {
        return type;
    }

    public void setType(TransactionType type) {
        this.type = type;
    }

    public DecodedTransaction getDecoded() {
        return decoded;
    }

    public void setDecoded(DecodedTransaction decoded) {
        this.decoded = decoded;
    }
}
