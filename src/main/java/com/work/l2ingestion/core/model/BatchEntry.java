package com.work.l2ingestion.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * L1 上提交的 batch 头信息。{@code [prevTotalElements, prevTotalElements + size)} 即该 batch 覆盖的 index 区间。
 */
@JsonPropertyOrder({"index", "blockNumber", "timestamp", "submitter", "size", "root", "prevTotalElements", "extraData"})
public abstract class BatchEntry implements IndexedRecord {

    private long index;
    private long blockNumber;
    private long timestamp;
    private String submitter;
    private long size;
    private String root;
    private long prevTotalElements;
    private String extraData;

    @Override
    public long getIndex() {
        return index;
    }

    public void setIndex(long index) {
        this.index = index;
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

    public String getSubmitter() {
        return submitter;
    }

    public void setSubmitter(String submitter) {
        this.submitter = submitter;
    }

    public long getSize() {
        return size;
    }

    public void setSize(long size) {
        this.size = size;
    }

    public String getRoot() {
        return root;
    }

    public void setRoot(String root) {
        this.root = root;
    }

    public long getPrevTotalElements() {
        return prevTotalElements;
    }

    public void setPrevTotalElements(long prevTotalElements) {
        this.prevTotalElements = prevTotalElements;
    }

    public String getExtraData() {
        return extraData;
    }

    public void setExtraData(String extraData) {
        this.extraData = extraData;
    }

    /**
     * 该 batch 覆盖的首个元素 index（含）。
     */
    public long firstElementIndex() {
        return prevTotalElements;
    }

    /**
     * 该 batch 覆盖的末尾 index（不含）。
     */
    public long endElementIndex() {
        return prevTotalElements + size;
    }
}
