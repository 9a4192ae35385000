package com.work.l2ingestion.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"index", "batchIndex", "value"})
public class StateRootEntry implements IndexedRecord {

    private long index;
    private Long batchIndex;
    private String value;

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

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }
}
