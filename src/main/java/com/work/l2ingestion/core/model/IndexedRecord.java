package com.work.l2ingestion.core.model;

/**
 * 所有按 index 存储的记录的公共形态。index 在同一 kind 内从首次写入起连续且严格递增。
 */
public interface IndexedRecord {

    long getIndex();
}
