package com.work.l2ingestion.core.model;

public class StateRootBatchEntry extends BatchEntry {
}
