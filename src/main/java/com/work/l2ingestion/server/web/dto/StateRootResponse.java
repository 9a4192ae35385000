package com.work.l2ingestion.server.web.dto;

import com.work.l2ingestion.core.model.StateRootBatchEntry;
import com.work.l2ingestion.core.model.StateRootEntry;

public class StateRootResponse {

    private StateRootEntry stateRoot;
    private StateRootBatchEntry batch;

    public StateRootResponse() {
    }

    public StateRootResponse(StateRootEntry stateRoot, StateRootBatchEntry batch) {
        this.stateRoot = stateRoot;
        this.batch = batch;
    }

    public StateRootEntry getStateRoot() {
        return stateRoot;
    }

    public StateRootBatchEntry getBatch() {
        return batch;
    }
}
