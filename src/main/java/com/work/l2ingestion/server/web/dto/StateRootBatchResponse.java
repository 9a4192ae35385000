package com.work.l2ingestion.server.web.dto;

import com.work.l2ingestion.core.model.StateRootBatchEntry;
import com.work.l2ingestion.core.model.StateRootEntry;

import java.util.List;

public class StateRootBatchResponse {

    private StateRootBatchEntry batch;
    private List<StateRootEntry> stateRoots;

    public StateRootBatchResponse() {
    }

    public StateRootBatchResponse(StateRootBatchEntry batch, List<StateRootEntry> stateRoots) {
        this.batch = batch;
        this.stateRoots = stateRoots;
    }

    public StateRootBatchEntry getBatch() {
        return batch;
    }

    public List<StateRootEntry> getStateRoots() {
        return stateRoots;
    }
}
