package com.work.l2ingestion.server.web.dto;

public class EventCursorResponse {

    private String watcher;
    private long lastScannedBlock;

    public EventCursorResponse() {
    }

    public EventCursorResponse(String watcher, long lastScannedBlock) {
        this.watcher = watcher;
        this.lastScannedBlock = lastScannedBlock;
    }

    public String getWatcher() {
        return watcher;
    }

    public long getLastScannedBlock() {
        return lastScannedBlock;
    }
}
