package com.work.l2ingestion.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 交易来源：sequencer 直接打包，或来自 L1 enqueue 队列。
 */
public enum QueueOrigin {

    SEQUENCER("sequencer"),
    L1("l1");

    private final String wireName;

    QueueOrigin(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static QueueOrigin fromWireName(String value) {
        for (QueueOrigin origin : values()) {
            if (origin.wireName.equalsIgnoreCase(value)) {
                return origin;
            }
        }
        throw new IllegalArgumentException("unknown queueOrigin: " + value);
    }
}
