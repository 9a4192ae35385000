package com.work.l2ingestion.ingestion.engine;

public enum IterationOutcome {
    /** 没有新区块，已睡眠一个 pollingInterval */
    IDLE,
    /** 拉取并提交了一个窗口，游标已推进 */
    SYNCED,
    /** 游标超前于链头，本轮未拉取 */
    CURSOR_AHEAD
}
