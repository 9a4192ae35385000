package com.work.l2ingestion.ingestion.engine;

/**
 * ingestion 循环边界处的统一错误处理策略，不区分异常类型。
 */
public enum ErrorPolicy {

    /**
     * 记录并重新抛出，engine 终止，由外部 supervisor 重启进程。
     */
    FAIL_FAST,

    /**
     * 记录、退避一个 pollingInterval 后继续循环。
     */
    CATCH_AND_BACKOFF;

    public static ErrorPolicy fromCatchAllFlag(boolean dangerouslyCatchAllErrors) {
        return dangerouslyCatchAllErrors ? CATCH_AND_BACKOFF : FAIL_FAST;
    }

    /**
     * 已请求停止时任何策略都吞掉异常，让循环在下一个边界自然退出。
     *
     * @return true 表示吞掉异常并退避，false 表示向外抛出
     */
    public boolean absorbs(boolean stopRequested) {
        return stopRequested || this == CATCH_AND_BACKOFF;
    }
}
