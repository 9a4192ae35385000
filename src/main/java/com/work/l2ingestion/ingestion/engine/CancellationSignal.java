package com.work.l2ingestion.ingestion.engine;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 协作式停止信号，同时也是 engine 唯一的睡眠原语：取消时正在进行的 sleep 立即返回。
 */
public class CancellationSignal {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * @return true 表示睡满了 duration，false 表示被取消提前唤醒
     */
    public boolean sleep(Duration duration) {
        try {
            return !cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return false;
        }
    }
}
