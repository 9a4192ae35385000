package com.work.l2ingestion.server.worker;

import com.work.l2ingestion.ingestion.engine.CancellationSignal;
import com.work.l2ingestion.ingestion.engine.L2IngestionEngine;
import com.work.l2ingestion.server.config.IngestionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationContext;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import javax.annotation.PreDestroy;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 在独立的单线程上运行 L2IngestionEngine，应用关闭时发出停止信号。
 *
 * engine 以异常终止（FAIL_FAST）且 exit-on-failure 打开时，以非 0 退出码关闭进程，交给外部 supervisor 重启。
 */
@Component
public class IngestionWorker {

    private static final Logger log = LoggerFactory.getLogger(IngestionWorker.class);

    private final L2IngestionEngine engine;
    private final IngestionProperties properties;
    private final ApplicationContext applicationContext;
    private final CancellationSignal signal = new CancellationSignal();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Duration shutdownTimeout;
    private ExecutorService executor;

    public IngestionWorker(L2IngestionEngine engine,
                           IngestionProperties properties,
                           ApplicationContext applicationContext) {
        this.engine = engine;
        this.properties = properties;
        this.applicationContext = applicationContext;
        this.shutdownTimeout = properties.getShutdownTimeout();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!properties.isEnabled()) {
            log.info("L2 ingestion disabled (ingestion.enabled=false)");
            return;
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }
        executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("l2-ingestion-engine");
            t.setDaemon(true);
            return t;
        });
        executor.execute(this::runEngine);
    }

    void runEngine() {
        try {
            engine.run(signal);
        } catch (RuntimeException e) {
            log.error("L2 ingestion engine terminated. err={}", e.toString(), e);
            if (properties.isExitOnFailure() && !signal.isCancelled()) {
                terminate(1);
            }
        } finally {
            running.set(false);
        }
    }

    /**
     * 关闭 Spring 上下文并退出 JVM。放在单独线程执行，engine 线程会被 stop() 中断。
     */
    protected void terminate(int exitCode) {
        Thread exit = new Thread(() -> System.exit(SpringApplication.exit(applicationContext, () -> exitCode)));
        exit.setName("l2-ingestion-exit");
        exit.start();
    }

    public boolean isRunning() {
        return running.get();
    }

    CancellationSignal getSignal() {
        return signal;
    }

    /**
     * 发出停止信号并等待进行中的一轮同步提交完成；超时后才中断 engine 线程。
     */
    @PreDestroy
    public void stop() {
        signal.cancel();
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("L2 ingestion engine did not stop within {}ms, interrupting", shutdownTimeout.toMillis());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
