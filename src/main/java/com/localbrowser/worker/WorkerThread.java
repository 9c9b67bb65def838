package com.localbrowser.worker;

import com.localbrowser.record.RecordRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 驱动一个工作单元的专用线程：按固定间隔激活，每次激活处理一个队列项。
 *
 * <p>间隔从上一次激活结束算起，较慢的单元不会积压激活。</p>
 */
public final class WorkerThread {
    private static final Logger logger = LoggerFactory.getLogger(WorkerThread.class);

    private final Worker worker;
    private final long intervalMs;
    private final long shutdownTimeoutMs;
    private ScheduledExecutorService executor;
    private ScheduledFuture<?> timer;

    public WorkerThread(Worker worker, long intervalMs, long shutdownTimeoutMs) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("激活间隔必须大于0: " + intervalMs);
        }
        this.worker = worker;
        this.intervalMs = intervalMs;
        this.shutdownTimeoutMs = shutdownTimeoutMs;
    }

    public Worker worker() {
        return worker;
    }

    public WorkQueue queue() {
        return worker.queue();
    }

    /**
     * 启动线程并开始计时激活。
     */
    public synchronized void start() {
        if (executor != null) {
            throw new IllegalStateException("工作线程已启动: " + worker.name());
        }
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "lfb-" + worker.name());
            thread.setDaemon(true);
            worker.bindTo(thread);
            return thread;
        });
        timer = executor.scheduleWithFixedDelay(worker::activate, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        logger.debug("工作线程已启动: {} (间隔 {}ms)", worker.name(), intervalMs);
    }

    public synchronized boolean isRunning() {
        return executor != null && !executor.isShutdown();
    }

    /**
     * 提交句柄。普通提交在句柄已排队时忽略，强制提交总是插到队首优先处理。
     *
     * @throws IllegalArgumentException 句柄为空时抛出
     */
    public void put(RecordRef ref, boolean force) {
        if (ref == null) {
            throw new IllegalArgumentException("只能提交记录句柄");
        }
        worker.clearInterrupt();
        if (force) {
            worker.queue().submit(ref, true);
        } else {
            worker.queue().submitIfAbsent(ref);
        }
    }

    /**
     * 提升句柄为下一个处理对象，不产生重复条目。
     */
    public void prioritize(RecordRef ref) {
        if (ref == null) {
            throw new IllegalArgumentException("只能提交记录句柄");
        }
        worker.clearInterrupt();
        worker.queue().promote(ref);
    }

    public void requestReset() {
        worker.requestReset();
    }

    /**
     * 停止计时器、通知工作单元退出并等待线程结束。
     */
    public synchronized void shutdown() {
        if (executor == null) {
            return;
        }
        timer.cancel(false);
        worker.requestShutdown();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
                logger.warn("工作线程未能按时结束，强制中断: {}", worker.name());
                executor.shutdownNow();
            }
        } catch (InterruptedException interruptedException) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.debug("工作线程已停止: {}", worker.name());
    }
}
