package com.localbrowser.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * 汇总所有已注册队列的待处理数量，定时刷新状态文本。
 */
public final class ProgressMonitor implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ProgressMonitor.class);

    private final List<WorkQueue> queues = new CopyOnWriteArrayList<>();
    private final List<Consumer<String>> listeners = new CopyOnWriteArrayList<>();
    private final long refreshMs;
    private ScheduledExecutorService executor;
    private volatile String lastStatus = "";

    public ProgressMonitor(long refreshMs) {
        this.refreshMs = refreshMs;
    }

    public void register(WorkQueue queue) {
        queues.add(queue);
    }

    public int pendingCount() {
        int pending = 0;
        for (WorkQueue queue : queues) {
            pending += queue.size();
        }
        return pending;
    }

    /**
     * 当前状态文本，没有待处理项时为空串。
     */
    public String statusText() {
        return formatStatus(pendingCount());
    }

    static String formatStatus(int pending) {
        return pending == 0 ? "" : "正在加载... (剩余 " + pending + " 项)";
    }

    public String lastStatus() {
        return lastStatus;
    }

    public void addListener(Consumer<String> listener) {
        listeners.add(listener);
    }

    public synchronized void start() {
        if (executor != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "lfb-progress");
            thread.setDaemon(true);
            return thread;
        });
        executor.scheduleAtFixedRate(this::refresh, 0, refreshMs, TimeUnit.MILLISECONDS);
    }

    void refresh() {
        String status = statusText();
        lastStatus = status;
        for (Consumer<String> listener : listeners) {
            try {
                listener.accept(status);
            } catch (RuntimeException exception) {
                logger.warn("进度监听器执行失败", exception);
            }
        }
    }

    public synchronized void stop() {
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        executor = null;
    }

    @Override
    public void close() {
        stop();
    }
}
