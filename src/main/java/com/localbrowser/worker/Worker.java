package com.localbrowser.worker;

import com.localbrowser.record.Record;
import com.localbrowser.record.RecordRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * 绑定单个队列的工作单元，每次激活处理一个句柄。
 *
 * <p>取消是协作式的：{@link #requestReset()} 置位中断标志并清空队列，
 * {@link #step(RecordRef)} 在每次触碰记录前通过 {@link #live(RecordRef)} 检查标志与存活状态。
 * 一次激活结束后标志自动清除，重置只是一次脉冲。</p>
 */
public abstract class Worker {
    private static final Logger logger = LoggerFactory.getLogger(Worker.class);

    private final String name;
    private final WorkQueue queue;
    private final AtomicBoolean interrupt = new AtomicBoolean();
    private final AtomicBoolean shutdownRequested = new AtomicBoolean();
    private final List<Consumer<RecordRef>> itemReadyListeners = new CopyOnWriteArrayList<>();
    private volatile Thread boundThread;
    private volatile boolean busy;

    protected Worker(String name) {
        this.name = name;
        this.queue = new WorkQueue(name);
    }

    public String name() {
        return name;
    }

    public WorkQueue queue() {
        return queue;
    }

    /**
     * 由计时器驱动的一次激活。不会抛出异常。
     */
    public void activate() {
        busy = true;
        try {
            processNext();
        } finally {
            interrupt.set(false);
            busy = false;
        }
    }

    /**
     * 取出一个句柄交给 {@link #step(RecordRef)}；失败的句柄直接丢弃，不重试。
     */
    protected void processNext() {
        Optional<RecordRef> next = queue.dequeue();
        if (next.isEmpty()) {
            return;
        }
        RecordRef ref = next.get();
        try {
            Optional<RecordRef> result = step(ref);
            if (result.isPresent()) {
                fireItemReady(result.get());
                queue.taskDone();
            }
        } catch (RuntimeException exception) {
            logger.error("[{}] 处理失败: {}", name, ref, exception);
        }
    }

    /**
     * 处理一个句柄。
     *
     * @return 成功时返回句柄，句柄失效、被中断或无事可做时返回空
     */
    protected abstract Optional<RecordRef> step(RecordRef ref);

    /**
     * 存活检查：被中断或句柄失效时返回 {@code null}。
     */
    protected final Record live(RecordRef ref) {
        if (interrupt.get()) {
            return null;
        }
        Record record = ref.get();
        if (record == null) {
            logger.trace("[{}] 句柄已失效: {}", name, ref);
        }
        return record;
    }

    /**
     * 请求重置：中断进行中的处理并清空队列。
     */
    public void requestReset() {
        interrupt.set(true);
        int discarded = queue.drain();
        logger.debug("[{}] 重置队列，丢弃 {} 项", name, discarded);
    }

    public boolean isInterrupted() {
        return interrupt.get();
    }

    public void clearInterrupt() {
        interrupt.set(false);
    }

    public void requestShutdown() {
        shutdownRequested.set(true);
        interrupt.set(true);
    }

    public boolean isShutdownRequested() {
        return shutdownRequested.get();
    }

    /**
     * 记录执行该工作单元的线程。
     */
    public void bindTo(Thread thread) {
        this.boundThread = thread;
        logger.debug("[{}] 绑定到线程 {}", name, thread.getName());
    }

    public Thread boundThread() {
        return boundThread;
    }

    /**
     * 没有进行中的激活且队列为空。
     */
    public boolean isIdle() {
        return !busy && queue.size() == 0;
    }

    public void addItemReadyListener(Consumer<RecordRef> listener) {
        itemReadyListeners.add(listener);
    }

    protected void fireItemReady(RecordRef ref) {
        for (Consumer<RecordRef> listener : itemReadyListeners) {
            listener.accept(ref);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
