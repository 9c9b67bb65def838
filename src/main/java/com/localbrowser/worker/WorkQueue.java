package com.localbrowser.worker;

import com.localbrowser.record.RecordRef;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 待处理句柄的双端队列。
 *
 * <p>普通提交压入冷端（队头），出队总是从热端（队尾）取，因此普通提交之间是先进先出；
 * 强制提交直接压入热端，强制提交之间后进先出，并且总是先于已在排队的普通提交被取出。
 * 强制提交全部取完后恢复先进先出。</p>
 *
 * <p>普通提交不应重复入队，{@link #submitIfAbsent(RecordRef)} 以原子方式完成检查与入队；
 * {@link #submit(RecordRef, boolean)} 本身不做检查；界面滚动等高频场景使用 {@link #promote(RecordRef)}。</p>
 */
public final class WorkQueue {
    private final String name;
    private final Deque<RecordRef> entries = new ArrayDeque<>();
    private final Map<RecordRef, Integer> occurrences = new HashMap<>();
    private final AtomicLong completed = new AtomicLong();

    public WorkQueue(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    /**
     * 入队，不检查是否已存在。
     *
     * @param ref 记录句柄
     * @param force 为 {@code true} 时插到所有普通提交之前
     */
    public synchronized void submit(RecordRef ref, boolean force) {
        if (force) {
            entries.addLast(ref);
        } else {
            entries.addFirst(ref);
        }
        occurrences.merge(ref, 1, Integer::sum);
    }

    /**
     * 句柄不在队列中时按普通提交入队。
     *
     * @return 实际入队返回 {@code true}
     */
    public synchronized boolean submitIfAbsent(RecordRef ref) {
        if (occurrences.containsKey(ref)) {
            return false;
        }
        submit(ref, false);
        return true;
    }

    /**
     * 把句柄移到热端，使其下一个被取出。队列中原有的副本被移除，因此反复提升同一句柄不会使队列增长。
     *
     * @return 句柄原本已在热端时返回 {@code false}
     */
    public synchronized boolean promote(RecordRef ref) {
        if (ref.equals(entries.peekLast())) {
            return false;
        }
        if (occurrences.containsKey(ref)) {
            entries.removeIf(ref::equals);
        }
        entries.addLast(ref);
        occurrences.put(ref, 1);
        return true;
    }

    /**
     * 非阻塞出队。
     */
    public synchronized Optional<RecordRef> dequeue() {
        RecordRef ref = entries.pollLast();
        if (ref == null) {
            return Optional.empty();
        }
        occurrences.computeIfPresent(ref, (key, count) -> count == 1 ? null : count - 1);
        return Optional.of(ref);
    }

    public synchronized boolean contains(RecordRef ref) {
        return occurrences.containsKey(ref);
    }

    public synchronized int size() {
        return entries.size();
    }

    /**
     * 清空队列。
     *
     * @return 被丢弃的句柄数量
     */
    public synchronized int drain() {
        int discarded = entries.size();
        entries.clear();
        occurrences.clear();
        return discarded;
    }

    /**
     * 记录一个单元处理完成。
     */
    public void taskDone() {
        completed.incrementAndGet();
    }

    public long completedCount() {
        return completed.get();
    }

    @Override
    public String toString() {
        return "WorkQueue[" + name + ", size=" + size() + "]";
    }
}
