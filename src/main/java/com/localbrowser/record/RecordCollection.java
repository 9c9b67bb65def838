package com.localbrowser.record;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 持有记录的内存集合，所有记录的唯一所有者。
 *
 * <p>每次 {@link #reset(List)} 或 {@link #discard()} 都会推进代号，之前发出的
 * {@link RecordRef} 全部失效。排序只改变顺序，不影响句柄。</p>
 */
public class RecordCollection {
    private final String name;
    private final List<Record> records = new ArrayList<>();
    private final AtomicLong generation = new AtomicLong();
    private volatile boolean fullyLoaded;
    private Comparator<Record> comparator = Comparator.comparing(Record::sortKey);

    public RecordCollection(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public long generation() {
        return generation.get();
    }

    /**
     * 替换全部记录，旧记录被标记为已丢弃。
     */
    public synchronized void reset(List<Record> newRecords) {
        for (Record record : records) {
            record.detach();
        }
        records.clear();
        records.addAll(newRecords);
        records.sort(comparator);
        generation.incrementAndGet();
        fullyLoaded = false;
    }

    public void discard() {
        reset(List.of());
    }

    public synchronized int size() {
        return records.size();
    }

    public synchronized Record get(int index) {
        return records.get(index);
    }

    /**
     * 当前记录的快照，遍历期间集合可被其他线程替换。
     */
    public synchronized List<Record> snapshot() {
        return List.copyOf(records);
    }

    public synchronized List<RecordRef> refs() {
        long currentGeneration = generation.get();
        List<RecordRef> refs = new ArrayList<>(records.size());
        for (Record record : records) {
            refs.add(new RecordRef(this, currentGeneration, record));
        }
        return refs;
    }

    /**
     * 为集合中的记录创建句柄。
     *
     * @throws IllegalArgumentException 记录不属于该集合时抛出
     */
    public synchronized RecordRef refOf(Record record) {
        for (Record candidate : records) {
            if (candidate == record) {
                return new RecordRef(this, generation.get(), record);
            }
        }
        throw new IllegalArgumentException("记录不属于集合 " + name + ": " + record);
    }

    public synchronized void setComparator(Comparator<Record> comparator) {
        this.comparator = comparator;
        records.sort(comparator);
    }

    public synchronized void sort() {
        records.sort(comparator);
    }

    public boolean isFullyLoaded() {
        return fullyLoaded;
    }

    /**
     * 后台扫描确认所有记录都已加载元数据，按新数据重新排序。
     */
    public void markFullyLoaded() {
        fullyLoaded = true;
        sort();
    }

    @Override
    public String toString() {
        return "RecordCollection[" + name + ", gen=" + generation.get() + "]";
    }
}
