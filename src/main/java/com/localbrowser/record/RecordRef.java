package com.localbrowser.record;

/**
 * 指向集合中某条记录的非持有句柄，每次访问前都要做存活检查。
 *
 * <p>集合切换目录、过滤或重新加载时会推进代号并丢弃旧记录，旧句柄随之失效，
 * {@link #get()} 返回 {@code null}。这是常见情况而不是错误：工作线程据此放弃处理。</p>
 */
public final class RecordRef {
    private final RecordCollection owner;
    private final long generation;
    private final Record record;

    RecordRef(RecordCollection owner, long generation, Record record) {
        this.owner = owner;
        this.generation = generation;
        this.record = record;
    }

    /**
     * 存活检查。
     *
     * @return 记录仍由集合持有时返回记录，否则返回 {@code null}
     */
    public Record get() {
        if (record.isDetached() || owner.generation() != generation) {
            return null;
        }
        return record;
    }

    public boolean isAlive() {
        return get() != null;
    }

    /**
     * 为文件夹记录的子记录创建同代号的句柄。
     */
    public RecordRef child(Record child) {
        return new RecordRef(owner, generation, child);
    }

    public RecordCollection owner() {
        return owner;
    }

    public long generation() {
        return generation;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RecordRef)) {
            return false;
        }
        RecordRef that = (RecordRef) other;
        return owner == that.owner && generation == that.generation && record == that.record;
    }

    @Override
    public int hashCode() {
        int result = System.identityHashCode(owner);
        result = 31 * result + Long.hashCode(generation);
        return 31 * result + System.identityHashCode(record);
    }

    @Override
    public String toString() {
        return "RecordRef[" + record + ", gen=" + generation + (isAlive() ? "" : ", stale") + "]";
    }
}
