package com.localbrowser.record;

/**
 * 记录标志位，按位组合存放在 {@link Record#getFlags()} 中。
 */
public final class RecordFlags {
    private RecordFlags() {
    }

    public static final int NONE = 0;
    public static final int SELECTABLE = 1;
    public static final int EDITABLE = 1 << 1;
    public static final int DRAG_ENABLED = 1 << 2;
    public static final int ENABLED = 1 << 5;
    public static final int NEVER_HAS_CHILDREN = 1 << 7;

    /** 以下为应用自定义标志，与侧车存储中的 flags 字段共用同一套位 */
    public static final int ARCHIVED = 1 << 9;
    public static final int FAVOURITE = 1 << 10;
    public static final int ACTIVE = 1 << 11;

    /**
     * 新建记录的默认标志。
     */
    public static int defaults() {
        return NEVER_HAS_CHILDREN | ENABLED | SELECTABLE;
    }

    public static boolean has(int flags, int flag) {
        return (flags & flag) != 0;
    }
}
