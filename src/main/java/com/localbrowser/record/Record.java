package com.localbrowser.record;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * 列表中的一条可浏览记录：单文件、折叠后的帧序列或文件夹。
 *
 * <p>记录由所属的 {@link RecordCollection} 独占持有。后台工作线程只会原地写入字段，
 * 界面线程随时可能读到只加载了一部分的记录，因此每个输出字段都是独立的 volatile 写入。</p>
 */
public final class Record {
    private final RecordType type;
    private final SequenceName sequence;
    private final List<String> frames;
    private final String sidecarKey;
    private final List<Record> children;

    private volatile String path;
    private volatile String displayName;
    private volatile List<Path> entries;
    private volatile int flags = RecordFlags.defaults();
    private volatile int rowHeight;

    private volatile String description = "";
    private volatile int todoCount;
    private volatile int entryCount;
    private volatile boolean entryCountCapped;
    private volatile long sizeBytes;
    private volatile Instant lastModified = Instant.EPOCH;
    private volatile String details = "";
    private volatile String startPath;
    private volatile String endPath;

    private volatile Path thumbnailPath;
    private volatile BufferedImage thumbnail;
    private volatile Color thumbnailBackground;
    private volatile BufferedImage defaultThumbnail;
    private volatile Color defaultThumbnailBackground;

    private volatile boolean infoLoaded;
    private volatile boolean thumbnailLoaded;
    private volatile boolean detached;

    private Record(RecordType type, String path, SequenceName sequence, List<String> frames,
                   List<Path> entries, String sidecarKey, List<Record> children) {
        this.type = type;
        this.path = path;
        this.displayName = fileNameOf(path);
        this.sequence = sequence;
        this.frames = List.copyOf(frames);
        this.entries = List.copyOf(entries);
        this.sidecarKey = sidecarKey;
        this.children = List.copyOf(children);
    }

    /**
     * 单文件记录，保留一个文件系统句柄供后台线程读取属性。
     */
    public static Record file(Path file) {
        String normalizedPath = normalizePath(file.toString());
        return new Record(RecordType.FILE, normalizedPath, null, List.of(), List.of(file), normalizedPath, List.of());
    }

    /**
     * 折叠后的帧序列记录。路径先写作代理路径，元数据加载后改为区间路径。
     */
    public static Record sequence(SequenceName sequence, List<String> frames, List<Path> entries) {
        if (frames.isEmpty()) {
            throw new IllegalArgumentException("序列至少需要一帧: " + sequence.proxyPath());
        }
        String proxyPath = sequence.proxyPath();
        return new Record(RecordType.SEQUENCE, proxyPath, sequence, frames, entries, proxyPath, List.of());
    }

    /**
     * 文件夹记录；{@code children} 为需要逐个统计的子文件夹。
     */
    public static Record folder(Path directory, List<Record> children) {
        String normalizedPath = normalizePath(directory.toString());
        return new Record(RecordType.FOLDER, normalizedPath, null, List.of(), List.of(), normalizedPath, children);
    }

    public RecordType getType() {
        return type;
    }

    public SequenceName getSequence() {
        return sequence;
    }

    public List<String> getFrames() {
        return frames;
    }

    /**
     * 侧车存储与缩略图缓存使用的内容键。序列使用 {@code [0]} 代理路径，在重命名显示路径后保持不变。
     */
    public String getSidecarKey() {
        return sidecarKey;
    }

    public List<Record> getChildren() {
        return children;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    /**
     * 小写扩展名，没有扩展名时为空串。序列取模式中的扩展名。
     */
    public String getExtension() {
        if (sequence != null) {
            return sequence.extension().toLowerCase(Locale.ROOT);
        }
        String name = fileNameOf(path);
        int dotIndex = name.lastIndexOf('.');
        return dotIndex < 0 ? "" : name.substring(dotIndex + 1).toLowerCase(Locale.ROOT);
    }

    public List<Path> getEntries() {
        return entries;
    }

    /**
     * 释放文件系统句柄，元数据加载完成后不再需要。
     */
    public void releaseEntries() {
        this.entries = List.of();
    }

    public int getFlags() {
        return flags;
    }

    public void setFlags(int flags) {
        this.flags = flags;
    }

    public boolean hasFlag(int flag) {
        return RecordFlags.has(flags, flag);
    }

    public int getRowHeight() {
        return rowHeight;
    }

    public void setRowHeight(int rowHeight) {
        this.rowHeight = rowHeight;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public int getTodoCount() {
        return todoCount;
    }

    public void setTodoCount(int todoCount) {
        this.todoCount = todoCount;
    }

    public int getEntryCount() {
        return entryCount;
    }

    public void setEntryCount(int entryCount) {
        this.entryCount = entryCount;
    }

    /**
     * 实际条目数超过计数上限时为 {@code true}，此时 {@link #getEntryCount()} 为上限值。
     */
    public boolean isEntryCountCapped() {
        return entryCountCapped;
    }

    public void setEntryCountCapped(boolean entryCountCapped) {
        this.entryCountCapped = entryCountCapped;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public void setSizeBytes(long sizeBytes) {
        this.sizeBytes = sizeBytes;
    }

    public Instant getLastModified() {
        return lastModified;
    }

    public void setLastModified(Instant lastModified) {
        this.lastModified = lastModified;
    }

    public String getDetails() {
        return details;
    }

    public void setDetails(String details) {
        this.details = details;
    }

    public String getStartPath() {
        return startPath;
    }

    public void setStartPath(String startPath) {
        this.startPath = startPath;
    }

    public String getEndPath() {
        return endPath;
    }

    public void setEndPath(String endPath) {
        this.endPath = endPath;
    }

    public Path getThumbnailPath() {
        return thumbnailPath;
    }

    public void setThumbnailPath(Path thumbnailPath) {
        this.thumbnailPath = thumbnailPath;
    }

    public BufferedImage getThumbnail() {
        return thumbnail;
    }

    public void setThumbnail(BufferedImage thumbnail) {
        this.thumbnail = thumbnail;
    }

    public Color getThumbnailBackground() {
        return thumbnailBackground;
    }

    public void setThumbnailBackground(Color thumbnailBackground) {
        this.thumbnailBackground = thumbnailBackground;
    }

    public BufferedImage getDefaultThumbnail() {
        return defaultThumbnail;
    }

    public Color getDefaultThumbnailBackground() {
        return defaultThumbnailBackground;
    }

    /**
     * 设置占位缩略图，同时作为当前显示的缩略图。
     */
    public void setPlaceholder(BufferedImage image, Color background) {
        this.defaultThumbnail = image;
        this.defaultThumbnailBackground = background;
        this.thumbnail = image;
        this.thumbnailBackground = background;
    }

    /**
     * 回退到占位缩略图。
     */
    public void usePlaceholder() {
        this.thumbnail = defaultThumbnail;
        this.thumbnailBackground = defaultThumbnailBackground;
    }

    public boolean isInfoLoaded() {
        return infoLoaded;
    }

    public void setInfoLoaded(boolean infoLoaded) {
        this.infoLoaded = infoLoaded;
    }

    public boolean isThumbnailLoaded() {
        return thumbnailLoaded;
    }

    public void setThumbnailLoaded(boolean thumbnailLoaded) {
        this.thumbnailLoaded = thumbnailLoaded;
    }

    /**
     * 所属集合已丢弃该记录。
     */
    public boolean isDetached() {
        return detached;
    }

    void detach() {
        detached = true;
        for (Record child : children) {
            child.detach();
        }
    }

    /**
     * 把后台写入的字段恢复为初始状态，使缩略图线程重新加载。
     */
    public void resetThumbnail() {
        this.thumbnailLoaded = false;
        this.thumbnailPath = null;
        usePlaceholder();
    }

    String sortKey() {
        return path.toLowerCase(Locale.ROOT);
    }

    static String normalizePath(String rawPath) {
        return rawPath.replace('\\', '/');
    }

    private static String fileNameOf(String path) {
        int slashIndex = path.lastIndexOf('/');
        return slashIndex < 0 ? path : path.substring(slashIndex + 1);
    }

    @Override
    public String toString() {
        return type + ":" + path;
    }
}
