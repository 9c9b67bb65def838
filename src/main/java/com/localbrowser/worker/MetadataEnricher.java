package com.localbrowser.worker;

import com.localbrowser.record.DetailFormatter;
import com.localbrowser.record.Record;
import com.localbrowser.record.RecordFlags;
import com.localbrowser.record.RecordRef;
import com.localbrowser.record.RecordType;
import com.localbrowser.record.SequenceName;
import com.localbrowser.sidecar.NotesCodec;
import com.localbrowser.sidecar.SidecarReadException;
import com.localbrowser.sidecar.SidecarStore;
import com.localbrowser.thumbnail.ThumbnailCacheDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * 为单条记录加载元数据：侧车字段、序列区间、文件属性与缩略图缓存路径。
 *
 * <p>每次外部读取前后都重新做存活检查，句柄失效或收到中断时立即返回空，
 * 不再写入剩余字段。侧车读取失败只影响对应字段，记录仍会被标记为已加载。</p>
 */
public final class MetadataEnricher {
    private static final Logger logger = LoggerFactory.getLogger(MetadataEnricher.class);

    private final SidecarStore sidecarStore;
    private final ThumbnailCacheDir thumbnailCacheDir;
    private final ZoneId zone;

    public MetadataEnricher(SidecarStore sidecarStore, ThumbnailCacheDir thumbnailCacheDir, ZoneId zone) {
        this.sidecarStore = sidecarStore;
        this.thumbnailCacheDir = thumbnailCacheDir;
        this.zone = zone;
    }

    /**
     * 加载元数据。
     *
     * @param ref 记录句柄
     * @param interrupted 中断标志
     * @return 完成时返回句柄；已加载、句柄失效或被中断时返回空
     */
    public Optional<RecordRef> enrich(RecordRef ref, BooleanSupplier interrupted) {
        Record record = live(ref, interrupted);
        if (record == null || record.isInfoLoaded()) {
            return Optional.empty();
        }

        String itemKey = record.getSidecarKey();
        if (!loadSidecar(ref, interrupted, itemKey)) {
            return Optional.empty();
        }

        record = live(ref, interrupted);
        if (record == null) {
            return Optional.empty();
        }
        boolean complete = record.getType() == RecordType.SEQUENCE
            ? loadSequence(ref, interrupted, record)
            : loadFile(ref, interrupted, record);
        if (!complete) {
            return Optional.empty();
        }

        Path thumbnailPath = thumbnailCacheDir.thumbnailPath(itemKey);
        record = live(ref, interrupted);
        if (record == null) {
            return Optional.empty();
        }
        record.setThumbnailPath(thumbnailPath);
        record.setInfoLoaded(true);
        record.releaseEntries();
        return live(ref, interrupted) == null ? Optional.empty() : Optional.of(ref);
    }

    private boolean loadSidecar(RecordRef ref, BooleanSupplier interrupted, String itemKey) {
        Optional<String> description = readField(itemKey, SidecarStore.DESCRIPTION);
        Record record = live(ref, interrupted);
        if (record == null) {
            return false;
        }
        description.filter(value -> !value.isBlank()).ifPresent(record::setDescription);

        Optional<String> notes = readField(itemKey, SidecarStore.NOTES);
        int todoCount = 0;
        if (notes.isPresent()) {
            try {
                todoCount = NotesCodec.countOpenNotes(notes.get());
            } catch (SidecarReadException exception) {
                logger.warn("备注无法解析: {} - {}", itemKey, exception.getMessage());
            }
        }
        record = live(ref, interrupted);
        if (record == null) {
            return false;
        }
        record.setTodoCount(todoCount);

        Optional<String> storedFlags = readField(itemKey, SidecarStore.FLAGS);
        Optional<String> archived = readField(itemKey, SidecarStore.ARCHIVED);
        record = live(ref, interrupted);
        if (record == null) {
            return false;
        }
        int flags = record.getFlags() | RecordFlags.EDITABLE | RecordFlags.DRAG_ENABLED;
        if (storedFlags.isPresent()) {
            try {
                flags |= Integer.parseInt(storedFlags.get().trim());
            } catch (NumberFormatException exception) {
                logger.warn("侧车标志无效: {} = {}", itemKey, storedFlags.get());
            }
        }
        if (archived.map(MetadataEnricher::isTrue).orElse(false)) {
            flags |= RecordFlags.ARCHIVED;
        }
        record.setFlags(flags);
        return true;
    }

    private boolean loadSequence(RecordRef ref, BooleanSupplier interrupted, Record record) {
        SequenceName sequence = record.getSequence();
        List<String> frames = record.getFrames();
        int padding = frames.get(0).length();
        List<Integer> frameNumbers = new ArrayList<>(frames.size());
        for (String frame : frames) {
            frameNumbers.add(Integer.parseInt(frame));
        }
        int first = frameNumbers.stream().mapToInt(Integer::intValue).min().orElseThrow();
        int last = frameNumbers.stream().mapToInt(Integer::intValue).max().orElseThrow();
        String collapsedPath = sequence.collapsedPath(SequenceName.rangeString(frameNumbers, padding));

        record.setStartPath(sequence.pathForFrame(first, padding));
        record.setEndPath(sequence.pathForFrame(last, padding));
        record.setPath(collapsedPath);
        record.setDisplayName(collapsedPath.substring(collapsedPath.lastIndexOf('/') + 1));

        long totalSize = 0;
        Instant latest = null;
        for (Path entry : record.getEntries()) {
            if (live(ref, interrupted) == null) {
                return false;
            }
            Optional<BasicFileAttributes> attributes = stat(entry);
            if (attributes.isEmpty()) {
                continue;
            }
            totalSize += attributes.get().size();
            Instant modified = attributes.get().lastModifiedTime().toInstant();
            if (latest == null || modified.isAfter(latest)) {
                latest = modified;
            }
        }

        record = live(ref, interrupted);
        if (record == null) {
            return false;
        }
        if (latest != null) {
            record.setSizeBytes(totalSize);
            record.setLastModified(latest);
            record.setDetails(DetailFormatter.sequenceDetails(frames.size(), latest, totalSize, zone));
        }
        return true;
    }

    private boolean loadFile(RecordRef ref, BooleanSupplier interrupted, Record record) {
        List<Path> entries = record.getEntries();
        if (entries.isEmpty()) {
            return true;
        }
        Optional<BasicFileAttributes> attributes = stat(entries.get(0));
        record = live(ref, interrupted);
        if (record == null) {
            return false;
        }
        if (attributes.isPresent()) {
            Instant modified = attributes.get().lastModifiedTime().toInstant();
            long size = attributes.get().size();
            record.setSizeBytes(size);
            record.setLastModified(modified);
            record.setDetails(DetailFormatter.fileDetails(modified, size, zone));
        }
        return true;
    }

    private Optional<String> readField(String itemKey, String field) {
        try {
            return sidecarStore.get(itemKey, field);
        } catch (SidecarReadException exception) {
            logger.warn("读取侧车字段失败: {}.{} - {}", itemKey, field, exception.getMessage());
            return Optional.empty();
        }
    }

    private static Optional<BasicFileAttributes> stat(Path entry) {
        try {
            return Optional.of(Files.readAttributes(entry, BasicFileAttributes.class));
        } catch (IOException ioException) {
            logger.warn("无法读取文件属性: {} - {}", entry, ioException.getMessage());
            return Optional.empty();
        }
    }

    private static Record live(RecordRef ref, BooleanSupplier interrupted) {
        return interrupted.getAsBoolean() ? null : ref.get();
    }

    private static boolean isTrue(String value) {
        String trimmed = value.trim();
        return "1".equals(trimmed) || "true".equalsIgnoreCase(trimmed);
    }
}
