package com.localbrowser.record;

import java.time.Instant;

/**
 * 记录的不可变快照，用于输出与展示。
 */
public record RecordSummary(
    RecordType type,
    String path,
    String displayName,
    String details,
    String description,
    int todoCount,
    int entryCount,
    boolean entryCountCapped,
    long sizeBytes,
    Instant lastModified,
    int flags,
    String thumbnailPath,
    boolean infoLoaded,
    boolean thumbnailLoaded
) {
    public static RecordSummary of(Record record) {
        return new RecordSummary(
            record.getType(),
            record.getPath(),
            record.getDisplayName(),
            record.getDetails(),
            record.getDescription(),
            record.getTodoCount(),
            record.getEntryCount(),
            record.isEntryCountCapped(),
            record.getSizeBytes(),
            record.getLastModified(),
            record.getFlags(),
            record.getThumbnailPath() == null ? null : record.getThumbnailPath().toString(),
            record.isInfoLoaded(),
            record.isThumbnailLoaded());
    }
}
