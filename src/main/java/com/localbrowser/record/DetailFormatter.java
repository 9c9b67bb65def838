package com.localbrowser.record;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * 生成列表中显示的详情字符串，字段之间以分号分隔。
 */
public final class DetailFormatter {
    private static final DateTimeFormatter DETAIL_TIME_FORMAT = DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm");

    private DetailFormatter() {
    }

    /**
     * 序列详情：{@code 4f;01/02/2026 10:30;3.00 MB}
     */
    public static String sequenceDetails(int frameCount, Instant lastModified, long sizeBytes, ZoneId zone) {
        return frameCount + "f;" + fileDetails(lastModified, sizeBytes, zone);
    }

    /**
     * 单文件详情：{@code 01/02/2026 10:30;512 B}
     */
    public static String fileDetails(Instant lastModified, long sizeBytes, ZoneId zone) {
        return DETAIL_TIME_FORMAT.format(lastModified.atZone(zone)) + ";" + formatBytes(sizeBytes);
    }

    public static String formatBytes(long bytes) {
        if (bytes < 1024) {
            return bytes + " B";
        }
        if (bytes < 1024L * 1024L) {
            return String.format(Locale.ROOT, "%.2f KB", bytes / 1024.0);
        }
        if (bytes < 1024L * 1024L * 1024L) {
            return String.format(Locale.ROOT, "%.2f MB", bytes / (1024.0 * 1024.0));
        }
        return String.format(Locale.ROOT, "%.2f GB", bytes / (1024.0 * 1024.0 * 1024.0));
    }
}
