package com.localbrowser.sidecar;

import java.util.Optional;

/**
 * 每个条目的侧车元数据存储（键 → 字段 → 值）。
 */
public interface SidecarStore extends AutoCloseable {
    String DESCRIPTION = "description";
    String NOTES = "notes";
    String FLAGS = "flags";
    String ARCHIVED = "archived";

    /**
     * 读取字段值。
     *
     * @throws SidecarReadException 存储不可读或已损坏时抛出
     */
    Optional<String> get(String itemKey, String field);

    void put(String itemKey, String field, String value);

    @Override
    void close();
}
