package com.localbrowser.sidecar;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;
import java.util.Optional;

/**
 * 基于 SQLite 的侧车存储，每行保存一个条目的一个字段。
 *
 * <p>连接在多个工作线程之间共享，所有访问都在实例锁内进行。</p>
 */
public final class SqliteSidecarStore implements SidecarStore {
    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS sidecar (
                item_key TEXT NOT NULL,
                field    TEXT NOT NULL,
                value    TEXT,
                PRIMARY KEY (item_key, field)
            )
            """;

    private static final String ENABLE_WAL_SQL = "PRAGMA journal_mode=WAL";
    private static final String SELECT_SQL = "SELECT value FROM sidecar WHERE item_key = ? AND field = ?";
    private static final String UPSERT_SQL = """
            INSERT INTO sidecar(item_key, field, value) VALUES (?, ?, ?)
            ON CONFLICT(item_key, field) DO UPDATE SET value = excluded.value
            """;

    private final Path dbPath;
    private final Connection connection;

    /**
     * 打开或创建侧车数据库并启用 WAL。
     */
    public SqliteSidecarStore(Path dbPath) {
        this.dbPath = dbPath;
        try {
            Path parent = dbPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            this.connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath.toAbsolutePath());
            initializeSchema();
        } catch (SQLException | IOException exception) {
            throw new IllegalStateException("初始化侧车存储失败: " + dbPath, exception);
        }
    }

    @Override
    public synchronized Optional<String> get(String itemKey, String field) {
        try (PreparedStatement preparedStatement = connection.prepareStatement(SELECT_SQL)) {
            preparedStatement.setString(1, normalizeKey(itemKey));
            preparedStatement.setString(2, field);
            try (ResultSet resultSet = preparedStatement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                return Optional.ofNullable(resultSet.getString(1));
            }
        } catch (SQLException sqlException) {
            throw new SidecarReadException("读取侧车字段失败, key=" + itemKey + ", field=" + field, sqlException);
        }
    }

    @Override
    public synchronized void put(String itemKey, String field, String value) {
        try (PreparedStatement preparedStatement = connection.prepareStatement(UPSERT_SQL)) {
            preparedStatement.setString(1, normalizeKey(itemKey));
            preparedStatement.setString(2, field);
            preparedStatement.setString(3, value);
            preparedStatement.executeUpdate();
        } catch (SQLException sqlException) {
            throw new IllegalStateException("写入侧车字段失败, key=" + itemKey + ", field=" + field, sqlException);
        }
    }

    /**
     * 读取当前连接的 journal_mode。
     */
    synchronized String getJournalMode() {
        try (Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery("PRAGMA journal_mode")) {
            return resultSet.next() ? resultSet.getString(1) : "";
        } catch (SQLException sqlException) {
            throw new IllegalStateException("读取 journal_mode 失败", sqlException);
        }
    }

    /**
     * 关闭数据库连接。
     */
    @Override
    public synchronized void close() {
        try {
            connection.close();
        } catch (SQLException sqlException) {
            throw new IllegalStateException("关闭侧车存储失败: " + dbPath, sqlException);
        }
    }

    private void initializeSchema() throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute(ENABLE_WAL_SQL);
            statement.execute(CREATE_TABLE_SQL);
        }
    }

    private String normalizeKey(String rawKey) {
        return rawKey.replace('\\', '/').toLowerCase(Locale.ROOT);
    }
}
