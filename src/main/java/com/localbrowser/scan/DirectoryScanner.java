package com.localbrowser.scan;

import com.localbrowser.record.Record;
import com.localbrowser.record.SequenceName;
import com.localbrowser.thumbnail.Placeholders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

/**
 * 扫描目录，生成初始记录。
 *
 * <p>只写入路径、类型、文件句柄与占位缩略图，其余字段留给后台线程加载。
 * 以点开头的隐藏条目与 {@code thumbs.db} 会被跳过。</p>
 */
public final class DirectoryScanner {
    private static final Logger logger = LoggerFactory.getLogger(DirectoryScanner.class);
    private static final String THUMBS_DB = "thumbs.db";

    private final int rowHeight;
    private final Placeholders placeholders;

    public DirectoryScanner(int rowHeight, Placeholders placeholders) {
        this.rowHeight = rowHeight;
        this.placeholders = placeholders;
    }

    /**
     * 递归扫描目录下的文件。
     *
     * @param root 根目录
     * @param collapseSequences 为 {@code true} 时把帧号连续变化的文件折叠为序列，只有一帧的仍作为单文件
     * @return 初始记录
     * @throws IOException 根目录不可读时抛出
     */
    public List<Record> scan(Path root, boolean collapseSequences) throws IOException {
        Path normalizedRoot = requireDirectory(root);
        List<Path> files = listFiles(normalizedRoot);

        List<Record> records = new ArrayList<>();
        Map<String, SequenceGroup> groups = new LinkedHashMap<>();
        for (Path file : files) {
            if (!collapseSequences) {
                records.add(prepare(Record.file(file)));
                continue;
            }
            String normalizedPath = file.toString().replace('\\', '/');
            SequenceName.parse(normalizedPath).ifPresentOrElse(
                sequence -> groups
                    .computeIfAbsent(sequence.groupKey().toLowerCase(Locale.ROOT), key -> new SequenceGroup(sequence))
                    .add(sequence.frame(), file),
                () -> records.add(prepare(Record.file(file))));
        }

        for (SequenceGroup group : groups.values()) {
            if (group.frames.size() == 1) {
                records.add(prepare(Record.file(group.entries.get(0))));
            } else {
                records.add(prepare(Record.sequence(group.sequence, group.frames, group.entries)));
            }
        }
        logger.info("扫描完成: {} ({} 个文件，{} 条记录)", normalizedRoot, files.size(), records.size());
        return records;
    }

    /**
     * 扫描根目录下的直接子文件夹，返回以根目录为分组、子文件夹为成员的文件夹记录。
     */
    public Record scanFolders(Path root) throws IOException {
        Path normalizedRoot = requireDirectory(root);
        List<Record> children = new ArrayList<>();
        try (Stream<Path> entries = Files.list(normalizedRoot)) {
            entries
                .filter(Files::isDirectory)
                .filter(path -> !isHidden(path))
                .sorted()
                .forEach(directory -> children.add(prepare(Record.folder(directory, List.of()))));
        }
        return prepare(Record.folder(normalizedRoot, children));
    }

    private Record prepare(Record record) {
        record.setRowHeight(rowHeight);
        record.setPlaceholder(placeholders.imageFor(record.getExtension(), rowHeight), Placeholders.THUMBNAIL_BACKGROUND);
        return record;
    }

    private static Path requireDirectory(Path root) {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(normalizedRoot)) {
            throw new IllegalArgumentException("目录不存在: " + root);
        }
        return normalizedRoot;
    }

    private static List<Path> listFiles(Path root) throws IOException {
        List<Path> files = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                return !dir.equals(root) && isHidden(dir) ? FileVisitResult.SKIP_SUBTREE : FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                String name = file.getFileName().toString();
                if (attrs.isRegularFile() && !isHidden(file) && !THUMBS_DB.equalsIgnoreCase(name)) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exception) {
                logger.warn("无法访问: {} - {}", file, exception.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        files.sort(null);
        return files;
    }

    private static boolean isHidden(Path path) {
        Path fileName = path.getFileName();
        return fileName != null && fileName.toString().startsWith(".");
    }

    private static final class SequenceGroup {
        private final SequenceName sequence;
        private final List<String> frames = new ArrayList<>();
        private final List<Path> entries = new ArrayList<>();

        private SequenceGroup(SequenceName sequence) {
            this.sequence = sequence;
        }

        private void add(String frame, Path entry) {
            frames.add(frame);
            entries.add(entry);
        }
    }
}
