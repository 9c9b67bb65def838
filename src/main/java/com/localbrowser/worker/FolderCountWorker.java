package com.localbrowser.worker;

import com.localbrowser.record.Record;
import com.localbrowser.record.RecordRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * 统计文件夹分组中每个子文件夹的条目数。
 *
 * <p>递归遍历，跳过以点开头的隐藏条目，超过上限即停止遍历并记为上限值。
 * 每统计完一个子文件夹就发出一次"条目就绪"事件；整组处理完不再额外发出事件。</p>
 */
public class FolderCountWorker extends Worker {
    private static final Logger logger = LoggerFactory.getLogger(FolderCountWorker.class);

    private final int limit;

    public FolderCountWorker(int limit) {
        super("folder-count");
        this.limit = limit;
    }

    @Override
    protected Optional<RecordRef> step(RecordRef ref) {
        Record group = live(ref);
        if (group == null) {
            return Optional.empty();
        }
        for (Record child : group.getChildren()) {
            RecordRef childRef = ref.child(child);
            if (live(ref) == null || live(childRef) == null) {
                return Optional.empty();
            }
            OptionalInt count = countEntries(ref, Path.of(child.getPath()));
            if (count.isEmpty()) {
                return Optional.empty();
            }
            Record liveChild = live(childRef);
            if (liveChild == null) {
                return Optional.empty();
            }
            liveChild.setEntryCount(Math.min(count.getAsInt(), limit));
            liveChild.setEntryCountCapped(count.getAsInt() > limit);
            if (live(ref) == null) {
                return Optional.empty();
            }
            fireItemReady(childRef);
        }
        return Optional.empty();
    }

    /**
     * 统计目录下的条目数。
     *
     * @return 遍历期间句柄失效或收到中断时返回空；超过上限时返回上限加一
     */
    OptionalInt countEntries(RecordRef ref, Path directory) {
        EntryCounter counter = new EntryCounter(ref, directory);
        try {
            Files.walkFileTree(directory, counter);
        } catch (IOException ioException) {
            logger.warn("遍历文件夹失败: {} - {}", directory, ioException.getMessage());
        }
        if (counter.aborted) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(counter.count);
    }

    /**
     * 每计入一个条目后调用。
     */
    protected void entryCounted(Path entry) {
    }

    private static boolean isHidden(Path path) {
        Path fileName = path.getFileName();
        return fileName != null && fileName.toString().startsWith(".");
    }

    private final class EntryCounter extends SimpleFileVisitor<Path> {
        private final RecordRef ref;
        private final Path root;
        private int count;
        private boolean aborted;

        private EntryCounter(RecordRef ref, Path root) {
            this.ref = ref;
            this.root = root;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            if (dir.equals(root)) {
                return FileVisitResult.CONTINUE;
            }
            if (live(ref) == null) {
                aborted = true;
                return FileVisitResult.TERMINATE;
            }
            if (isHidden(dir)) {
                return FileVisitResult.SKIP_SUBTREE;
            }
            return increment(dir);
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (live(ref) == null) {
                aborted = true;
                return FileVisitResult.TERMINATE;
            }
            return isHidden(file) ? FileVisitResult.CONTINUE : increment(file);
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exception) {
            logger.debug("无法访问: {} - {}", file, exception.getMessage());
            return FileVisitResult.CONTINUE;
        }

        private FileVisitResult increment(Path entry) {
            count++;
            entryCounted(entry);
            return count > limit ? FileVisitResult.TERMINATE : FileVisitResult.CONTINUE;
        }
    }
}
