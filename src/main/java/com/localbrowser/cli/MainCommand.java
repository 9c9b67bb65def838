package com.localbrowser.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.localbrowser.config.BrowserConfig;
import com.localbrowser.config.Constants;
import com.localbrowser.gui.DesktopApp;
import com.localbrowser.record.Record;
import com.localbrowser.record.RecordCollection;
import com.localbrowser.record.RecordSummary;
import com.localbrowser.record.SequenceName;
import com.localbrowser.scan.DirectoryScanner;
import com.localbrowser.sidecar.NotesCodec;
import com.localbrowser.sidecar.SidecarStore;
import com.localbrowser.sidecar.SqliteSidecarStore;
import com.localbrowser.thumbnail.ImageIoThumbnailGenerator;
import com.localbrowser.thumbnail.Placeholders;
import com.localbrowser.worker.EnrichmentPipeline;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "lfb",
    description = "📁 本地文件浏览器：后台加载元数据与缩略图",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.ScanSubcommand.class,
        MainCommand.CountSubcommand.class,
        MainCommand.NoteSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--gui"}, description = "启动图形界面")
    private boolean guiMode;

    @Option(names = {"--config"}, description = "JSON 配置文件路径")
    private Path configFile;

    @Option(names = {"--sidecar-db"}, description = "侧车数据库路径（覆盖配置文件）")
    private Path sidecarDb;

    @Option(names = {"--cache-dir"}, description = "缩略图缓存目录（覆盖配置文件）")
    private Path cacheDir;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        if (guiMode) {
            try {
                DesktopApp.launchAndWait(resolveConfig());
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 图形界面启动失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }
        System.out.println("📁 本地文件浏览器");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    /**
     * 合并配置：默认值 ← 配置文件 ← 命令行参数。
     */
    BrowserConfig resolveConfig() {
        BrowserConfig config = configFile == null ? BrowserConfig.defaults() : BrowserConfig.load(configFile);
        if (sidecarDb != null) {
            config.setSidecarDbPath(sidecarDb);
        }
        if (cacheDir != null) {
            config.setThumbnailCacheDir(cacheDir);
        }
        return config;
    }

    static String sidecarKeyFor(Path file, boolean sequence) {
        String normalizedPath = file.toAbsolutePath().normalize().toString().replace('\\', '/');
        if (!sequence) {
            return normalizedPath;
        }
        return SequenceName.parse(normalizedPath)
            .map(SequenceName::proxyPath)
            .orElseThrow(() -> new IllegalArgumentException("文件名不含帧号，无法作为序列: " + file));
    }

    @Command(name = "scan", description = "🔎 扫描目录并加载元数据与缩略图")
    static class ScanSubcommand implements Callable<Integer> {

        @Parameters(description = "要扫描的目录", arity = "1")
        private Path directory;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @Option(names = {"--no-collapse"}, description = "不折叠帧序列")
        private boolean noCollapse;

        @Option(names = {"--timeout"}, description = "等待加载完成的秒数", defaultValue = "120")
        private long timeoutSeconds;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            BrowserConfig config;
            try {
                config = main.resolveConfig();
            } catch (RuntimeException exception) {
                System.err.println("❌ 配置无效: " + exception.getMessage());
                return 1;
            }

            try (SidecarStore sidecarStore = new SqliteSidecarStore(config.getSidecarDbPath());
                 EnrichmentPipeline pipeline = new EnrichmentPipeline(config, sidecarStore, new ImageIoThumbnailGenerator())) {
                DirectoryScanner scanner = new DirectoryScanner(config.getRowHeight(), new Placeholders());
                RecordCollection collection = new RecordCollection(directory.toString());
                collection.reset(scanner.scan(directory, !noCollapse));

                long start = System.currentTimeMillis();
                pipeline.start();
                pipeline.load(collection);
                boolean drained = pipeline.awaitIdle(Duration.ofSeconds(timeoutSeconds));
                long elapsed = System.currentTimeMillis() - start;
                collection.sort();

                List<RecordSummary> summaries = collection.snapshot().stream().map(RecordSummary::of).toList();
                if ("json".equalsIgnoreCase(format)) {
                    printJson(summaries);
                } else {
                    printText(summaries);
                    System.out.println();
                    System.out.println("📊 共 " + summaries.size() + " 条记录，用时 " + elapsed + "ms");
                }
                if (!drained) {
                    System.err.println("⚠️ 等待超时，部分记录尚未加载完成");
                    return 2;
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 扫描失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }

        private void printText(List<RecordSummary> summaries) {
            if (summaries.isEmpty()) {
                System.out.println("⚠️ 目录为空");
                return;
            }
            for (RecordSummary summary : summaries) {
                System.out.println("─────────────────────────────────");
                System.out.printf("%s [%s]%n", summary.path(), summary.type());
                System.out.println("   " + summary.details());
                if (!summary.description().isEmpty()) {
                    System.out.println("   描述: " + summary.description());
                }
                if (summary.todoCount() > 0) {
                    System.out.println("   待办: " + summary.todoCount());
                }
            }
        }

        private void printJson(List<RecordSummary> summaries) throws IOException {
            ObjectMapper mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(summaries));
        }
    }

    @Command(name = "count", description = "📂 统计子文件夹中的条目数")
    static class CountSubcommand implements Callable<Integer> {

        @Parameters(description = "父目录", arity = "1")
        private Path directory;

        @Option(names = {"--timeout"}, description = "等待统计完成的秒数", defaultValue = "120")
        private long timeoutSeconds;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                BrowserConfig config = main.resolveConfig();
                try (SidecarStore sidecarStore = new SqliteSidecarStore(config.getSidecarDbPath());
                     EnrichmentPipeline pipeline = new EnrichmentPipeline(config, sidecarStore, new ImageIoThumbnailGenerator())) {
                    Record group = new DirectoryScanner(config.getRowHeight(), new Placeholders()).scanFolders(directory);
                    RecordCollection folders = new RecordCollection("folders");
                    folders.reset(List.of(group));

                    pipeline.start();
                    pipeline.loadFolders(folders);
                    boolean drained = pipeline.awaitIdle(Duration.ofSeconds(timeoutSeconds));
                    if (!drained) {
                        System.err.println("⚠️ 等待超时，文件夹统计尚未完成");
                        return 2;
                    }

                    if (group.getChildren().isEmpty()) {
                        System.out.println("⚠️ 没有子文件夹");
                    }
                    for (Record child : group.getChildren()) {
                        System.out.printf("%-8s %s%n",
                            formatCount(child.getEntryCount(), child.isEntryCountCapped()), child.getDisplayName());
                    }
                    return 0;
                }
            } catch (Exception exception) {
                System.err.println("❌ 统计失败: " + exception.getMessage());
                return 1;
            }
        }

        static String formatCount(int count, boolean capped) {
            return capped ? Constants.FOLDER_COUNT_LIMIT + "+" : String.valueOf(count);
        }
    }

    @Command(name = "note", description = "📝 写入侧车元数据（备注、描述、归档）")
    static class NoteSubcommand implements Callable<Integer> {

        @Parameters(description = "文件路径", arity = "1")
        private Path file;

        @Option(names = {"-t", "--text"}, description = "追加一条待办备注")
        private String noteText;

        @Option(names = {"-d", "--description"}, description = "设置描述")
        private String description;

        @Option(names = {"--archive"}, description = "标记为已归档")
        private boolean archive;

        @Option(names = {"--sequence"}, description = "按所属帧序列写入")
        private boolean sequence;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            if (noteText == null && description == null && !archive) {
                System.out.println("⚠️ 请至少指定 --text、--description 或 --archive 之一");
                return 1;
            }
            try {
                BrowserConfig config = main.resolveConfig();
                String itemKey = sidecarKeyFor(file, sequence);
                try (SidecarStore sidecarStore = new SqliteSidecarStore(config.getSidecarDbPath())) {
                    if (description != null) {
                        sidecarStore.put(itemKey, SidecarStore.DESCRIPTION, description);
                    }
                    if (noteText != null) {
                        String existing = sidecarStore.get(itemKey, SidecarStore.NOTES).orElse(null);
                        String updated = NotesCodec.appendNote(existing, noteText);
                        sidecarStore.put(itemKey, SidecarStore.NOTES, updated);
                        System.out.println("   待办数: " + NotesCodec.countOpenNotes(updated));
                    }
                    if (archive) {
                        sidecarStore.put(itemKey, SidecarStore.ARCHIVED, "true");
                    }
                }
                System.out.println("✅ 已写入: " + itemKey);
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 写入失败: " + exception.getMessage());
                return 1;
            }
        }
    }
}
