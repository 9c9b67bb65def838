package com.localbrowser.gui;

import com.localbrowser.config.BrowserConfig;
import com.localbrowser.record.Record;
import com.localbrowser.record.RecordCollection;
import com.localbrowser.scan.DirectoryScanner;
import com.localbrowser.sidecar.SidecarStore;
import com.localbrowser.sidecar.SqliteSidecarStore;
import com.localbrowser.thumbnail.ImageIoThumbnailGenerator;
import com.localbrowser.thumbnail.Placeholders;
import com.localbrowser.worker.EnrichmentPipeline;

import javax.swing.BorderFactory;
import javax.swing.JButton;
import javax.swing.JCheckBox;
import javax.swing.JFrame;
import javax.swing.JLabel;
import javax.swing.JOptionPane;
import javax.swing.JPanel;
import javax.swing.JScrollPane;
import javax.swing.JSplitPane;
import javax.swing.JTable;
import javax.swing.JTextArea;
import javax.swing.JTextField;
import javax.swing.ListSelectionModel;
import javax.swing.SwingUtilities;
import javax.swing.SwingWorker;
import javax.swing.Timer;
import javax.swing.WindowConstants;
import java.awt.BorderLayout;
import java.awt.FlowLayout;
import java.awt.GraphicsEnvironment;
import java.awt.Point;
import java.awt.Rectangle;
import java.awt.event.WindowAdapter;
import java.awt.event.WindowEvent;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.function.Consumer;

public final class DesktopApp {
    private DesktopApp() {
    }

    static Path parseDirectory(String rawPath) {
        String trimmedPath = rawPath.trim();
        if (trimmedPath.isEmpty()) {
            throw new IllegalArgumentException("目录不能为空");
        }
        try {
            return Path.of(trimmedPath);
        } catch (InvalidPathException invalidPathException) {
            throw new IllegalArgumentException("目录非法: " + trimmedPath);
        }
    }

    static String formatTodoCount(int todoCount) {
        return todoCount <= 0 ? "" : String.valueOf(todoCount);
    }

    /**
     * 可见区域覆盖的行区间 [first, last]，没有可见行时返回 {@code null}。
     */
    static int[] visibleRows(JTable table, Rectangle visibleRect) {
        if (table.getRowCount() == 0) {
            return null;
        }
        int first = table.rowAtPoint(visibleRect.getLocation());
        if (first < 0) {
            return null;
        }
        int last = table.rowAtPoint(new Point(visibleRect.x, visibleRect.y + visibleRect.height - 1));
        if (last < 0) {
            last = table.getRowCount() - 1;
        }
        return new int[] {first, last};
    }

    public static void launchAndWait(BrowserConfig config) throws Exception {
        if (GraphicsEnvironment.isHeadless()) {
            throw new IllegalStateException("当前环境不支持图形界面");
        }

        CountDownLatch closeSignal = new CountDownLatch(1);
        Holder<RuntimeException> startupFailure = new Holder<>();

        SwingUtilities.invokeAndWait(() -> {
            try {
                MainFrame frame = new MainFrame(config);
                frame.addWindowListener(new WindowAdapter() {
                    @Override
                    public void windowClosed(WindowEvent windowEvent) {
                        frame.shutdown();
                        closeSignal.countDown();
                    }
                });
                frame.setVisible(true);
            } catch (RuntimeException runtimeException) {
                startupFailure.value = runtimeException;
                closeSignal.countDown();
            }
        });

        if (startupFailure.value != null) {
            throw startupFailure.value;
        }
        closeSignal.await();
    }

    private static final class MainFrame extends JFrame {
        private static final DateTimeFormatter LOG_TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");
        /** 滚动停止后再提交可见行 */
        private static final int VISIBLE_ROWS_DEBOUNCE_MS = 150;

        private final BrowserConfig config;
        private final SidecarStore sidecarStore;
        private final EnrichmentPipeline pipeline;
        private final RecordCollection collection = new RecordCollection("files");

        private final JTextField directoryField = new JTextField(".", 40);
        private final JCheckBox collapseBox = new JCheckBox("折叠帧序列", true);
        private final JButton browseButton = new JButton("浏览");
        private final RecordTableModel tableModel = new RecordTableModel();
        private final JTable table = new JTable(tableModel);
        private final JLabel statusLabel = new JLabel(" ");
        private final JTextArea logArea = new JTextArea(6, 80);
        private final Timer visibleRowsTimer = new Timer(VISIBLE_ROWS_DEBOUNCE_MS, event -> prioritizeVisibleRows());
        private long sortedGeneration = -1;

        private MainFrame(BrowserConfig config) {
            this.config = config;
            this.sidecarStore = new SqliteSidecarStore(config.getSidecarDbPath());
            this.pipeline = new EnrichmentPipeline(config, sidecarStore, new ImageIoThumbnailGenerator());

            setTitle("本地文件浏览器");
            setDefaultCloseOperation(WindowConstants.DISPOSE_ON_CLOSE);
            setSize(1080, 760);
            setLocationRelativeTo(null);

            JPanel rootPanel = new JPanel(new BorderLayout(8, 8));
            rootPanel.setBorder(BorderFactory.createEmptyBorder(10, 10, 10, 10));
            rootPanel.add(createDirectoryPanel(), BorderLayout.NORTH);
            JSplitPane splitPane = new JSplitPane(JSplitPane.VERTICAL_SPLIT, createTablePanel(), createLogPanel());
            splitPane.setResizeWeight(0.85);
            rootPanel.add(splitPane, BorderLayout.CENTER);
            rootPanel.add(statusLabel, BorderLayout.SOUTH);
            setContentPane(rootPanel);

            wirePipeline();
            pipeline.start();
        }

        private JPanel createDirectoryPanel() {
            JPanel panel = new JPanel(new FlowLayout(FlowLayout.LEFT));
            panel.setBorder(BorderFactory.createTitledBorder("目录"));
            panel.add(new JLabel("路径:"));
            panel.add(directoryField);
            panel.add(collapseBox);
            browseButton.addActionListener(event -> runBrowseTask());
            panel.add(browseButton);
            return panel;
        }

        private JScrollPane createTablePanel() {
            table.setRowHeight(config.getRowHeight());
            table.setSelectionMode(ListSelectionModel.SINGLE_SELECTION);
            table.getColumnModel().getColumn(RecordTableModel.THUMBNAIL_COLUMN).setPreferredWidth(config.getRowHeight() * 2);
            table.getColumnModel().getColumn(RecordTableModel.THUMBNAIL_COLUMN).setMaxWidth(config.getRowHeight() * 3);
            table.getSelectionModel().addListSelectionListener(event -> {
                if (!event.getValueIsAdjusting()) {
                    prioritizeSelection();
                }
            });

            JScrollPane scrollPane = new JScrollPane(table);
            visibleRowsTimer.setRepeats(false);
            scrollPane.getViewport().addChangeListener(event -> visibleRowsTimer.restart());
            return scrollPane;
        }

        private JScrollPane createLogPanel() {
            logArea.setEditable(false);
            logArea.setLineWrap(true);
            logArea.setWrapStyleWord(true);
            JScrollPane logScrollPane = new JScrollPane(logArea);
            logScrollPane.setBorder(BorderFactory.createTitledBorder("运行日志"));
            return logScrollPane;
        }

        private void wirePipeline() {
            pipeline.addItemReadyListener(ref -> SwingUtilities.invokeLater(() -> tableModel.refresh(ref)));
            pipeline.addDatasetEnrichedListener(enriched -> SwingUtilities.invokeLater(() -> {
                if (enriched == collection) {
                    tableModel.fireTableDataChanged();
                }
            }));
            pipeline.progressMonitor().addListener(status -> SwingUtilities.invokeLater(() -> {
                statusLabel.setText(status.isEmpty() ? " " : status);
                if (collection.isFullyLoaded() && collection.generation() != sortedGeneration) {
                    sortedGeneration = collection.generation();
                    tableModel.setRefs(collection.refs());
                }
            }));
        }

        private void runBrowseTask() {
            Path directory;
            try {
                directory = parseDirectory(directoryField.getText());
            } catch (IllegalArgumentException illegalArgumentException) {
                showError(illegalArgumentException.getMessage());
                return;
            }

            boolean collapse = collapseBox.isSelected();
            DirectoryScanner scanner = new DirectoryScanner(config.getRowHeight(), new Placeholders());
            executeAsync("扫描目录", () -> scanner.scan(directory, collapse), records -> {
                showRecords(records);
                appendLog("扫描完成: " + directory + "，记录=" + records.size());
            });
        }

        private void showRecords(List<Record> records) {
            collection.reset(records);
            tableModel.setRefs(collection.refs());
            pipeline.load(collection);
        }

        private void prioritizeSelection() {
            int row = table.getSelectedRow();
            if (row >= 0) {
                pipeline.submitVisible(tableModel.refAt(table.convertRowIndexToModel(row)));
            }
        }

        private void prioritizeVisibleRows() {
            int[] rows = visibleRows(table, table.getVisibleRect());
            if (rows == null) {
                return;
            }
            for (int row = rows[1]; row >= rows[0]; row--) {
                pipeline.submitVisible(tableModel.refAt(table.convertRowIndexToModel(row)));
            }
        }

        private <T> void executeAsync(String taskName, Callable<T> action, Consumer<T> onSuccess) {
            browseButton.setEnabled(false);
            appendLog("开始: " + taskName);
            SwingWorker<T, Void> worker = new SwingWorker<>() {
                @Override
                protected T doInBackground() throws Exception {
                    return action.call();
                }

                @Override
                protected void done() {
                    browseButton.setEnabled(true);
                    try {
                        T result = get();
                        onSuccess.accept(result);
                    } catch (Exception exception) {
                        appendLog("失败: " + taskName + " - " + exception.getMessage());
                        showError(taskName + "失败: " + exception.getMessage());
                    }
                }
            };
            worker.execute();
        }

        private void shutdown() {
            visibleRowsTimer.stop();
            collection.discard();
            pipeline.close();
            sidecarStore.close();
        }

        private void appendLog(String message) {
            String timestamp = LocalDateTime.now().format(LOG_TIME_FORMAT);
            logArea.append("[" + timestamp + "] " + message + "\n");
            logArea.setCaretPosition(logArea.getDocument().getLength());
        }

        private void showError(String message) {
            JOptionPane.showMessageDialog(this, message, "错误", JOptionPane.ERROR_MESSAGE);
        }
    }

    private static final class Holder<T> {
        private T value;
    }
}
