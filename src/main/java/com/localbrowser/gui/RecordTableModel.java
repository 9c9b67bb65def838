package com.localbrowser.gui;

import com.localbrowser.record.Record;
import com.localbrowser.record.RecordRef;

import javax.swing.Icon;
import javax.swing.ImageIcon;
import javax.swing.table.AbstractTableModel;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

/**
 * 记录列表的表格模型。只在界面线程上读写。
 */
final class RecordTableModel extends AbstractTableModel {
    static final int THUMBNAIL_COLUMN = 0;
    private static final String[] COLUMN_NAMES = {"缩略图", "名称", "详情", "描述", "待办"};

    private final List<RecordRef> refs = new ArrayList<>();

    void setRefs(List<RecordRef> newRefs) {
        refs.clear();
        refs.addAll(newRefs);
        fireTableDataChanged();
    }

    RecordRef refAt(int row) {
        return refs.get(row);
    }

    /**
     * 某条记录有更新时只重绘对应行，句柄不在表格中时忽略。
     */
    void refresh(RecordRef ref) {
        int row = refs.indexOf(ref);
        if (row >= 0) {
            fireTableRowsUpdated(row, row);
        }
    }

    @Override
    public int getRowCount() {
        return refs.size();
    }

    @Override
    public int getColumnCount() {
        return COLUMN_NAMES.length;
    }

    @Override
    public String getColumnName(int column) {
        return COLUMN_NAMES[column];
    }

    @Override
    public Class<?> getColumnClass(int column) {
        return column == THUMBNAIL_COLUMN ? Icon.class : String.class;
    }

    @Override
    public Object getValueAt(int row, int column) {
        Record record = refs.get(row).get();
        if (record == null) {
            return null;
        }
        return switch (column) {
            case THUMBNAIL_COLUMN -> iconOf(record.getThumbnail());
            case 1 -> record.getDisplayName();
            case 2 -> record.getDetails();
            case 3 -> record.getDescription();
            case 4 -> DesktopApp.formatTodoCount(record.getTodoCount());
            default -> throw new IllegalArgumentException("未知列: " + column);
        };
    }

    private static Icon iconOf(BufferedImage image) {
        return image == null ? null : new ImageIcon(image);
    }
}
