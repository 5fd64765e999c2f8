package com.photomatic.ui;

import com.photomatic.core.model.PhotoRecord;

import javax.swing.DefaultListCellRenderer;
import javax.swing.ImageIcon;
import javax.swing.JLabel;
import javax.swing.JList;
import javax.swing.SwingConstants;
import java.awt.Component;
import java.awt.Image;
import java.util.Map;
import java.util.WeakHashMap;

/**
 * Filmstrip cell: the record's JPEG thumbnail scaled to a fixed height, name underneath.
 */
final class ThumbnailCellRenderer extends DefaultListCellRenderer {

    static final int THUMB_HEIGHT = 96;

    private final Map<PhotoRecord, ImageIcon> icons = new WeakHashMap<>();

    @Override
    public Component getListCellRendererComponent(JList<?> list, Object value, int index,
                                                  boolean isSelected, boolean cellHasFocus) {
        JLabel label = (JLabel) super.getListCellRendererComponent(list, value, index, isSelected, cellHasFocus);
        if (value instanceof PhotoRecord record) {
            label.setText(record.getName());
            label.setIcon(icons.computeIfAbsent(record, ThumbnailCellRenderer::iconFor));
            label.setToolTipText(record.getWidth() + " x " + record.getHeight());
        }
        label.setHorizontalTextPosition(SwingConstants.CENTER);
        label.setVerticalTextPosition(SwingConstants.BOTTOM);
        label.setHorizontalAlignment(SwingConstants.CENTER);
        return label;
    }

    private static ImageIcon iconFor(PhotoRecord record) {
        ImageIcon full = new ImageIcon(record.getDisplayThumbnail());
        int height = full.getIconHeight();
        if (height <= 0) {
            return full;
        }
        int width = Math.max(1, (int) Math.round(full.getIconWidth() * (double) THUMB_HEIGHT / height));
        return new ImageIcon(full.getImage().getScaledInstance(width, THUMB_HEIGHT, Image.SCALE_SMOOTH));
    }
}
