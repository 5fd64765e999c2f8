package com.photomatic.ui;

import com.photomatic.core.model.PhotoRecord;
import com.photomatic.testing.TestPhotos;
import org.junit.jupiter.api.Test;

import javax.swing.JLabel;
import javax.swing.JList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class ThumbnailCellRendererTest {

    @Test
    void showsNameAndFixedHeightThumbnail() {
        PhotoRecord record = TestPhotos.record("harbour.jpg", 300, 200);
        JList<PhotoRecord> list = new JList<>(new PhotoRecord[] {record});

        JLabel cell = (JLabel) new ThumbnailCellRenderer()
            .getListCellRendererComponent(list, record, 0, false, false);

        assertEquals("harbour.jpg", cell.getText());
        assertNotNull(cell.getIcon());
        assertEquals(ThumbnailCellRenderer.THUMB_HEIGHT, cell.getIcon().getIconHeight());
        assertEquals(144, cell.getIcon().getIconWidth());
    }
}
