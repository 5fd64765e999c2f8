package com.photomatic.core.ingest;

import com.photomatic.core.metadata.ExifMetadataDecoder;
import com.photomatic.core.metadata.MetadataField;
import com.photomatic.core.metadata.MetadataTag;
import com.photomatic.core.model.PhotoRecord;
import com.photomatic.core.model.PhotoSource;
import com.photomatic.testing.TestPhotos;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PhotoIngestorTest {

    private final PhotoIngestor ingestor =
        new PhotoIngestor(new ExifMetadataDecoder(), new ImageIoRasterDecoder(), TestPhotos.SMALL_LAYOUT);

    @Test
    void fitsLandscapeIntoWorkingCanvas() throws Exception {
        PhotoRecord record = ingestor.ingest(TestPhotos.jpegSource("wide.jpg", 300, 200));

        // 400 canvas, margin 10: 380 wide, 380 / 1.5 high
        assertEquals("wide.jpg", record.getName());
        assertEquals(380, record.getWidth());
        assertEquals(253, record.getHeight());
        assertTrue(record.getMetadata().isEmpty());
    }

    @Test
    void fitsPortraitIntoWorkingCanvas() throws Exception {
        PhotoRecord record = ingestor.ingest(TestPhotos.jpegSource("tall.jpg", 200, 400));

        assertEquals(190, record.getWidth());
        assertEquals(380, record.getHeight());
    }

    @Test
    void thumbnailIsDecodableJpegOfTheFittedRaster() throws Exception {
        PhotoRecord record = ingestor.ingest(TestPhotos.jpegSource("wide.jpg", 300, 200));

        BufferedImage thumbnail = ImageIO.read(new ByteArrayInputStream(record.getDisplayThumbnail()));
        assertNotNull(thumbnail, "Thumbnail should be a readable image");
        assertEquals(record.getWidth(), thumbnail.getWidth());
        assertEquals(record.getHeight(), thumbnail.getHeight());
    }

    @Test
    void undecodableBytesFailWithSourceName() {
        PhotoDecodeException e = assertThrows(PhotoDecodeException.class,
            () -> ingestor.ingest(TestPhotos.brokenSource("broken.jpg")));

        assertEquals("broken.jpg", e.getSourceName());
        assertTrue(e.getMessage().contains("broken.jpg"), e.getMessage());
    }

    @Test
    void unreadableSourceFails() {
        PhotoSource unreadable = new PhotoSource() {
            @Override
            public String name() {
                return "gone.jpg";
            }

            @Override
            public byte[] readAllBytes() throws IOException {
                throw new IOException("disk vanished");
            }
        };

        PhotoDecodeException e = assertThrows(PhotoDecodeException.class, () -> ingestor.ingest(unreadable));
        assertTrue(e.getCause() instanceof IOException);
    }

    @Test
    void failingMetadataDecoderStillYieldsRecord() throws Exception {
        PhotoIngestor tolerant = new PhotoIngestor(
            bytes -> {
                throw new IllegalStateException("corrupt EXIF");
            },
            new ImageIoRasterDecoder(),
            TestPhotos.SMALL_LAYOUT);

        PhotoRecord record = tolerant.ingest(TestPhotos.jpegSource("photo.jpg", 120, 80));

        assertTrue(record.getMetadata().isEmpty());
    }

    @Test
    void decodedTagsBecomeMetadata() throws Exception {
        PhotoIngestor withTags = new PhotoIngestor(
            bytes -> Map.of("FNumber", new MetadataTag("f/1.8"), "ISOSpeedRatings", new MetadataTag("100")),
            new ImageIoRasterDecoder(),
            TestPhotos.SMALL_LAYOUT);

        PhotoRecord record = withTags.ingest(TestPhotos.jpegSource("photo.jpg", 120, 80));

        assertEquals(Optional.of("f/1.8"), record.getMetadata().get(MetadataField.F_NUMBER));
        assertEquals(Optional.of("100"), record.getMetadata().get(MetadataField.ISO));
    }
}
