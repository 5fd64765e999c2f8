package com.photomatic.core.metadata;

import com.drew.lang.Rational;
import com.photomatic.testing.TestPhotos;
import org.junit.jupiter.api.Test;

import java.awt.Color;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExifMetadataDecoderTest {

    private final ExifMetadataDecoder decoder = new ExifMetadataDecoder();

    @Test
    void garbageBytesYieldNoTags() {
        assertTrue(decoder.decode("not an image at all".getBytes()).isEmpty());
    }

    @Test
    void missingInputYieldsNoTags() {
        assertTrue(decoder.decode(null).isEmpty());
        assertTrue(decoder.decode(new byte[0]).isEmpty());
    }

    @Test
    void jpegWithoutExifYieldsNoTags() {
        byte[] jpeg = TestPhotos.jpeg(40, 30, Color.BLUE);

        assertTrue(decoder.decode(jpeg).isEmpty(), "ImageIO writes JFIF only, no exposure tags expected");
    }

    @Test
    void describesExposureLikeACamera() {
        assertEquals("1/125", ExifMetadataDecoder.describeExposure(new Rational(1, 125)));
        assertEquals("1/250", ExifMetadataDecoder.describeExposure(new Rational(10, 2500)));
        assertEquals("2", ExifMetadataDecoder.describeExposure(new Rational(2, 1)));
        assertEquals("2.5", ExifMetadataDecoder.describeExposure(new Rational(5, 2)));
        assertNull(ExifMetadataDecoder.describeExposure(new Rational(0, 1)));
        assertNull(ExifMetadataDecoder.describeExposure(null));
    }
}
