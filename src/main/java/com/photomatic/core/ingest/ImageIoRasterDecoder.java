package com.photomatic.core.ingest;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * {@link RasterDecoder} using the JDK's ImageIO readers (JPEG, PNG, GIF, BMP).
 */
public final class ImageIoRasterDecoder implements RasterDecoder {

    @Override
    public BufferedImage decode(String sourceName, byte[] imageBytes) throws PhotoDecodeException {
        if (imageBytes == null || imageBytes.length == 0) {
            throw new PhotoDecodeException(sourceName, "Unable to load image " + sourceName + ": file is empty");
        }
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(imageBytes));
            if (image == null) {
                throw new PhotoDecodeException(sourceName, "Unable to load image " + sourceName + ": unsupported format");
            }
            return image;
        } catch (IOException | RuntimeException e) {
            throw new PhotoDecodeException(sourceName, "Unable to load image " + sourceName + ": " + e.getMessage(), e);
        }
    }
}
