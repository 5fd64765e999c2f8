package com.photomatic.core.ingest;

import java.awt.image.BufferedImage;

/**
 * Turns encoded image bytes into pixels.
 */
@FunctionalInterface
public interface RasterDecoder {

    /**
     * @param sourceName used in error messages only
     * @throws PhotoDecodeException when the bytes are not a decodable image
     */
    BufferedImage decode(String sourceName, byte[] imageBytes) throws PhotoDecodeException;
}
