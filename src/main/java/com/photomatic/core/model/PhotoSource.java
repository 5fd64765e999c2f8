package com.photomatic.core.model;

import java.io.IOException;

/**
 * Read-only handle to an input photo. Ingestion reads it once; nothing ever writes through it.
 */
public interface PhotoSource {

    /**
     * File name shown in the filmstrip and used to derive export names.
     */
    String name();

    byte[] readAllBytes() throws IOException;

    static PhotoSource ofBytes(String name, byte[] bytes) {
        byte[] copy = bytes == null ? new byte[0] : bytes.clone();
        return new PhotoSource() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public byte[] readAllBytes() {
                return copy.clone();
            }

            @Override
            public String toString() {
                return "PhotoSource[" + name + "]";
            }
        };
    }
}
