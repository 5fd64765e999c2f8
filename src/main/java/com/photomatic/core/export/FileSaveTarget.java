package com.photomatic.core.export;

import java.io.IOException;

/**
 * Receives an encoded export and stores it somewhere the user can find it.
 */
@FunctionalInterface
public interface FileSaveTarget {

    /**
     * @return a description of where the bytes ended up, typically an absolute path
     */
    String save(String suggestedName, byte[] data) throws IOException;
}
