package com.foodgram.backend.service.image;

public interface ImageStorage {

    /**
     * Stores the bytes under {@code directory} and returns the generated key.
     */
    String store(byte[] content, String directory, String extension);

    void delete(String key);

    String getUrl(String key);
}
