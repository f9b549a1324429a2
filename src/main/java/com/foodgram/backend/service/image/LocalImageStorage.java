package com.foodgram.backend.service.image;

import com.foodgram.backend.exception.CustomException;
import com.foodgram.backend.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;

@Slf4j
@Component
public class LocalImageStorage implements ImageStorage {

    private final Path root;
    private final String baseUrl;

    public LocalImageStorage(
            @Value("${app.media.root:./media}") String root,
            @Value("${app.media.base-url:http://localhost:8080/media}") String baseUrl) {
        this.root = Paths.get(root).toAbsolutePath().normalize();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public String store(byte[] content, String directory, String extension) {
        String key = directory + "/" + UUID.randomUUID() + "." + extension;
        Path target = resolve(key);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content);
        } catch (IOException e) {
            log.error("Failed to write image {}", target, e);
            throw new CustomException(ErrorCode.IMAGE_STORAGE_FAILED);
        }
        log.debug("Stored image {} ({} bytes)", key, content.length);
        return key;
    }

    @Override
    public void delete(String key) {
        if (key == null || key.isBlank()) {
            return;
        }
        Path target = resolve(key);
        try {
            if (!Files.deleteIfExists(target)) {
                log.warn("Image to delete not found: {}", target);
            }
        } catch (IOException e) {
            log.warn("Failed to delete image {}: {}", target, e.getMessage());
        }
    }

    @Override
    public String getUrl(String key) {
        return key == null ? null : baseUrl + "/" + key;
    }

    private Path resolve(String key) {
        Path target = root.resolve(key).normalize();
        if (!target.startsWith(root)) {
            throw new CustomException(ErrorCode.INVALID_IMAGE, "Invalid image key: " + key);
        }
        return target;
    }
}
