package com.foodgram.backend.service.image;

import com.foodgram.backend.exception.CustomException;
import com.foodgram.backend.exception.ErrorCode;
import com.foodgram.backend.exception.RequestValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Base64;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Accepts images as base64 data URIs ({@code data:image/png;base64,...}) or multipart files
 * and hands the bytes to {@link ImageStorage}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImageService {

    public static final String RECIPE_DIRECTORY = "recipes/images";
    public static final String AVATAR_DIRECTORY = "avatars";

    private static final Pattern DATA_URI = Pattern.compile("^data:image/([a-zA-Z0-9.+-]+);base64,(.+)$", Pattern.DOTALL);
    private static final Set<String> ALLOWED_EXTENSIONS = Set.of("jpg", "jpeg", "png", "gif", "webp", "bmp");

    private final ImageStorage imageStorage;

    public String storeDataUri(String dataUri, String directory, String field) {
        Matcher matcher = DATA_URI.matcher(dataUri.trim());
        if (!matcher.matches()) {
            throw new RequestValidationException(ErrorCode.INVALID_IMAGE, field);
        }
        String extension = normalizeExtension(matcher.group(1), field);

        byte[] content;
        try {
            content = Base64.getMimeDecoder().decode(matcher.group(2));
        } catch (IllegalArgumentException e) {
            log.debug("Rejected malformed base64 image for '{}': {}", field, e.getMessage());
            throw new RequestValidationException(ErrorCode.INVALID_IMAGE, field);
        }
        if (content.length == 0) {
            throw new RequestValidationException(ErrorCode.INVALID_IMAGE, field);
        }
        return imageStorage.store(content, directory, extension);
    }

    public String storeMultipart(MultipartFile file, String directory, String field) {
        if (file == null || file.isEmpty()) {
            throw new RequestValidationException(ErrorCode.INVALID_IMAGE, field);
        }
        String contentType = file.getContentType();
        if (contentType == null || !contentType.startsWith("image/")) {
            throw new RequestValidationException(ErrorCode.INVALID_IMAGE, field);
        }
        String extension = StringUtils.getFilenameExtension(file.getOriginalFilename());
        if (!StringUtils.hasText(extension)) {
            extension = contentType.substring("image/".length());
        }
        extension = normalizeExtension(extension, field);

        try {
            return imageStorage.store(file.getBytes(), directory, extension);
        } catch (IOException e) {
            log.error("Failed to read uploaded image '{}'", file.getOriginalFilename(), e);
            throw new CustomException(ErrorCode.IMAGE_STORAGE_FAILED);
        }
    }

    /**
     * Deletes the file once the surrounding transaction commits, or right away outside a transaction.
     * Used for images the committed row no longer points at.
     */
    public void deleteAfterCommit(String key) {
        if (key == null) {
            return;
        }
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            imageStorage.delete(key);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                imageStorage.delete(key);
            }
        });
    }

    /**
     * Removes a freshly stored file if the surrounding transaction rolls back.
     */
    public void discardOnRollback(String key) {
        if (key == null || !TransactionSynchronizationManager.isSynchronizationActive()) {
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status == STATUS_ROLLED_BACK) {
                    log.info("Discarding image of rolled back write: {}", key);
                    imageStorage.delete(key);
                }
            }
        });
    }

    public String toUrl(String key) {
        return imageStorage.getUrl(key);
    }

    private String normalizeExtension(String raw, String field) {
        String extension = raw.toLowerCase(Locale.ROOT);
        if ("svg+xml".equals(extension) || !ALLOWED_EXTENSIONS.contains(extension)) {
            throw new RequestValidationException(ErrorCode.INVALID_IMAGE, field);
        }
        return extension;
    }
}
