package com.legacylens.core.renderer;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A generated file waiting to be rendered.
 *
 * @param relativePath path relative to the output root, using {@code /} separators
 * @param content file content
 * @param contentType MIME type of the content
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
        if (relativePath.isBlank()) {
            throw new IllegalArgumentException("relativePath must not be blank");
        }
        if (contentType == null) {
            contentType = "text/plain";
        }
    }

    public int sizeInBytes() {
        return content.getBytes(StandardCharsets.UTF_8).length;
    }
}
