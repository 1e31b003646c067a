package com.legacylens.core.generator;

import java.util.Objects;

/**
 * Represents a rendered diagram.
 *
 * @param name diagram name, used as the file name stem
 * @param content diagram content in the generator's markup
 * @param fileExtension file extension for this content
 */
public record GeneratedDiagram(
    String name,
    String content,
    String fileExtension
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedDiagram {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
    }

    /**
     * Returns the file name for this diagram.
     *
     * @return name plus extension
     */
    public String fileName() {
        return name + "." + fileExtension;
    }
}
