package com.legacylens.core.source;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import com.legacylens.core.model.SourceUnit;

/**
 * Reads a source file into a {@link SourceUnit}.
 *
 * <p>Bytes that are not valid in the configured charset are replaced rather than rejected, so
 * any readable file yields a unit.
 */
public class SourceReader {

    private final Charset charset;

    public SourceReader(Charset charset) {
        this.charset = Objects.requireNonNull(charset, "charset must not be null");
    }

    /**
     * Reads and decodes a file.
     *
     * @param file source file
     * @return source unit named after the file path
     * @throws IOException if the file cannot be read
     */
    public SourceUnit read(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        return new SourceUnit(new String(bytes, charset), file.toString());
    }
}
