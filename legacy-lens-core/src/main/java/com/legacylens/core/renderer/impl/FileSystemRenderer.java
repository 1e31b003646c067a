package com.legacylens.core.renderer.impl;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.legacylens.core.renderer.GeneratedFile;
import com.legacylens.core.renderer.GeneratedOutput;
import com.legacylens.core.renderer.OutputRenderer;
import com.legacylens.core.renderer.RenderContext;

/**
 * Renderer that writes generated files below the output directory.
 *
 * <p>Creates missing directories, overwrites changed files and leaves files with identical
 * content untouched. A relative path that would escape the output directory is rejected.
 *
 * <p><b>Settings:</b>
 * <ul>
 *   <li>{@code filesystem.encoding} - charset of written files (default: UTF-8)</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * GeneratedOutput output = new GeneratedOutput(List.of(
 *     new GeneratedFile("PAYROLL/report.md", "# Analysis Report...", "text/markdown")
 * ));
 *
 * new FileSystemRenderer().render(output, RenderContext.of(Path.of("./legacylens-output")));
 * // Creates: ./legacylens-output/PAYROLL/report.md
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    public static final String ENCODING_SETTING = "filesystem.encoding";

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        Path outputDir = context.outputDirectory().toAbsolutePath().normalize();
        Charset charset = Charset.forName(
            context.getSettingOrDefault(ENCODING_SETTING, StandardCharsets.UTF_8.name()));
        logger.info("Rendering {} files to filesystem at: {}", output.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        int written = 0;
        for (GeneratedFile file : output.files()) {
            if (writeFile(outputDir, file, charset)) {
                written++;
            }
        }
        logger.info("Wrote {} files, {} unchanged", written, output.files().size() - written);
    }

    /**
     * Writes a single file.
     *
     * @return false when the file already had this content
     */
    private boolean writeFile(Path outputDir, GeneratedFile file, Charset charset) {
        Path targetPath = outputDir.resolve(file.relativePath()).normalize();
        if (!targetPath.startsWith(outputDir)) {
            throw new IllegalArgumentException("File path escapes output directory: " + file.relativePath());
        }

        try {
            if (Files.isRegularFile(targetPath) && Files.readString(targetPath, charset).equals(file.content())) {
                logger.debug("Unchanged: {}", file.relativePath());
                return false;
            }

            Path parentDir = targetPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(targetPath, file.content(), charset);
            logger.debug("Wrote file: {} ({} bytes)", file.relativePath(), file.sizeInBytes());
            return true;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + file.relativePath(), e);
        }
    }
}
