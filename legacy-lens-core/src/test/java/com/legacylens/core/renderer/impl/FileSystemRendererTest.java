package com.legacylens.core.renderer.impl;

import com.legacylens.core.renderer.GeneratedFile;
import com.legacylens.core.renderer.GeneratedOutput;
import com.legacylens.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest {

    private FileSystemRenderer renderer;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        renderer = new FileSystemRenderer();
    }

    @Test
    void getId_returnsFilesystem() {
        assertThat(renderer.getId()).isEqualTo("filesystem");
    }

    @Test
    void render_withNestedPath_createsDirectoryStructure() throws IOException {
        // Given
        GeneratedFile file = new GeneratedFile("PAYROLL/diagrams/flow.md", "# Program Flow", "text/markdown");
        GeneratedOutput output = new GeneratedOutput(List.of(file));

        // When
        renderer.render(output, RenderContext.of(tempDir));

        // Then
        Path expectedFile = tempDir.resolve("PAYROLL/diagrams/flow.md");
        assertThat(expectedFile).exists();
        assertThat(Files.readString(expectedFile)).isEqualTo("# Program Flow");
    }

    @Test
    void render_withMissingOutputDirectory_createsIt() {
        Path outputDir = tempDir.resolve("out/legacy");
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("a.json", "{}", "application/json")));

        renderer.render(output, RenderContext.of(outputDir));

        assertThat(outputDir.resolve("a.json")).hasContent("{}");
    }

    @Test
    void render_existingFileWithNewContent_overwritesIt() throws IOException {
        Files.writeString(tempDir.resolve("report.md"), "old");
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("report.md", "new", "text/markdown")));

        renderer.render(output, RenderContext.of(tempDir));

        assertThat(tempDir.resolve("report.md")).hasContent("new");
    }

    @Test
    void render_unchangedContent_leavesFileUntouched() throws IOException {
        // Given
        Path target = tempDir.resolve("report.md");
        Files.writeString(target, "same");
        FileTime past = FileTime.fromMillis(1_000_000L);
        Files.setLastModifiedTime(target, past);
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("report.md", "same", "text/markdown")));

        // When
        renderer.render(output, RenderContext.of(tempDir));

        // Then
        assertThat(Files.getLastModifiedTime(target)).isEqualTo(past);
    }

    @Test
    void render_pathEscapingOutputDirectory_isRejected() {
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("../evil.md", "x", "text/markdown")));

        assertThatThrownBy(() -> renderer.render(output, RenderContext.of(tempDir)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("escapes output directory");
        assertThat(tempDir.resolveSibling("evil.md")).doesNotExist();
    }

    @Test
    void render_withEncodingSetting_writesInThatCharset() throws IOException {
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("latin.md", "Größe", "text/markdown")));
        RenderContext context = new RenderContext(tempDir, Map.of(FileSystemRenderer.ENCODING_SETTING, "ISO-8859-1"));

        renderer.render(output, context);

        assertThat(Files.readAllBytes(tempDir.resolve("latin.md"))).isEqualTo("Größe".getBytes(StandardCharsets.ISO_8859_1));
    }

    @Test
    void render_emptyOutput_createsOnlyDirectory() {
        Path outputDir = tempDir.resolve("empty");

        renderer.render(GeneratedOutput.empty(), RenderContext.of(outputDir));

        assertThat(outputDir).isEmptyDirectory();
    }
}
