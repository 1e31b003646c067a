package com.legacylens.core.renderer.impl;

import java.io.PrintStream;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.legacylens.core.renderer.GeneratedFile;
import com.legacylens.core.renderer.GeneratedOutput;
import com.legacylens.core.renderer.OutputRenderer;
import com.legacylens.core.renderer.RenderContext;

/**
 * Renderer that prints generated files to a stream, standard output by default.
 *
 * <p><b>Settings:</b>
 * <ul>
 *   <li>{@code console.showHeaders} - print a header line before each file (default: "true")</li>
 *   <li>{@code console.separator} - line printed between files (default: "---")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    private static final String DEFAULT_SEPARATOR = "---";

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean showHeaders = Boolean.parseBoolean(context.getSettingOrDefault("console.showHeaders", "true"));
        String separator = context.getSettingOrDefault("console.separator", DEFAULT_SEPARATOR);
        logger.debug("Rendering {} files to console", output.files().size());
        if (output.isEmpty()) {
            out.println("(no files generated)");
            out.flush();
            return;
        }

        for (int i = 0; i < output.files().size(); i++) {
            GeneratedFile file = output.files().get(i);
            if (i > 0) {
                out.println(separator);
            }
            if (showHeaders) {
                out.println("==> " + file.relativePath() + " (" + file.contentType() + ")");
            }
            out.println(file.content().stripTrailing());
        }
        out.flush();
    }
}
