package com.legacylens.core.renderer;

/**
 * Writes generated files to a destination.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI). Register
 * implementations in {@code META-INF/services/com.legacylens.core.renderer.OutputRenderer}.
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique lowercase identifier for this renderer (e.g. "filesystem", "console").
     *
     * @return renderer identifier
     */
    String getId();

    /**
     * Renders every file of the output.
     *
     * @param output files to render
     * @param context destination settings
     * @throws IllegalStateException if a file cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);
}
