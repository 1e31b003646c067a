package com.legacylens.core.generator;

import java.util.Set;

import com.legacylens.core.model.Diagram;
import com.legacylens.core.model.DiagramKind;

/**
 * Interface for generators that render {@link Diagram} values into a concrete markup.
 *
 * <p>The analysis engine only produces graph values; turning them into Mermaid, PlantUML or
 * any other syntax is the job of a generator. Generators are discovered via Java Service
 * Provider Interface (SPI).
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class PlantUmlGenerator implements DiagramGenerator {
 *     @Override
 *     public String getId() {
 *         return "plantuml";
 *     }
 *
 *     @Override
 *     public GeneratedDiagram generate(Diagram diagram, String programId) {
 *         String content = "@startuml\n" + renderNodes(diagram) + "@enduml\n";
 *         return new GeneratedDiagram(diagram.kind().id(), content, getFileExtension());
 *     }
 *     ...
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.legacylens.core.generator.DiagramGenerator}
 *
 * @see Diagram
 * @see GeneratedDiagram
 */
public interface DiagramGenerator {

    /**
     * Returns unique identifier for this generator.
     *
     * <p>Used in configuration ({@code output.formats}). Should be lowercase.
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this generator.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for generated diagrams, without leading dot.
     *
     * @return file extension
     */
    String getFileExtension();

    /**
     * Returns the diagram kinds this generator can render.
     *
     * @return supported diagram kinds
     */
    Set<DiagramKind> getSupportedDiagramKinds();

    /**
     * Renders a diagram.
     *
     * @param diagram diagram value
     * @param programId program the diagram belongs to, used in titles
     * @return generated diagram content
     * @throws IllegalArgumentException if the diagram kind is not supported
     */
    GeneratedDiagram generate(Diagram diagram, String programId);
}
