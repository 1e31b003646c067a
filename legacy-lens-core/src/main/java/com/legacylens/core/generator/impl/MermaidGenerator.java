package com.legacylens.core.generator.impl;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.legacylens.core.generator.DiagramGenerator;
import com.legacylens.core.generator.GeneratedDiagram;
import com.legacylens.core.model.Diagram;
import com.legacylens.core.model.DiagramEdge;
import com.legacylens.core.model.DiagramKind;
import com.legacylens.core.model.DiagramNode;
import com.legacylens.core.model.EdgeStyle;

/**
 * Generates Mermaid flowchart definitions from diagram values.
 *
 * <p>Output is Markdown with an embedded {@code ```mermaid} code block, suitable for GitHub,
 * GitLab and most documentation sites.
 *
 * <h2>Layout</h2>
 * <ul>
 *   <li><b>Flow:</b> top-down chain with stadium-shaped start and end nodes</li>
 *   <li><b>Data:</b> left-to-right star around a hexagonal working-storage hub</li>
 *   <li><b>Dependency:</b> left-to-right star around the program; call targets use solid
 *       arrows and subroutine shapes, copybooks use dotted arrows and parallelograms</li>
 * </ul>
 *
 * <p>Node ids are sanitized to {@code [A-Za-z0-9_]}, and Mermaid keywords such as {@code end}
 * are suffixed. Labels are always quoted so names with parentheses or hyphens render unchanged.
 *
 * @see <a href="https://mermaid.js.org/">Mermaid Documentation</a>
 */
public class MermaidGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(MermaidGenerator.class);

    // Generator identification
    private static final String GENERATOR_ID = "mermaid";
    private static final String GENERATOR_DISPLAY_NAME = "Mermaid Diagram Generator";
    private static final String FILE_EXTENSION = "md";

    // Markdown formatting
    private static final String MARKDOWN_HEADER_PREFIX = "# ";
    private static final String MARKDOWN_NEWLINE = "\n";
    private static final String CODE_BLOCK_START = "```mermaid\n";
    private static final String CODE_BLOCK_END = "```\n";

    // Mermaid diagram types
    private static final String GRAPH_TD = "graph TD\n";
    private static final String GRAPH_LR = "graph LR\n";
    private static final String INDENT = "    ";

    private static final String ID_SANITIZATION_PATTERN = "[^a-zA-Z0-9_]";
    private static final Set<String> RESERVED_IDS = Set.of("end", "graph", "subgraph", "style", "class", "click");

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public Set<DiagramKind> getSupportedDiagramKinds() {
        return EnumSet.allOf(DiagramKind.class);
    }

    @Override
    public GeneratedDiagram generate(Diagram diagram, String programId) {
        Objects.requireNonNull(diagram, "diagram must not be null");
        Objects.requireNonNull(programId, "programId must not be null");

        if (!getSupportedDiagramKinds().contains(diagram.kind())) {
            throw new IllegalArgumentException("Unsupported diagram kind: " + diagram.kind());
        }

        log.debug("Generating Mermaid {} diagram for {}", diagram.kind().id(), programId);

        StringBuilder sb = new StringBuilder();
        sb.append(MARKDOWN_HEADER_PREFIX).append(diagram.kind().title()).append(": ").append(programId)
            .append(MARKDOWN_NEWLINE).append(MARKDOWN_NEWLINE);
        sb.append(CODE_BLOCK_START);
        sb.append(diagram.kind() == DiagramKind.FLOW ? GRAPH_TD : GRAPH_LR);
        for (DiagramNode node : diagram.nodes()) {
            sb.append(INDENT).append(renderNode(node)).append(MARKDOWN_NEWLINE);
        }
        for (DiagramEdge edge : diagram.edges()) {
            sb.append(INDENT).append(renderEdge(edge)).append(MARKDOWN_NEWLINE);
        }
        sb.append(CODE_BLOCK_END);

        return new GeneratedDiagram(diagram.kind().id(), sb.toString(), FILE_EXTENSION);
    }

    private String renderNode(DiagramNode node) {
        String id = nodeId(node.id());
        String label = "\"" + escape(node.label()) + "\"";
        return switch (node.role()) {
            case TERMINAL -> id + "([" + label + "])";
            case HUB -> id + "{{" + label + "}}";
            case DEPENDENCY -> id + "[[" + label + "]]";
            case COPYBOOK -> id + "[/" + label + "/]";
            case PROCEDURE, DATA_ITEM -> id + "[" + label + "]";
        };
    }

    private String renderEdge(DiagramEdge edge) {
        String arrow = edge.style() == EdgeStyle.DOTTED ? " -.-> " : " --> ";
        return nodeId(edge.from()) + arrow + nodeId(edge.to());
    }

    /**
     * Sanitizes an identifier for use as a Mermaid node id.
     *
     * @param id raw identifier
     * @return sanitized identifier
     */
    static String nodeId(String id) {
        String sanitized = id.replaceAll(ID_SANITIZATION_PATTERN, "_");
        return RESERVED_IDS.contains(sanitized.toLowerCase(Locale.ROOT)) ? sanitized + "_node" : sanitized;
    }

    private static String escape(String text) {
        return text.replace("\"", "'").replace("\n", " ");
    }
}
