package com.legacylens.core.generator.impl;

import com.legacylens.core.generator.DiagramGenerator;
import com.legacylens.core.generator.GeneratedDiagram;
import com.legacylens.core.model.Diagram;
import com.legacylens.core.model.DiagramEdge;
import com.legacylens.core.model.DiagramKind;
import com.legacylens.core.model.DiagramNode;
import com.legacylens.core.model.NodeRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link MermaidGenerator}.
 */
class MermaidGeneratorTest {

    private MermaidGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new MermaidGenerator();
    }

    @Test
    void getId_returnsCorrectId() {
        assertThat(generator.getId()).isEqualTo("mermaid");
    }

    @Test
    void getDisplayName_returnsCorrectName() {
        assertThat(generator.getDisplayName()).isEqualTo("Mermaid Diagram Generator");
    }

    @Test
    void getFileExtension_returnsMd() {
        assertThat(generator.getFileExtension()).isEqualTo("md");
    }

    @Test
    void getSupportedDiagramKinds_returnsAllKinds() {
        assertThat(generator.getSupportedDiagramKinds()).containsExactlyInAnyOrder(DiagramKind.values());
    }

    @Test
    void generate_flowDiagram_rendersTopDownChain() {
        // Given
        Diagram flow = new Diagram(DiagramKind.FLOW,
            List.of(
                new DiagramNode("start", "Program Start", NodeRole.TERMINAL),
                new DiagramNode("p0", "MAIN-PARA", NodeRole.PROCEDURE),
                new DiagramNode("end", "Program End", NodeRole.TERMINAL)),
            List.of(DiagramEdge.solid("start", "p0"), DiagramEdge.solid("p0", "end")));

        // When
        GeneratedDiagram result = generator.generate(flow, "PAYROLL");

        // Then
        assertThat(result.name()).isEqualTo("flow");
        assertThat(result.fileName()).isEqualTo("flow.md");
        assertThat(result.content()).isEqualTo("""
            # Program Flow: PAYROLL

            ```mermaid
            graph TD
                start(["Program Start"])
                p0["MAIN-PARA"]
                end_node(["Program End"])
                start --> p0
                p0 --> end_node
            ```
            """);
    }

    @Test
    void generate_dependencyDiagram_usesShapesPerRole() {
        // Given
        Diagram dependency = new Diagram(DiagramKind.DEPENDENCY,
            List.of(
                new DiagramNode("program", "PAYROLL", NodeRole.HUB),
                new DiagramNode("dep0", "SUBPGM", NodeRole.DEPENDENCY),
                new DiagramNode("copy0", "EMPCOPY", NodeRole.COPYBOOK)),
            List.of(DiagramEdge.solid("program", "dep0"), DiagramEdge.dotted("program", "copy0")));

        // When
        String content = generator.generate(dependency, "PAYROLL").content();

        // Then
        assertThat(content)
            .contains("graph LR")
            .contains("program{{\"PAYROLL\"}}")
            .contains("dep0[[\"SUBPGM\"]]")
            .contains("copy0[/\"EMPCOPY\"/]")
            .contains("program --> dep0")
            .contains("program -.-> copy0");
    }

    @Test
    void generate_labelWithQuotes_escapesThem() {
        Diagram data = new Diagram(DiagramKind.DATA,
            List.of(new DiagramNode("ws", "Working \"Storage\"", NodeRole.HUB)),
            List.of());

        String content = generator.generate(data, "X").content();

        assertThat(content).contains("ws{{\"Working 'Storage'\"}}");
    }

    @Test
    void nodeId_sanitizesAndAvoidsReservedWords() {
        assertThat(MermaidGenerator.nodeId("a-b.c")).isEqualTo("a_b_c");
        assertThat(MermaidGenerator.nodeId("end")).isEqualTo("end_node");
        assertThat(MermaidGenerator.nodeId("Graph")).isEqualTo("Graph_node");
        assertThat(MermaidGenerator.nodeId("p0")).isEqualTo("p0");
    }

    @Test
    void serviceLoader_discoversMermaidGenerator() {
        List<DiagramGenerator> generators = new ArrayList<>();
        ServiceLoader.load(DiagramGenerator.class).forEach(generators::add);

        assertThat(generators).extracting(DiagramGenerator::getId).contains("mermaid");
    }
}
