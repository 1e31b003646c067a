package com.legacylens.core.report;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import com.legacylens.core.model.DataItem;
import com.legacylens.core.model.Diagram;
import com.legacylens.core.model.DiagramEdge;
import com.legacylens.core.model.DiagramKind;
import com.legacylens.core.model.DiagramNode;
import com.legacylens.core.model.NodeRole;
import com.legacylens.core.model.StructuralModel;

/**
 * Builds the flow, data and dependency diagrams of a program.
 *
 * <p>Large collections are truncated to bounded previews:
 * <ul>
 *   <li><b>flow:</b> the first {@value #MAX_FLOW_PROCEDURES} procedures chained between a start
 *       and an end node</li>
 *   <li><b>data:</b> a working-storage hub and the first {@value #MAX_DATA_ITEMS} data items</li>
 *   <li><b>dependency:</b> a program hub, the first {@value #MAX_DEPENDENCIES} call targets
 *       (solid edges) and the first {@value #MAX_COPYBOOKS} copybooks (dotted edges)</li>
 * </ul>
 */
public class DiagramSynthesizer {

    public static final int MAX_FLOW_PROCEDURES = 10;
    public static final int MAX_DATA_ITEMS = 10;
    public static final int MAX_DEPENDENCIES = 8;
    public static final int MAX_COPYBOOKS = 5;

    static final String START_ID = "start";
    static final String END_ID = "end";
    static final String STORAGE_HUB_ID = "ws";
    static final String PROGRAM_HUB_ID = "program";

    /**
     * Builds all three diagrams in kind order.
     *
     * @param model structural model
     * @return flow, data and dependency diagrams
     */
    public List<Diagram> synthesize(StructuralModel model) {
        Objects.requireNonNull(model, "model must not be null");
        return List.of(flowDiagram(model), dataDiagram(model), dependencyDiagram(model));
    }

    public Diagram flowDiagram(StructuralModel model) {
        List<DiagramNode> nodes = new ArrayList<>();
        List<DiagramEdge> edges = new ArrayList<>();

        nodes.add(new DiagramNode(START_ID, "Program Start", NodeRole.TERMINAL));
        String previous = START_ID;
        int count = Math.min(MAX_FLOW_PROCEDURES, model.procedures().size());
        for (int i = 0; i < count; i++) {
            String id = "p" + i;
            nodes.add(new DiagramNode(id, model.procedures().get(i).name(), NodeRole.PROCEDURE));
            edges.add(DiagramEdge.solid(previous, id));
            previous = id;
        }
        nodes.add(new DiagramNode(END_ID, "Program End", NodeRole.TERMINAL));
        edges.add(DiagramEdge.solid(previous, END_ID));

        return new Diagram(DiagramKind.FLOW, nodes, edges);
    }

    public Diagram dataDiagram(StructuralModel model) {
        List<DiagramNode> nodes = new ArrayList<>();
        List<DiagramEdge> edges = new ArrayList<>();

        nodes.add(new DiagramNode(STORAGE_HUB_ID, "Working Storage", NodeRole.HUB));
        int count = Math.min(MAX_DATA_ITEMS, model.dataItems().size());
        for (int i = 0; i < count; i++) {
            String id = "d" + i;
            nodes.add(new DiagramNode(id, dataLabel(model.dataItems().get(i)), NodeRole.DATA_ITEM));
            edges.add(DiagramEdge.solid(STORAGE_HUB_ID, id));
        }

        return new Diagram(DiagramKind.DATA, nodes, edges);
    }

    public Diagram dependencyDiagram(StructuralModel model) {
        List<DiagramNode> nodes = new ArrayList<>();
        List<DiagramEdge> edges = new ArrayList<>();

        nodes.add(new DiagramNode(PROGRAM_HUB_ID, model.programId(), NodeRole.HUB));

        int index = 0;
        for (String dependency : model.dependencies()) {
            if (index == MAX_DEPENDENCIES) {
                break;
            }
            String id = "dep" + index++;
            nodes.add(new DiagramNode(id, dependency, NodeRole.DEPENDENCY));
            edges.add(DiagramEdge.solid(PROGRAM_HUB_ID, id));
        }

        index = 0;
        for (String copybook : model.copyDependencies()) {
            if (index == MAX_COPYBOOKS) {
                break;
            }
            String id = "copy" + index++;
            nodes.add(new DiagramNode(id, copybook, NodeRole.COPYBOOK));
            edges.add(DiagramEdge.dotted(PROGRAM_HUB_ID, id));
        }

        return new Diagram(DiagramKind.DEPENDENCY, nodes, edges);
    }

    private static String dataLabel(DataItem item) {
        String label = String.format(Locale.ROOT, "%02d %s", item.level(), item.name());
        return item.hasPicture() ? label + " PIC " + item.picture() : label;
    }
}
