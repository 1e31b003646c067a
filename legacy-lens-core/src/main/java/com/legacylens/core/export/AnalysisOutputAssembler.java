package com.legacylens.core.export;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.legacylens.core.generator.DiagramGenerator;
import com.legacylens.core.generator.GeneratedDiagram;
import com.legacylens.core.model.AnalysisResult;
import com.legacylens.core.model.Diagram;
import com.legacylens.core.renderer.GeneratedFile;
import com.legacylens.core.renderer.GeneratedOutput;
import com.legacylens.core.report.MarkdownReportFormatter;

/**
 * Turns analysis results into in-memory files ready for an output renderer.
 *
 * <p>Per result, under a directory named after the source:
 * <ul>
 *   <li>{@code analysis.json} when the {@code json} format is selected</li>
 *   <li>{@code report.md} when the {@code markdown} format is selected; diagrams are embedded
 *       using the first selected generator</li>
 *   <li>{@code diagrams/<kind>.<ext>} for every selected diagram generator</li>
 * </ul>
 * Unknown format names are ignored with a warning.
 */
public class AnalysisOutputAssembler {

    private static final Logger log = LoggerFactory.getLogger(AnalysisOutputAssembler.class);

    public static final String FORMAT_JSON = "json";
    public static final String FORMAT_MARKDOWN = "markdown";

    private static final String CONTENT_TYPE_JSON = "application/json";
    private static final String CONTENT_TYPE_MARKDOWN = "text/markdown";

    private final List<DiagramGenerator> generators;
    private final JsonExporter jsonExporter;
    private final MarkdownReportFormatter markdownFormatter;

    /**
     * Creates an assembler over the available diagram generators.
     *
     * @param generators diagram generators, typically discovered via SPI
     */
    public AnalysisOutputAssembler(Collection<DiagramGenerator> generators) {
        Objects.requireNonNull(generators, "generators must not be null");
        this.generators = List.copyOf(generators);
        this.jsonExporter = new JsonExporter();
        this.markdownFormatter = new MarkdownReportFormatter();
    }

    /**
     * Builds the files of one result.
     *
     * @param result analysis result
     * @param directory relative directory for this result's files
     * @param formats selected format names ({@code json}, {@code markdown}, generator ids)
     * @return generated output
     */
    public GeneratedOutput assemble(AnalysisResult result, String directory, Collection<String> formats) {
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(directory, "directory must not be null");
        Objects.requireNonNull(formats, "formats must not be null");

        Set<String> selected = formats.stream()
            .map(format -> format.toLowerCase(Locale.ROOT))
            .collect(Collectors.toCollection(LinkedHashSet::new));
        warnUnknownFormats(selected);

        List<DiagramGenerator> selectedGenerators = generators.stream()
            .filter(generator -> selected.contains(generator.getId()))
            .toList();

        List<GeneratedFile> files = new ArrayList<>();
        if (selected.contains(FORMAT_JSON)) {
            files.add(new GeneratedFile(directory + "/analysis.json", jsonExporter.toJson(result), CONTENT_TYPE_JSON));
        }
        if (selected.contains(FORMAT_MARKDOWN)) {
            List<GeneratedDiagram> embedded = selectedGenerators.isEmpty()
                ? List.of()
                : render(result, selectedGenerators.get(0));
            files.add(new GeneratedFile(directory + "/report.md",
                markdownFormatter.format(result, embedded), CONTENT_TYPE_MARKDOWN));
        }
        for (DiagramGenerator generator : selectedGenerators) {
            for (GeneratedDiagram diagram : render(result, generator)) {
                files.add(new GeneratedFile(directory + "/diagrams/" + diagram.fileName(),
                    diagram.content(), CONTENT_TYPE_MARKDOWN));
            }
        }

        log.debug("Assembled {} files for {}", files.size(), result.sourceName());
        return new GeneratedOutput(files);
    }

    /**
     * Derives a directory name from a source name: the file name without extension, restricted
     * to {@code [A-Za-z0-9_.-]}.
     *
     * @param sourceName display name or path of the source
     * @return directory name, never empty
     */
    public static String directoryName(String sourceName) {
        String name = sourceName.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        name = name.replaceAll("[^A-Za-z0-9_.-]", "_");
        return name.isEmpty() ? "program" : name;
    }

    private List<GeneratedDiagram> render(AnalysisResult result, DiagramGenerator generator) {
        List<GeneratedDiagram> rendered = new ArrayList<>();
        for (Diagram diagram : result.diagrams()) {
            if (generator.getSupportedDiagramKinds().contains(diagram.kind())) {
                rendered.add(generator.generate(diagram, result.programId()));
            }
        }
        return rendered;
    }

    private void warnUnknownFormats(Set<String> selected) {
        for (String format : selected) {
            boolean known = FORMAT_JSON.equals(format) || FORMAT_MARKDOWN.equals(format)
                || generators.stream().anyMatch(generator -> generator.getId().equals(format));
            if (!known) {
                log.warn("Unknown output format '{}' ignored", format);
            }
        }
    }
}
