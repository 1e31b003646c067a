package com.legacylens.cli;

import com.legacylens.core.generator.DiagramGenerator;
import com.legacylens.core.model.ReportSection;
import com.legacylens.core.renderer.OutputRenderer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to list available generators, renderers or report sections.
 *
 * <p>Generators and renderers are discovered via the Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * legacylens list generators
 * legacylens list renderers
 * legacylens list sections
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available generators, renderers or report sections",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: generators, renderers or sections"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "generators", "generator" -> listGenerators();
            case "renderers", "renderer" -> listRenderers();
            case "sections", "section" -> listSections();
            default -> {
                log.error("Unknown type: {}. Use: generators, renderers or sections", type);
                System.err.println("✗ Unknown type: " + type);
                yield 1;
            }
        };
    }

    private int listGenerators() {
        System.out.println("Available Generators:");
        System.out.println();

        boolean found = false;
        for (DiagramGenerator generator : ServiceLoader.load(DiagramGenerator.class)) {
            found = true;
            System.out.printf("  • %s (ID: %s)%n", generator.getDisplayName(), generator.getId());
            System.out.printf("    File Extension: .%s%n", generator.getFileExtension());
            System.out.printf("    Diagram Kinds: %s%n", generator.getSupportedDiagramKinds());
            System.out.println();
        }

        if (!found) {
            System.out.println("  No generators found.");
        }
        return 0;
    }

    private int listRenderers() {
        System.out.println("Available Renderers:");
        System.out.println();

        boolean found = false;
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            found = true;
            System.out.printf("  • %s%n", renderer.getId());
        }

        if (!found) {
            System.out.println("  No renderers found.");
        }
        return 0;
    }

    private int listSections() {
        System.out.println("Report Sections:");
        System.out.println();
        for (ReportSection section : ReportSection.values()) {
            System.out.printf("  • %s (%s)%n", section.title(), section.name().toLowerCase(Locale.ROOT));
        }
        return 0;
    }
}
