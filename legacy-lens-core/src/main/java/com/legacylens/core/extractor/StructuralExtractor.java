package com.legacylens.core.extractor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.MatchResult;

import com.legacylens.core.extractor.base.AbstractRegexExtractor;
import com.legacylens.core.heuristics.HeuristicTables;
import com.legacylens.core.heuristics.Keyword;
import com.legacylens.core.model.DataItem;
import com.legacylens.core.model.Division;
import com.legacylens.core.model.FileDescriptor;
import com.legacylens.core.model.LineStats;
import com.legacylens.core.model.NormalizedLine;
import com.legacylens.core.model.Procedure;
import com.legacylens.core.model.ProcedureKind;
import com.legacylens.core.model.Rating;
import com.legacylens.core.model.SourceUnit;
import com.legacylens.core.model.StructuralModel;

/**
 * Turns normalized source lines into a {@link StructuralModel}.
 *
 * <h2>What is extracted</h2>
 * <ul>
 *   <li><b>Program identity:</b> first {@code PROGRAM-ID} marker, {@code UNKNOWN} when absent</li>
 *   <li><b>Divisions:</b> every IDENTIFICATION, ENVIRONMENT, DATA and PROCEDURE header, in order</li>
 *   <li><b>Procedures:</b> paragraph label lines and {@code PERFORM} targets, not deduplicated</li>
 *   <li><b>Data items:</b> level-numbered declarations of the first WORKING-STORAGE region</li>
 *   <li><b>File descriptors:</b> {@code FD} entries of the FILE SECTION region</li>
 *   <li><b>Dependencies:</b> {@code CALL} targets anywhere in the text; variable targets are
 *       prefixed with {@code DYNAMIC:}</li>
 *   <li><b>Copy dependencies:</b> {@code COPY} targets anywhere in the text</li>
 *   <li><b>Complexity seed:</b> weighted size and keyword counts, Low/Medium/High</li>
 * </ul>
 *
 * <p>Program identity, divisions, dependencies and copy dependencies are matched over the whole
 * normalized text, comment lines included. Procedures, data items and file descriptors only look
 * at code lines.
 *
 * <h2>Failure handling</h2>
 * <p>{@link #extract(List)} never throws for any text. An internal fault is logged and turned
 * into a degraded model via {@link StructuralModel#degraded(String, LineStats)} so later stages
 * still run.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * StructuralExtractor extractor = new StructuralExtractor();
 * StructuralModel model = extractor.extract(SourceUnit.of(cobolText));
 * model.dependencies(); // e.g. [SUBPGM, DYNAMIC:WS-ROUTINE]
 * }</pre>
 */
public class StructuralExtractor extends AbstractRegexExtractor {

    private final LineNormalizer normalizer;

    public StructuralExtractor() {
        this(new LineNormalizer());
    }

    public StructuralExtractor(LineNormalizer normalizer) {
        super();
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
    }

    /**
     * Normalizes the unit's text and extracts its structural model.
     *
     * @param unit source unit
     * @return structural model, degraded if extraction failed internally
     * @throws NullPointerException if unit is null
     */
    public StructuralModel extract(SourceUnit unit) {
        Objects.requireNonNull(unit, "unit must not be null");
        return extract(normalizer.normalize(unit.text()));
    }

    /**
     * Extracts the structural model from already normalized lines.
     *
     * @param lines normalized lines
     * @return structural model, degraded if extraction failed internally
     * @throws NullPointerException if lines is null
     */
    public StructuralModel extract(List<NormalizedLine> lines) {
        Objects.requireNonNull(lines, "lines must not be null");
        LineStats lineStats = LineStats.of(lines);

        try {
            String text = LineNormalizer.toText(lines);

            String programId = extractProgramId(text);
            List<Procedure> procedures = extractProcedures(lines);
            StructuralModel model = new StructuralModel(
                programId,
                extractDivisions(lines),
                procedures,
                extractDataItems(lines),
                extractFileDescriptors(lines),
                extractDependencies(text),
                extractCopyDependencies(text),
                lineStats,
                estimateComplexity(text, lineStats, procedures.size()),
                null
            );

            log.debug("Extracted program {}: {} divisions, {} procedures, {} data items, {} dependencies",
                model.programId(), model.divisions().size(), model.procedures().size(),
                model.dataItems().size(), model.dependencies().size());
            return model;
        } catch (RuntimeException e) {
            String description = e.getClass().getSimpleName()
                + (e.getMessage() == null ? "" : ": " + e.getMessage());
            log.warn("Structural extraction degraded after {} lines: {}", lineStats.total(), description);
            return StructuralModel.degraded(description, lineStats);
        }
    }

    // ==================== Extraction Steps ====================

    protected String extractProgramId(String text) {
        Matcher matcher = findFirst(SourcePatterns.PROGRAM_ID, text);
        return matcher == null ? StructuralModel.UNKNOWN_PROGRAM : matcher.group(1);
    }

    protected List<Division> extractDivisions(List<NormalizedLine> lines) {
        List<Division> divisions = new ArrayList<>();
        for (NormalizedLine line : lines) {
            for (MatchResult match : findMatches(SourcePatterns.DIVISION, line.text())) {
                divisions.add(new Division(match.group(1).toUpperCase(Locale.ROOT), line.lineNumber()));
            }
        }
        return divisions;
    }

    protected List<Procedure> extractProcedures(List<NormalizedLine> lines) {
        List<Procedure> procedures = new ArrayList<>();
        for (NormalizedLine line : codeLines(lines)) {
            String trimmed = line.text().strip();

            Matcher paragraph = SourcePatterns.PARAGRAPH.matcher(trimmed);
            if (paragraph.matches()) {
                procedures.add(new Procedure(paragraph.group(1), ProcedureKind.PARAGRAPH, line.lineNumber()));
            }

            Matcher perform = findFirst(SourcePatterns.PERFORM_TARGET, trimmed);
            if (perform != null) {
                procedures.add(new Procedure(perform.group(1), ProcedureKind.INVOKED, line.lineNumber()));
            }
        }
        return procedures;
    }

    protected List<DataItem> extractDataItems(List<NormalizedLine> lines) {
        List<NormalizedLine> region = boundedRegion(lines,
            SourcePatterns.WORKING_STORAGE_HEADER, SourcePatterns.REGION_BOUNDARY);

        List<DataItem> items = new ArrayList<>();
        for (NormalizedLine line : region) {
            String trimmed = line.text().strip();
            Matcher matcher = SourcePatterns.DATA_ITEM.matcher(trimmed);
            if (matcher.find()) {
                Matcher picture = findFirst(SourcePatterns.PICTURE, trimmed);
                items.add(new DataItem(
                    Integer.parseInt(matcher.group(1)),
                    matcher.group(2),
                    line.lineNumber(),
                    trimmed,
                    picture == null ? null : picture.group(1)
                ));
            }
        }
        return items;
    }

    protected List<FileDescriptor> extractFileDescriptors(List<NormalizedLine> lines) {
        List<NormalizedLine> region = boundedRegion(lines,
            SourcePatterns.FILE_SECTION_HEADER, SourcePatterns.REGION_BOUNDARY);

        List<FileDescriptor> descriptors = new ArrayList<>();
        for (NormalizedLine line : region) {
            for (MatchResult match : findMatches(SourcePatterns.FILE_DESCRIPTOR, line.text())) {
                descriptors.add(new FileDescriptor(match.group(1), match.group()));
            }
        }
        return descriptors;
    }

    protected Set<String> extractDependencies(String text) {
        Set<String> dependencies = new LinkedHashSet<>();
        for (MatchResult match : findMatches(SourcePatterns.CALL_TARGET, text)) {
            String literal = extractGroup(match, 2);
            if (literal != null) {
                dependencies.add(literal);
            } else {
                dependencies.add(StructuralModel.DYNAMIC_PREFIX + extractGroup(match, 3));
            }
        }
        return dependencies;
    }

    protected Set<String> extractCopyDependencies(String text) {
        Set<String> copybooks = new LinkedHashSet<>();
        for (MatchResult match : findMatches(SourcePatterns.COPY_TARGET, text)) {
            copybooks.add(match.group(1));
        }
        return copybooks;
    }

    /**
     * Coarse complexity label computed before any metric facet runs.
     *
     * @param text normalized text
     * @param lineStats line statistics
     * @param procedureCount number of procedure entries
     * @return seed rating
     */
    protected Rating estimateComplexity(String text, LineStats lineStats, int procedureCount) {
        double score = lineStats.code() * HeuristicTables.SEED_LINE_WEIGHT
            + procedureCount * HeuristicTables.SEED_PROCEDURE_WEIGHT
            + Keyword.IF.countIn(text) * HeuristicTables.SEED_IF_WEIGHT
            + Keyword.PERFORM.countIn(text) * HeuristicTables.SEED_PERFORM_WEIGHT
            + Keyword.CALL.countIn(text) * HeuristicTables.SEED_CALL_WEIGHT;

        if (score < HeuristicTables.SEED_LOW_BELOW) {
            return Rating.LOW;
        }
        return score < HeuristicTables.SEED_MEDIUM_BELOW ? Rating.MEDIUM : Rating.HIGH;
    }
}
