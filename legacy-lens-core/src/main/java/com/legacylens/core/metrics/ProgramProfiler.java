package com.legacylens.core.metrics;

import java.util.List;

import com.legacylens.core.heuristics.Keyword;
import com.legacylens.core.model.FlowComplexity;
import com.legacylens.core.model.NormalizedLine;
import com.legacylens.core.model.ProgramProfile;
import com.legacylens.core.model.Rating;
import com.legacylens.core.model.StructuralModel;

/**
 * Summarizes what kind of work a program does: main logic, error handling, file, database and
 * screen I/O, arithmetic.
 */
public class ProgramProfiler implements MetricFacet<ProgramProfile> {

    @Override
    public String name() {
        return "profile";
    }

    @Override
    public ProgramProfile analyze(StructuralModel model, List<NormalizedLine> lines) {
        String code = String.join("\n", MetricFacet.codeText(lines));

        int fileOperations = count(code, Keyword.OPEN, Keyword.READ, Keyword.WRITE, Keyword.CLOSE);
        int screenOperations = count(code, Keyword.DISPLAY, Keyword.ACCEPT);
        int databaseOperations = Keyword.EXEC_SQL.countIn(code);
        int conditionals = Keyword.IF.countIn(code);
        int dataItems = model.dataItems().size();

        return new ProgramProfile(
            model.divisions().stream().anyMatch(division -> "PROCEDURE".equals(division.name())),
            count(code, Keyword.ERROR, Keyword.EXCEPTION, Keyword.INVALID) > 0,
            fileOperations > 0,
            databaseOperations > 0,
            count(code, Keyword.COMPUTE, Keyword.ADD, Keyword.SUBTRACT, Keyword.MULTIPLY, Keyword.DIVIDE) > 0,
            conditionals > 10 ? FlowComplexity.COMPLEX : conditionals > 5 ? FlowComplexity.MODERATE : FlowComplexity.SIMPLE,
            dataItems > 50 ? Rating.HIGH : dataItems > 20 ? Rating.MEDIUM : Rating.LOW,
            fileOperations,
            screenOperations,
            databaseOperations
        );
    }

    @Override
    public ProgramProfile fallback() {
        return ProgramProfile.empty();
    }

    private static int count(String code, Keyword... keywords) {
        int total = 0;
        for (Keyword keyword : keywords) {
            total += keyword.countIn(code);
        }
        return total;
    }
}
