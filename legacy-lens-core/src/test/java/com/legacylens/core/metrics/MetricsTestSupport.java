package com.legacylens.core.metrics;

import com.legacylens.core.extractor.LineNormalizer;
import com.legacylens.core.extractor.StructuralExtractor;
import com.legacylens.core.model.NormalizedLine;
import com.legacylens.core.model.StructuralModel;

import java.util.List;

/**
 * Runs normalization and extraction so facet tests can start from source text.
 */
final class MetricsTestSupport {

    private MetricsTestSupport() {
        // Utility class
    }

    record Prepared(StructuralModel model, List<NormalizedLine> lines) {
    }

    static Prepared prepare(String text) {
        List<NormalizedLine> lines = new LineNormalizer().normalize(text);
        return new Prepared(new StructuralExtractor().extract(lines), lines);
    }

    static <T> T analyze(MetricFacet<T> facet, String text) {
        Prepared prepared = prepare(text);
        return facet.analyze(prepared.model(), prepared.lines());
    }
}
