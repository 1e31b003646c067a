package com.legacylens.core.metrics;

import java.util.List;

import com.legacylens.core.model.NormalizedLine;
import com.legacylens.core.model.StructuralModel;

/**
 * One independent facet of the metrics bundle.
 *
 * <p>Implementations are pure functions of their inputs: no shared mutable state, no I/O, and
 * the same input always yields the same value. They only read code lines; blank and comment
 * lines are ignored unless a facet says otherwise.
 *
 * @param <T> facet value type
 */
public interface MetricFacet<T> {

    /**
     * Returns the facet name used in logs.
     *
     * @return facet name
     */
    String name();

    /**
     * Computes the facet.
     *
     * @param model structural model of the source
     * @param lines normalized lines of the source
     * @return facet value
     */
    T analyze(StructuralModel model, List<NormalizedLine> lines);

    /**
     * Returns the value substituted when {@link #analyze} fails.
     *
     * @return safe default
     */
    T fallback();

    /**
     * Collects the text of the code lines.
     *
     * @param lines normalized lines
     * @return code line texts in order
     */
    static List<String> codeText(List<NormalizedLine> lines) {
        return lines.stream()
            .filter(NormalizedLine::isCode)
            .map(NormalizedLine::text)
            .toList();
    }
}
