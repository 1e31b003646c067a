package com.legacylens.core.metrics;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import com.legacylens.core.heuristics.HeuristicTables;
import com.legacylens.core.heuristics.SecurityRule;
import com.legacylens.core.model.NormalizedLine;
import com.legacylens.core.model.Rating;
import com.legacylens.core.model.SecurityAssessment;
import com.legacylens.core.model.SecurityIssue;
import com.legacylens.core.model.StructuralModel;

/**
 * Scans code lines against the {@link SecurityRule} table.
 *
 * <p>Every matching (line, rule) pair yields one issue; the same rule on five lines yields five
 * issues. The risk level starts at Low and only ever rises with the severity of the issues seen.
 */
public class SecurityAnalyzer implements MetricFacet<SecurityAssessment> {

    static final String NO_ISSUES_RECOMMENDATION = "Continue following secure coding practices";

    @Override
    public String name() {
        return "security";
    }

    @Override
    public SecurityAssessment analyze(StructuralModel model, List<NormalizedLine> lines) {
        List<SecurityIssue> issues = new ArrayList<>();
        for (NormalizedLine line : lines) {
            if (!line.isCode()) {
                continue;
            }
            for (SecurityRule rule : SecurityRule.values()) {
                if (rule.matches(line.text())) {
                    issues.add(new SecurityIssue(rule.name(), rule.severity(), rule.description(),
                        line.lineNumber(), line.text().strip()));
                }
            }
        }

        int score = Math.max(0, 100 - issues.size() * HeuristicTables.SECURITY_PENALTY_PER_ISSUE);
        return new SecurityAssessment(riskLevel(issues), issues, score, recommendations(issues));
    }

    @Override
    public SecurityAssessment fallback() {
        return SecurityAssessment.defaults();
    }

    /**
     * Folds issue severities in scan order into a risk level.
     *
     * @param issues issues in scan order
     * @return highest severity seen, Low when there are none
     */
    public static Rating riskLevel(List<SecurityIssue> issues) {
        Rating risk = Rating.LOW;
        for (SecurityIssue issue : issues) {
            risk = risk.atLeast(issue.severity());
        }
        return risk;
    }

    static List<String> recommendations(List<SecurityIssue> issues) {
        if (issues.isEmpty()) {
            return List.of(NO_ISSUES_RECOMMENDATION);
        }
        Set<SecurityRule> found = EnumSet.noneOf(SecurityRule.class);
        for (SecurityIssue issue : issues) {
            found.add(SecurityRule.valueOf(issue.kind()));
        }
        return found.stream().map(SecurityRule::recommendation).toList();
    }
}
