package de.mirkosertic.nlpquery.refinement;

import java.util.List;

/**
 * Heuristic quality assessment of a query and its results. Every figure is in [0,1].
 *
 * @param confidence mean of specificity, clarity, completeness and relevance
 */
public record RefinementAnalysis(
        QueryQuality queryQuality,
        ResultQuality resultQuality,
        List<String> improvementOpportunities,
        double confidence
) {

    public RefinementAnalysis {
        improvementOpportunities = List.copyOf(improvementOpportunities);
    }

    public record QueryQuality(double specificity, double clarity, double completeness) {
    }

    public record ResultQuality(double relevance, double coverage, double diversity) {
    }
}
