package com.survey.boothsampling.engine;

import com.survey.boothsampling.model.ClusteringOutcome;
import com.survey.boothsampling.model.CompletenessReason;
import org.springframework.stereotype.Component;

/**
 * Compares what was selected with what the request asked for
 */
@Component
public class CompletenessEvaluator {

    /**
     * @param totalBooths  valid booths in the region
     * @param selected     booths actually selected
     * @param target       two booths per requested cluster
     * @param clustering   partition the selection came from, null when clustering never ran
     */
    public CompletenessReason evaluate(int totalBooths, int selected, int target, ClusteringOutcome clustering) {
        if (totalBooths == 0) {
            return CompletenessReason.NO_BOOTHS_IN_BOUNDARY;
        }
        if (selected == target) {
            return CompletenessReason.COMPLETE;
        }
        if (clustering != null && clustering.isReduced()) {
            return CompletenessReason.CLUSTER_COUNT_REDUCED;
        }
        // With at least two booths per cluster the engine fills every cluster, so a shortfall means too few booths
        return CompletenessReason.INSUFFICIENT_BOOTHS;
    }
}
