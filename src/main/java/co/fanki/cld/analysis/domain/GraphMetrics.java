package co.fanki.cld.analysis.domain;

import co.fanki.cld.shared.ValueObject;

/**
 * Summary counts of a causal graph.
 *
 * @param variableCount distinct variables
 * @param relationCount influences, parallel ones counted separately
 * @param positiveCount same-direction influences
 * @param negativeCount opposite-direction influences
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record GraphMetrics(int variableCount, int relationCount,
        int positiveCount, int negativeCount) implements ValueObject {
}
