package co.fanki.cld.analysis.application;

import co.fanki.cld.analysis.domain.DiagramAnalysis;
import co.fanki.cld.analysis.domain.FeedbackLoop;
import co.fanki.cld.analysis.domain.GraphMetrics;
import co.fanki.cld.analysis.domain.LoopPolarity;
import co.fanki.cld.analysis.domain.NodeTier;

import java.util.List;

/**
 * Formats a {@link DiagramAnalysis} as the plain text system report.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class AnalysisReportFormatter {

    private static final String RULE = "=".repeat(60);

    private AnalysisReportFormatter() {
    }

    /**
     * Builds the report: node tiers, loops with their behaviour, metrics.
     *
     * @param analysis the analysis to describe
     * @param layoutName the layout the diagram was rendered with
     * @return the multi-line report
     */
    public static String format(final DiagramAnalysis analysis,
            final String layoutName) {

        final StringBuilder sb = new StringBuilder();
        sb.append(RULE).append('\n');
        sb.append("DETAILED SYSTEM ANALYSIS").append('\n');
        sb.append(RULE).append('\n');

        sb.append('\n').append("NODE CLASSIFICATION:").append('\n');
        for (final NodeTier tier : NodeTier.values()) {
            final List<String> members =
                    analysis.classification().members(tier);
            sb.append("   ").append(tier.label())
                    .append(" (").append(members.size()).append("): ")
                    .append(String.join(", ", members)).append('\n');
        }

        final List<FeedbackLoop> loops = analysis.loops();
        if (loops.isEmpty()) {
            sb.append('\n').append("No loops detected in the system")
                    .append('\n');
        } else {
            sb.append('\n').append("IDENTIFIED LOOPS (").append(loops.size())
                    .append("):").append('\n');
            int number = 1;
            for (final FeedbackLoop loop : loops) {
                appendLoop(sb, number++, loop);
            }
        }

        final GraphMetrics metrics = analysis.metrics();
        sb.append('\n').append("SYSTEM METRICS:").append('\n');
        sb.append("   - Total variables: ").append(metrics.variableCount())
                .append('\n');
        sb.append("   - Total relations: ").append(metrics.relationCount())
                .append('\n');
        sb.append("   - Positive relations: ").append(metrics.positiveCount())
                .append('\n');
        sb.append("   - Negative relations: ").append(metrics.negativeCount())
                .append('\n');
        sb.append("   - Reinforcing loops: ")
                .append(analysis.loops(LoopPolarity.REINFORCING).size())
                .append('\n');
        sb.append("   - Balancing loops: ")
                .append(analysis.loops(LoopPolarity.BALANCING).size())
                .append('\n');
        if (layoutName != null) {
            sb.append("   - Layout used: ").append(layoutName).append('\n');
        }
        return sb.toString();
    }

    private static void appendLoop(final StringBuilder sb, final int number,
            final FeedbackLoop loop) {
        sb.append('\n').append("   Loop ").append(number).append(": ")
                .append(loop.describe()).append('\n');
        sb.append("   Type: ").append(loop.polarity().label())
                .append(" (").append(loop.oppositeCount())
                .append(" negative signs)").append('\n');
        sb.append("   Behavior: ").append(loop.polarity().behavior())
                .append('\n');
        if (loop.polarity() == LoopPolarity.REINFORCING) {
            sb.append("   Warning: May lead to uncontrolled growth or collapse")
                    .append('\n');
        } else {
            sb.append("   Effect: Stabilizes the system").append('\n');
        }
    }

}
