package co.fanki.cld.config;

import co.fanki.cld.analysis.domain.LoopClassifier;
import co.fanki.cld.analysis.domain.LoopDetector;
import co.fanki.cld.analysis.domain.MetricsAggregator;
import co.fanki.cld.analysis.domain.NodeClassifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the analysis domain objects.
 *
 * <p>The tier proportions come from {@code cld.analysis.*}; they default
 * to a quartile split (top 25% central, bottom 25% peripheral).</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class AnalysisConfiguration {

    /**
     * Provides the loop polarity classifier.
     *
     * @return the loop classifier
     */
    @Bean
    public LoopClassifier loopClassifier() {
        return new LoopClassifier();
    }

    /**
     * Provides the feedback loop detector.
     *
     * @param loopClassifier classifies each detected loop
     * @return the loop detector
     */
    @Bean
    public LoopDetector loopDetector(final LoopClassifier loopClassifier) {
        return new LoopDetector(loopClassifier);
    }

    /**
     * Provides the node tier classifier.
     *
     * @param centralFraction share of variables for the central tier
     * @param peripheralFraction share of variables for the peripheral tier
     * @return the node classifier
     */
    @Bean
    public NodeClassifier nodeClassifier(
            @Value("${cld.analysis.central-fraction:0.25}")
            final double centralFraction,
            @Value("${cld.analysis.peripheral-fraction:0.25}")
            final double peripheralFraction) {
        return new NodeClassifier(centralFraction, peripheralFraction);
    }

    /**
     * Provides the metrics aggregator.
     *
     * @return the metrics aggregator
     */
    @Bean
    public MetricsAggregator metricsAggregator() {
        return new MetricsAggregator();
    }

}
