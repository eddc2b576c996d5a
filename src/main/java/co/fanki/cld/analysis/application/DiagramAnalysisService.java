package co.fanki.cld.analysis.application;

import co.fanki.cld.analysis.domain.CausalGraph;
import co.fanki.cld.analysis.domain.DiagramAnalysis;
import co.fanki.cld.analysis.domain.FeedbackLoop;
import co.fanki.cld.analysis.domain.GraphMetrics;
import co.fanki.cld.analysis.domain.LoopDetector;
import co.fanki.cld.analysis.domain.MetricsAggregator;
import co.fanki.cld.analysis.domain.NodeClassification;
import co.fanki.cld.analysis.domain.NodeClassifier;
import co.fanki.cld.notation.domain.NotationFile;
import co.fanki.cld.notation.domain.NotationParser;
import co.fanki.cld.notation.domain.Relation;
import co.fanki.cld.shared.DomainException;
import co.fanki.cld.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs the analysis pipeline: notation, graph, loops, tiers and metrics.
 *
 * <p>The graph is built once and every derived view is computed from that
 * immutable snapshot. Any failure is terminal for the run; no partial
 * analysis is returned.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class DiagramAnalysisService {

    private static final Logger LOG = LoggerFactory.getLogger(
            DiagramAnalysisService.class);

    /** Error code for an input that declares no relation at all. */
    public static final String EMPTY_INPUT = "EMPTY_INPUT";

    private final LoopDetector loopDetector;

    private final NodeClassifier nodeClassifier;

    private final MetricsAggregator metricsAggregator;

    /**
     * Creates a new DiagramAnalysisService.
     *
     * @param theLoopDetector enumerates and classifies loops
     * @param theNodeClassifier assigns variable tiers
     * @param theMetricsAggregator tallies summary counts
     */
    public DiagramAnalysisService(final LoopDetector theLoopDetector,
            final NodeClassifier theNodeClassifier,
            final MetricsAggregator theMetricsAggregator) {
        this.loopDetector = theLoopDetector;
        this.nodeClassifier = theNodeClassifier;
        this.metricsAggregator = theMetricsAggregator;
    }

    /**
     * Reads and analyzes a notation file.
     *
     * @param inputFile the notation file
     * @return the annotated analysis
     * @throws DomainException with INPUT_NOT_FOUND, INVALID_ENCODING,
     *         MALFORMED_LINE or EMPTY_INPUT
     */
    public DiagramAnalysis analyzeFile(final Path inputFile) {
        Preconditions.requireNonNull(inputFile, "Input file is required");

        LOG.info("Analyzing {}", inputFile);
        return analyze(NotationFile.read(inputFile), inputFile.toString());
    }

    /**
     * Parses and analyzes notation text.
     *
     * @param text the notation text
     * @return the annotated analysis
     * @throws DomainException with MALFORMED_LINE or EMPTY_INPUT
     */
    public DiagramAnalysis analyzeText(final String text) {
        return analyze(NotationParser.parse(text), "input");
    }

    /**
     * Analyzes already parsed relations.
     *
     * @param relations the relations, in declaration order
     * @return the annotated analysis
     * @throws DomainException with EMPTY_INPUT if there are no relations
     */
    public DiagramAnalysis analyze(final List<Relation> relations) {
        return analyze(relations, "input");
    }

    /**
     * Analyzes already parsed relations read from a named source.
     *
     * @param relations the relations, in declaration order
     * @param source where the relations came from, used in error messages
     * @return the annotated analysis
     * @throws DomainException with EMPTY_INPUT if there are no relations
     */
    public DiagramAnalysis analyze(final List<Relation> relations,
            final String source) {
        Preconditions.requireNonNull(relations, "Relations are required");
        if (relations.isEmpty()) {
            throw new DomainException("No relations found in " + source,
                    EMPTY_INPUT);
        }

        final CausalGraph graph = CausalGraph.fromRelations(relations);
        LOG.info("System with {} variables and {} relations",
                graph.nodeCount(), graph.influenceCount());

        final List<FeedbackLoop> loops = loopDetector.detect(graph);
        final NodeClassification classification =
                nodeClassifier.classify(graph);
        final GraphMetrics metrics = metricsAggregator.aggregate(graph);

        LOG.info("Found {} feedback loops", loops.size());
        return new DiagramAnalysis(graph, classification, loops, metrics);
    }

}
