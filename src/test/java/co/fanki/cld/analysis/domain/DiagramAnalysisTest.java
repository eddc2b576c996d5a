package co.fanki.cld.analysis.domain;

import co.fanki.cld.notation.domain.NotationParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for {@link DiagramAnalysis}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class DiagramAnalysisTest {

    private static DiagramAnalysis analyze(final String notation) {
        final CausalGraph graph = CausalGraph.fromRelations(
                NotationParser.parse(notation));
        return new DiagramAnalysis(graph,
                new NodeClassifier().classify(graph),
                new LoopDetector(new LoopClassifier()).detect(graph),
                new MetricsAggregator().aggregate(graph));
    }

    @Test
    void whenFilteringLoops_givenPolarity_shouldReturnOnlyMatching() {
        final DiagramAnalysis analysis = analyze("""
                A + B
                B + A
                B - C
                C + B
                """);

        assertEquals(1, analysis.loops(LoopPolarity.REINFORCING).size());
        assertEquals(1, analysis.loops(LoopPolarity.BALANCING).size());
        assertEquals(List.of("B", "C"),
                analysis.loops(LoopPolarity.BALANCING).get(0).nodes());
    }

    @Test
    void whenSerializing_givenAnalysis_shouldWriteNodesEdgesLoopsAndMetrics()
            throws Exception {
        final DiagramAnalysis analysis = analyze("""
                X + Y
                Y - Z
                Z + X
                """);

        final JsonNode root = new ObjectMapper().readTree(analysis.toJson());

        assertEquals(3, root.get("nodes").size());
        assertEquals("X", root.get("nodes").get(0).get("id").asText());
        assertEquals("CENTRAL", root.get("nodes").get(0).get("tier").asText());
        assertEquals("OPPOSITE_DIRECTION",
                root.get("edges").get(1).get("polarity").asText());
        assertEquals(1, root.get("loops").size());
        assertEquals("BALANCING",
                root.get("loops").get(0).get("polarity").asText());
        assertEquals(1, root.get("loops").get(0).get("negativeCount").asInt());
        assertEquals(3, root.get("metrics").get("relations").asInt());
        assertEquals(1, root.get("metrics").get("negative").asInt());
    }

}
