package co.fanki.cld.analysis.application;

import co.fanki.cld.analysis.domain.DiagramAnalysis;
import co.fanki.cld.analysis.domain.FeedbackLoop;
import co.fanki.cld.analysis.domain.LoopClassifier;
import co.fanki.cld.analysis.domain.LoopDetector;
import co.fanki.cld.analysis.domain.LoopPolarity;
import co.fanki.cld.analysis.domain.MetricsAggregator;
import co.fanki.cld.analysis.domain.NodeClassifier;
import co.fanki.cld.analysis.domain.NodeTier;
import co.fanki.cld.notation.domain.MalformedLineException;
import co.fanki.cld.shared.DomainException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link DiagramAnalysisService}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class DiagramAnalysisServiceTest {

    private DiagramAnalysisService service;

    @BeforeEach
    void setUp() {
        service = new DiagramAnalysisService(
                new LoopDetector(new LoopClassifier()),
                new NodeClassifier(),
                new MetricsAggregator());
    }

    // -- end to end scenarios ----------------------------------------------

    @Test
    void whenAnalyzing_givenThreeNodeBalancingLoop_shouldReportIt() {
        final DiagramAnalysis analysis = service.analyzeText("""
                X + Y
                Y - Z
                Z + X
                """);

        assertEquals(1, analysis.loops().size());
        final FeedbackLoop loop = analysis.loops().get(0);
        assertEquals(List.of("X", "Y", "Z"), loop.nodes());
        assertEquals(LoopPolarity.BALANCING, loop.polarity());
        assertEquals(1, loop.oppositeCount());
        assertEquals(NodeTier.CENTRAL, analysis.tierOf("X"));
        assertEquals(NodeTier.CENTRAL, analysis.tierOf("Z"));
    }

    @Test
    void whenAnalyzing_givenTwoNodeReinforcingLoop_shouldReportIt() {
        final DiagramAnalysis analysis = service.analyzeText("""
                Population + Births
                Births + Population
                """);

        assertEquals(1, analysis.loops().size());
        assertEquals(LoopPolarity.REINFORCING,
                analysis.loops().get(0).polarity());
        assertEquals(2, analysis.metrics().positiveCount());
    }

    @Test
    void whenAnalyzing_givenNegativeSelfLoop_shouldReportBalancingLoop() {
        final DiagramAnalysis analysis = service.analyzeText("Stock - Stock");

        assertEquals(1, analysis.loops().size());
        assertEquals(List.of("Stock"), analysis.loops().get(0).nodes());
        assertEquals(LoopPolarity.BALANCING,
                analysis.loops().get(0).polarity());
        assertEquals(1, analysis.metrics().variableCount());
    }

    @Test
    void whenAnalyzing_givenChain_shouldReportNoLoops() {
        final DiagramAnalysis analysis = service.analyzeText("""
                A + B
                B - C
                """);

        assertTrue(analysis.loops().isEmpty());
        assertEquals(NodeTier.CENTRAL, analysis.tierOf("B"));
        assertEquals(NodeTier.PERIPHERAL, analysis.tierOf("A"));
    }

    @Test
    void whenAnalyzing_givenRotatedDeclarations_shouldReturnSameLoops() {
        final DiagramAnalysis first = service.analyzeText("""
                A + B
                B + C
                C - A
                """);
        final DiagramAnalysis second = service.analyzeText("""
                C - A
                A + B
                B + C
                """);

        assertEquals(first.loops().get(0).nodes(),
                second.loops().get(0).nodes());
        assertEquals(first.loops().get(0).polarity(),
                second.loops().get(0).polarity());
    }

    // -- errors ------------------------------------------------------------

    @Test
    void whenAnalyzing_givenOnlyComments_shouldThrowEmptyInput() {
        final DomainException ex = assertThrows(DomainException.class,
                () -> service.analyzeText("# nothing here\n\n"));

        assertEquals(DiagramAnalysisService.EMPTY_INPUT, ex.getErrorCode());
    }

    @Test
    void whenAnalyzing_givenEmptyRelationList_shouldThrowEmptyInput() {
        final DomainException ex = assertThrows(DomainException.class,
                () -> service.analyze(List.of()));

        assertEquals(DiagramAnalysisService.EMPTY_INPUT, ex.getErrorCode());
    }

    @Test
    void whenAnalyzing_givenMalformedLine_shouldPropagateLineNumber() {
        final MalformedLineException ex = assertThrows(
                MalformedLineException.class,
                () -> service.analyzeText("A + B\nB ++ C\n"));

        assertEquals(2, ex.lineNumber());
    }

    // -- files -------------------------------------------------------------

    @Test
    void whenAnalyzingFile_givenNotationFile_shouldAnalyzeIt(
            @TempDir final Path dir) throws Exception {
        final Path input = dir.resolve("cld.txt");
        Files.writeString(input, "# demand loop\nPrice - Demand\n"
                + "Demand + Price\n", StandardCharsets.UTF_8);

        final DiagramAnalysis analysis = service.analyzeFile(input);

        assertEquals(2, analysis.metrics().variableCount());
        assertEquals(List.of("Demand", "Price"),
                analysis.loops().get(0).nodes());
    }

    @Test
    void whenAnalyzingFile_givenEmptyFile_shouldThrowEmptyInput(
            @TempDir final Path dir) throws Exception {
        final Path input = dir.resolve("empty.txt");
        Files.writeString(input, "", StandardCharsets.UTF_8);

        final DomainException ex = assertThrows(DomainException.class,
                () -> service.analyzeFile(input));

        assertEquals(DiagramAnalysisService.EMPTY_INPUT, ex.getErrorCode());
        assertTrue(ex.getMessage().contains(input.toString()));
    }

    @Test
    void whenAnalyzingFile_givenMissingFile_shouldThrowInputNotFound(
            @TempDir final Path dir) {
        final DomainException ex = assertThrows(DomainException.class,
                () -> service.analyzeFile(dir.resolve("missing.txt")));

        assertEquals("INPUT_NOT_FOUND", ex.getErrorCode());
    }

}
