package co.fanki.cld.cli;

import co.fanki.cld.analysis.application.DiagramAnalysisService;
import co.fanki.cld.analysis.domain.LoopClassifier;
import co.fanki.cld.analysis.domain.LoopDetector;
import co.fanki.cld.analysis.domain.MetricsAggregator;
import co.fanki.cld.analysis.domain.NodeClassifier;
import co.fanki.cld.rendering.application.DiagramExportService;
import co.fanki.cld.rendering.application.LayoutComparisonService;
import co.fanki.cld.rendering.application.LayoutComparisonService.ComparisonResult;
import co.fanki.cld.rendering.domain.LayoutAlgorithm;
import co.fanki.cld.rendering.domain.RenderBackendUnavailableException;
import co.fanki.cld.rendering.domain.RenderOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link DiagramCommandRunner}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class DiagramCommandRunnerTest {

    @TempDir
    Path dir;

    private DiagramExportService exportService;
    private LayoutComparisonService comparisonService;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private DiagramCommandRunner runner;

    @BeforeEach
    void setUp() {
        exportService = mock(DiagramExportService.class);
        comparisonService = mock(LayoutComparisonService.class);
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        runner = new DiagramCommandRunner(
                new DiagramAnalysisService(
                        new LoopDetector(new LoopClassifier()),
                        new NodeClassifier(), new MetricsAggregator()),
                exportService, comparisonService,
                dir.resolve("cld_graphviz.svg").toString(), "circo", true,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
        when(exportService.export(any(), any(), any()))
                .thenAnswer(invocation -> invocation.getArgument(2));
    }

    private Path notation(final String content) throws Exception {
        final Path input = dir.resolve("model.txt");
        Files.writeString(input, content, StandardCharsets.UTF_8);
        return input;
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    // -- success -----------------------------------------------------------

    @Test
    void whenRunning_givenLayout_shouldRenderAndPrintReportOnly()
            throws Exception {
        final Path input = notation("X + Y\nY - Z\nZ + X\n");
        final Path output = dir.resolve("out.svg");

        runner.run(input.toString(), output.toString(), "neato");

        assertEquals(ExitCode.SUCCESS, runner.exitCode());
        assertEquals(0, runner.getExitCode());
        verify(exportService).export(any(),
                eq(new RenderOptions(LayoutAlgorithm.NEATO, true)),
                eq(output));
        verifyNoInteractions(comparisonService);

        final String printed = stdout();
        assertTrue(printed.contains("System with 3 variables and 3 relations"));
        assertTrue(printed.contains("Anti-crossing mode ACTIVE"));
        assertTrue(printed.contains("Diagram saved to: " + output));
        assertTrue(printed.contains("IDENTIFIED LOOPS (1):"));
        assertTrue(printed.contains("   Loop 1: X → Y → Z → X"));
        assertTrue(printed.contains("   - Layout used: neato"));
        assertFalse(printed.contains("RECOMMENDATIONS"));
    }

    @Test
    void whenRunning_givenNoLayout_shouldAlsoRenderComparison()
            throws Exception {
        final Path input = notation("A + B\nB + A\n");
        final Path output = dir.resolve("cld_graphviz.svg");
        when(comparisonService.compare(any(), eq(output), eq(false)))
                .thenReturn(List.of(new ComparisonResult(
                        dir.resolve("cld_graphviz_optimized_sfdp.svg"),
                        LayoutAlgorithm.SFDP, true)));

        runner.run(input.toString(), "--no-crossings");

        assertEquals(ExitCode.SUCCESS, runner.exitCode());
        verify(exportService).export(any(),
                eq(new RenderOptions(LayoutAlgorithm.CIRCO, false)),
                eq(output));
        final String printed = stdout();
        assertTrue(printed.contains("Anti-crossing mode DISABLED"));
        assertTrue(printed.contains("RECOMMENDATIONS TO MINIMIZE CROSSINGS:"));
        assertTrue(printed.contains("cld_graphviz_optimized_sfdp.svg"
                + " - Scalable Force-Directed Placement (anti-crossing)"));
    }

    // -- failures ----------------------------------------------------------

    @Test
    void whenRunning_givenNoArguments_shouldExitWithUsage() {
        runner.run();

        assertEquals(ExitCode.USAGE, runner.exitCode());
        assertEquals(2, runner.getExitCode());
        assertTrue(stderr().startsWith("Error [USAGE]: "));
        verifyNoInteractions(exportService);
    }

    @Test
    void whenRunning_givenInvalidPath_shouldExitWithUsage() {
        runner.run("in\0put.txt");

        assertEquals(ExitCode.USAGE, runner.exitCode());
        assertTrue(stderr().startsWith("Error [USAGE]: "));
        verifyNoInteractions(exportService);
    }

    @Test
    void whenRunning_givenUnknownLayout_shouldExitWithUsage() throws Exception {
        final Path input = notation("A + B\n");

        runner.run(input.toString(), "out.svg", "spiral");

        assertEquals(ExitCode.USAGE, runner.exitCode());
        assertTrue(stderr().contains("UNKNOWN_LAYOUT"));
    }

    @Test
    void whenRunning_givenMissingInput_shouldExitWithAnalysisError() {
        runner.run(dir.resolve("missing.txt").toString());

        assertEquals(ExitCode.ANALYSIS_ERROR, runner.exitCode());
        assertTrue(stderr().contains("INPUT_NOT_FOUND"));
        assertEquals("", stdout());
    }

    @Test
    void whenRunning_givenMalformedInput_shouldExitBeforeRendering()
            throws Exception {
        final Path input = notation("A + B\nA => B\n");

        runner.run(input.toString());

        assertEquals(ExitCode.ANALYSIS_ERROR, runner.exitCode());
        assertTrue(stderr().contains("MALFORMED_LINE"));
        verifyNoInteractions(exportService);
    }

    @Test
    void whenRunning_givenGraphvizMissing_shouldExitWithBackendUnavailable()
            throws Exception {
        final Path input = notation("A + B\n");
        when(exportService.export(any(), any(), any())).thenThrow(
                new RenderBackendUnavailableException("no dot", null));

        runner.run(input.toString(), "out.png", "dot");

        assertEquals(ExitCode.RENDER_BACKEND_UNAVAILABLE, runner.exitCode());
        assertEquals(3, runner.getExitCode());
        assertEquals("", stdout());
    }

}
