package co.fanki.cld.rendering.application;

import co.fanki.cld.analysis.application.DiagramAnalysisService;
import co.fanki.cld.analysis.domain.DiagramAnalysis;
import co.fanki.cld.analysis.domain.LoopClassifier;
import co.fanki.cld.analysis.domain.LoopDetector;
import co.fanki.cld.analysis.domain.MetricsAggregator;
import co.fanki.cld.analysis.domain.NodeClassifier;
import co.fanki.cld.rendering.domain.DiagramRenderer;
import co.fanki.cld.rendering.domain.LayoutAlgorithm;
import co.fanki.cld.rendering.domain.OutputFormat;
import co.fanki.cld.rendering.domain.RenderBackendUnavailableException;
import co.fanki.cld.rendering.domain.RenderOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Unit tests for {@link DiagramExportService}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class DiagramExportServiceTest {

    private static final RenderOptions OPTIONS =
            new RenderOptions(LayoutAlgorithm.CIRCO, false);

    private DiagramRenderer renderer;
    private DiagramExportService exportService;
    private DiagramAnalysis analysis;

    @BeforeEach
    void setUp() {
        renderer = mock(DiagramRenderer.class);
        exportService = new DiagramExportService(renderer);
        analysis = new DiagramAnalysisService(
                new LoopDetector(new LoopClassifier()), new NodeClassifier(),
                new MetricsAggregator()).analyzeText("""
                        X + Y
                        Y - X
                        """);
    }

    @Test
    void whenExporting_givenSvgFile_shouldDelegateToRenderer(
            @TempDir final Path dir) {
        final Path output = dir.resolve("diagram.svg");

        final Path written = exportService.export(analysis, OPTIONS, output);

        assertEquals(output, written);
        verify(renderer).render(anyString(), eq(OutputFormat.SVG), eq(output));
    }

    @Test
    void whenExporting_givenUnsupportedExtension_shouldRenderSvgSibling(
            @TempDir final Path dir) {
        final Path written = exportService.export(analysis, OPTIONS,
                dir.resolve("diagram.gif"));

        assertEquals(dir.resolve("diagram.svg"), written);
        verify(renderer).render(anyString(), eq(OutputFormat.SVG),
                eq(dir.resolve("diagram.svg")));
    }

    @Test
    void whenExporting_givenDotFile_shouldWriteSourceWithoutRenderer(
            @TempDir final Path dir) throws Exception {
        final Path output = dir.resolve("nested/out/diagram.dot");

        exportService.export(analysis, OPTIONS, output);

        final String content = Files.readString(output, StandardCharsets.UTF_8);
        assertTrue(content.startsWith("digraph cld {"));
        assertTrue(content.contains("\"X\" -> \"Y\""));
        verifyNoInteractions(renderer);
    }

    @Test
    void whenExporting_givenJsonFile_shouldWriteAnalysisWithoutRenderer(
            @TempDir final Path dir) throws Exception {
        final Path output = dir.resolve("diagram.json");

        exportService.export(analysis, OPTIONS, output);

        final String content = Files.readString(output, StandardCharsets.UTF_8);
        assertTrue(content.contains("\"loops\""));
        assertTrue(content.contains("\"BALANCING\""));
        verifyNoInteractions(renderer);
    }

    @Test
    void whenExporting_givenRendererUnavailable_shouldPropagate(
            @TempDir final Path dir) {
        doThrow(new RenderBackendUnavailableException("no graphviz", null))
                .when(renderer).render(anyString(), any(), any());

        assertThrows(RenderBackendUnavailableException.class,
                () -> exportService.export(analysis, OPTIONS,
                        dir.resolve("diagram.png")));
    }

}
