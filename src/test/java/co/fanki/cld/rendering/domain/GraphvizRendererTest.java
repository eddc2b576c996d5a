package co.fanki.cld.rendering.domain;

import co.fanki.cld.shared.DomainException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Unit tests for {@link GraphvizRenderer}.
 *
 * <p>Graphviz itself is not required; the tests point the renderer at
 * programs that are missing or always fail.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class GraphvizRendererTest {

    private static final String DOT_SOURCE = "digraph cld { \"A\" -> \"B\"; }\n";

    @Test
    void whenRendering_givenMissingExecutable_shouldReportBackendUnavailable(
            @TempDir final Path dir) {
        final GraphvizRenderer renderer = new GraphvizRenderer(
                dir.resolve("no-such-graphviz").toString(), 5);

        final RenderBackendUnavailableException ex = assertThrows(
                RenderBackendUnavailableException.class,
                () -> renderer.render(DOT_SOURCE, OutputFormat.SVG,
                        dir.resolve("out.svg")));

        assertEquals(RenderBackendUnavailableException.ERROR_CODE,
                ex.getErrorCode());
    }

    @Test
    void whenRendering_givenFailingExecutable_shouldReportRenderFailed(
            @TempDir final Path dir) {
        final Path failing = Path.of("/bin/false");
        assumeTrue(Files.isExecutable(failing));
        final GraphvizRenderer renderer = new GraphvizRenderer(
                failing.toString(), 5);

        final DomainException ex = assertThrows(DomainException.class,
                () -> renderer.render(DOT_SOURCE, OutputFormat.PNG,
                        dir.resolve("out.png")));

        assertEquals(GraphvizRenderer.RENDER_FAILED, ex.getErrorCode());
    }

    @Test
    void whenRendering_givenTextFormat_shouldRejectIt(@TempDir final Path dir) {
        final GraphvizRenderer renderer = new GraphvizRenderer("dot", 5);

        assertThrows(IllegalArgumentException.class,
                () -> renderer.render(DOT_SOURCE, OutputFormat.JSON,
                        dir.resolve("out.json")));
    }

    @Test
    void whenCreating_givenBlankExecutableOrZeroTimeout_shouldThrow() {
        assertThrows(IllegalArgumentException.class,
                () -> new GraphvizRenderer(" ", 5));
        assertThrows(IllegalArgumentException.class,
                () -> new GraphvizRenderer("dot", 0));
    }

}
