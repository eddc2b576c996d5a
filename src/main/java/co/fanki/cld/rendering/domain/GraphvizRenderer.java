package co.fanki.cld.rendering.domain;

import co.fanki.cld.shared.DomainException;
import co.fanki.cld.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Renders DOT source by invoking the external Graphviz program.
 *
 * <p>The executable receives {@code -T<format> -o <file>} and reads the DOT
 * source from stdin. The layout engine is chosen by the {@code layout}
 * graph attribute inside the source, so a single executable serves every
 * {@link LayoutAlgorithm}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class GraphvizRenderer implements DiagramRenderer {

    private static final Logger LOG = LoggerFactory.getLogger(
            GraphvizRenderer.class);

    /** Error code for a Graphviz run that exits with an error. */
    public static final String RENDER_FAILED = "RENDER_FAILED";

    private final String executable;

    private final long timeoutSeconds;

    /**
     * Creates a new GraphvizRenderer.
     *
     * @param theExecutable the Graphviz program, e.g. "dot"
     * @param theTimeoutSeconds how long a single render may take
     */
    public GraphvizRenderer(
            @Value("${cld.render.graphviz-executable:dot}")
            final String theExecutable,
            @Value("${cld.render.timeout-seconds:60}")
            final long theTimeoutSeconds) {
        this.executable = Preconditions.requireNonBlank(theExecutable,
                "Graphviz executable is required");
        this.timeoutSeconds = Preconditions.requirePositive(theTimeoutSeconds,
                "Render timeout must be positive");
    }

    @Override
    public void render(final String dotSource, final OutputFormat format,
            final Path outputFile) {
        Preconditions.requireNonNull(dotSource, "DOT source is required");
        Preconditions.requireNonNull(format, "Format is required");
        Preconditions.requireNonNull(outputFile, "Output file is required");
        Preconditions.require(format.requiresBackend(),
                "Format " + format + " is not rendered by Graphviz");

        final List<String> command = List.of(executable,
                "-T" + format.extension(),
                "-o", outputFile.toAbsolutePath().toString());

        final Process process;
        try {
            process = new ProcessBuilder(command)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
        } catch (final IOException e) {
            throw new RenderBackendUnavailableException(
                    "Cannot run Graphviz executable '" + executable
                            + "'. Install Graphviz or set"
                            + " cld.render.graphviz-executable", e);
        }

        LOG.debug("Running {}", String.join(" ", command));

        try {
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(dotSource.getBytes(StandardCharsets.UTF_8));
            }

            final boolean finished = process.waitFor(timeoutSeconds,
                    TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new RenderBackendUnavailableException(
                        "Graphviz timed out after " + timeoutSeconds
                                + " seconds", null);
            }

            if (process.exitValue() != 0) {
                final String stderr = new String(
                        process.getErrorStream().readAllBytes(),
                        StandardCharsets.UTF_8).trim();
                throw new DomainException("Graphviz exited with code "
                        + process.exitValue() + ": " + stderr, RENDER_FAILED);
            }
        } catch (final IOException e) {
            process.destroyForcibly();
            throw new DomainException("Failed to render " + outputFile,
                    RENDER_FAILED, e);
        } catch (final InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new DomainException("Interrupted while rendering "
                    + outputFile, RENDER_FAILED, e);
        }

        LOG.info("Rendered {} with {}", outputFile, executable);
    }

}
