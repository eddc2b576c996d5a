package co.fanki.cld.rendering.application;

import co.fanki.cld.analysis.domain.DiagramAnalysis;
import co.fanki.cld.rendering.domain.DiagramRenderer;
import co.fanki.cld.rendering.domain.DotDiagramWriter;
import co.fanki.cld.rendering.domain.GraphvizRenderer;
import co.fanki.cld.rendering.domain.OutputFormat;
import co.fanki.cld.rendering.domain.RenderOptions;
import co.fanki.cld.shared.DomainException;
import co.fanki.cld.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes an analyzed diagram to disk in the format its file name asks for.
 *
 * <p>DOT and JSON are written directly; SVG, PNG and PDF go through the
 * {@link DiagramRenderer}. Unsupported extensions fall back to SVG and
 * missing parent directories are created.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class DiagramExportService {

    private static final Logger LOG = LoggerFactory.getLogger(
            DiagramExportService.class);

    private final DiagramRenderer renderer;

    /**
     * Creates a new DiagramExportService.
     *
     * @param theRenderer the image rendering backend
     */
    public DiagramExportService(final DiagramRenderer theRenderer) {
        this.renderer = theRenderer;
    }

    /**
     * Exports the diagram.
     *
     * @param analysis the annotated graph
     * @param options layout and crossing settings
     * @param requestedFile the output file asked for
     * @return the file actually written
     * @throws co.fanki.cld.rendering.domain.RenderBackendUnavailableException
     *         if an image is requested and Graphviz cannot run
     * @throws DomainException with RENDER_FAILED if the file cannot be
     *         produced
     */
    public Path export(final DiagramAnalysis analysis,
            final RenderOptions options, final Path requestedFile) {
        Preconditions.requireNonNull(analysis, "Analysis is required");
        Preconditions.requireNonNull(options, "Render options are required");
        Preconditions.requireNonNull(requestedFile, "Output file is required");

        final Path outputFile = OutputFormat.normalize(requestedFile);
        if (!outputFile.equals(requestedFile)) {
            LOG.warn("Unsupported output extension in {}, writing {}",
                    requestedFile, outputFile);
        }
        final OutputFormat format = OutputFormat.fromFile(outputFile);

        createParentDirectories(outputFile);

        switch (format) {
            case JSON -> writeText(outputFile, analysis.toJson());
            case DOT -> writeText(outputFile,
                    DotDiagramWriter.write(analysis, options));
            default -> renderer.render(
                    DotDiagramWriter.write(analysis, options), format,
                    outputFile);
        }

        LOG.info("Diagram saved to {} (layout {})", outputFile,
                options.layout().engineName());
        return outputFile;
    }

    private static void createParentDirectories(final Path file) {
        final Path parent = file.toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (final IOException e) {
            throw new DomainException("Cannot create output directory "
                    + parent, GraphvizRenderer.RENDER_FAILED, e);
        }
    }

    private static void writeText(final Path file, final String content) {
        try {
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new DomainException("Cannot write " + file,
                    GraphvizRenderer.RENDER_FAILED, e);
        }
    }

}
