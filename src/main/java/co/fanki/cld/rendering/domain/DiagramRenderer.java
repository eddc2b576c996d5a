package co.fanki.cld.rendering.domain;

import java.nio.file.Path;

/**
 * Backend that turns DOT source into an image file.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface DiagramRenderer {

    /**
     * Renders DOT source into the given file.
     *
     * @param dotSource the diagram in DOT syntax
     * @param format the image format, must require a backend
     * @param outputFile where to write the image
     * @throws RenderBackendUnavailableException if the backend cannot run
     * @throws co.fanki.cld.shared.DomainException with RENDER_FAILED if the
     *         backend reports an error
     */
    void render(String dotSource, OutputFormat format, Path outputFile);

}
