package co.fanki.cld.rendering.domain;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Output formats, selected by the extension of the output file.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum OutputFormat {

    SVG("svg", true),

    PNG("png", true),

    PDF("pdf", true),

    /** DOT source, written without invoking Graphviz. */
    DOT("dot", false),

    /** The annotated analysis as JSON, written without invoking Graphviz. */
    JSON("json", false);

    private final String extension;

    private final boolean rendered;

    OutputFormat(final String theExtension, final boolean isRendered) {
        this.extension = theExtension;
        this.rendered = isRendered;
    }

    /**
     * Returns the file extension, without the dot.
     *
     * @return e.g. "svg"
     */
    public String extension() {
        return extension;
    }

    /**
     * Checks if producing this format requires the Graphviz backend.
     *
     * @return true for image formats
     */
    public boolean requiresBackend() {
        return rendered;
    }

    /**
     * Detects the format of an output file from its extension.
     *
     * @param file the output file
     * @return the format, or null when the extension is not supported
     */
    public static OutputFormat fromFile(final Path file) {
        final Path name = file.getFileName();
        if (name == null) {
            return null;
        }
        final String fileName = name.toString();
        final int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            return null;
        }
        final String ext = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        for (final OutputFormat format : values()) {
            if (format.extension.equals(ext)) {
                return format;
            }
        }
        return null;
    }

    /**
     * Resolves the file actually written for a requested output path.
     *
     * <p>Unsupported or missing extensions are replaced with {@code .svg}.</p>
     *
     * @param file the requested output file
     * @return the requested file, or its {@code .svg} sibling
     */
    public static Path normalize(final Path file) {
        if (fromFile(file) != null) {
            return file;
        }
        final String fileName = file.getFileName().toString();
        final int dot = fileName.lastIndexOf('.');
        final String base = dot < 0 ? fileName : fileName.substring(0, dot);
        return file.resolveSibling(base + "." + SVG.extension);
    }

}
