package co.fanki.cld.cli;

import co.fanki.cld.rendering.domain.LayoutAlgorithm;
import co.fanki.cld.shared.DomainException;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed command line:
 * {@code <input_file> [output_file] [layout_name] [--no-crossings]}.
 *
 * @param inputFile the notation file
 * @param outputFile the diagram file
 * @param layout the layout engine
 * @param minimizeCrossings false when {@code --no-crossings} is given
 * @param layoutSpecified whether the layout was given explicitly
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CommandLineArguments(Path inputFile, Path outputFile,
        LayoutAlgorithm layout, boolean minimizeCrossings,
        boolean layoutSpecified) {

    /** Flag that turns off the anti-crossing hints. */
    public static final String NO_CROSSINGS = "--no-crossings";

    /** Usage line printed on argument errors. */
    public static final String USAGE =
            "Usage: cld <input_file> [output_file] [layout_name]"
                    + " [--no-crossings]";

    /**
     * Parses raw arguments.
     *
     * <p>{@code --no-crossings} may appear anywhere. Spring style
     * {@code --name=value} options are ignored.</p>
     *
     * @param args the raw arguments
     * @param defaultOutput output file when none is given
     * @param defaultLayout layout when none is given
     * @return the parsed arguments
     * @throws DomainException with USAGE or UNKNOWN_LAYOUT
     */
    public static CommandLineArguments parse(final String[] args,
            final String defaultOutput, final String defaultLayout) {

        boolean minimize = true;
        final List<String> positional = new ArrayList<>();
        for (final String arg : args) {
            if (NO_CROSSINGS.equals(arg)) {
                minimize = false;
            } else if (arg.startsWith("--") && arg.contains("=")) {
                continue;
            } else {
                positional.add(arg);
            }
        }

        if (positional.isEmpty()) {
            throw new DomainException("Missing input file. " + USAGE,
                    "USAGE");
        }
        if (positional.size() > 3) {
            throw new DomainException("Too many arguments. " + USAGE,
                    "USAGE");
        }

        final Path input = toPath(positional.get(0));
        final Path output = toPath(positional.size() > 1
                ? positional.get(1) : defaultOutput);
        final boolean specified = positional.size() > 2;
        final LayoutAlgorithm layout = LayoutAlgorithm.fromName(
                specified ? positional.get(2) : defaultLayout);

        return new CommandLineArguments(input, output, layout, minimize,
                specified);
    }

    private static Path toPath(final String value) {
        try {
            return Path.of(value);
        } catch (final InvalidPathException e) {
            throw new DomainException("Invalid path '" + value + "': "
                    + e.getReason() + ". " + USAGE, "USAGE", e);
        }
    }

}
