package co.fanki.cld.notation.domain;

import co.fanki.cld.shared.DomainException;
import co.fanki.cld.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads a notation file from disk and parses it.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class NotationFile {

    private static final Logger LOG = LoggerFactory.getLogger(
            NotationFile.class);

    /** Error code for an input file that is missing or unreadable. */
    public static final String INPUT_NOT_FOUND = "INPUT_NOT_FOUND";

    /** Error code for an input file that is not valid UTF-8 text. */
    public static final String INVALID_ENCODING = "INVALID_ENCODING";

    private NotationFile() {
    }

    /**
     * Reads the file as UTF-8 and parses its relations.
     *
     * @param file the notation file
     * @return the relations in declaration order, possibly empty
     * @throws DomainException with {@code INPUT_NOT_FOUND} if the file
     *         cannot be read, or {@code INVALID_ENCODING} if it is not
     *         UTF-8
     * @throws MalformedLineException on the first invalid data line
     */
    public static List<Relation> read(final Path file) {
        Preconditions.requireNonNull(file, "Input file is required");

        if (!Files.isRegularFile(file)) {
            throw new DomainException("Input file not found: " + file,
                    INPUT_NOT_FOUND);
        }

        final List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (final CharacterCodingException e) {
            throw new DomainException("Input file is not valid UTF-8: "
                    + file, INVALID_ENCODING, e);
        } catch (final IOException e) {
            throw new DomainException("Cannot read input file: " + file,
                    INPUT_NOT_FOUND, e);
        }

        LOG.debug("Read {} lines from {}", lines.size(), file);
        return NotationParser.parse(lines);
    }

}
