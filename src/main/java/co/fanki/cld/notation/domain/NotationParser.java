package co.fanki.cld.notation.domain;

import co.fanki.cld.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parses causal loop notation into an ordered list of {@link Relation}s.
 *
 * <p>Syntax, one relation per line: {@code source sign destination}, where
 * the sign is a single {@code +} or {@code -} and the fields are separated
 * by runs of whitespace. Everything from an unescaped {@code #} to the end
 * of the line is a comment; lines that are blank once the comment is gone
 * are skipped.</p>
 *
 * <p>Parsing is all-or-nothing: the first malformed line aborts with a
 * {@link MalformedLineException}. An input without relations yields an
 * empty list; deciding whether that is an error is up to the caller.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class NotationParser {

    private static final char COMMENT = '#';

    private static final char ESCAPE = '\\';

    private NotationParser() {
    }

    /**
     * Parses the given lines into relations, in declaration order.
     *
     * @param lines the raw text lines, never null
     * @return unmodifiable list of relations, possibly empty
     * @throws MalformedLineException on the first invalid data line
     */
    public static List<Relation> parse(final List<String> lines) {
        Preconditions.requireNonNull(lines, "Lines are required");

        final List<Relation> relations = new ArrayList<>();
        int lineNumber = 0;
        for (final String line : lines) {
            lineNumber++;
            if (line == null) {
                continue;
            }
            final String data = stripComment(line).strip();
            if (data.isEmpty()) {
                continue;
            }
            relations.add(parseLine(lineNumber, line, data));
        }
        return Collections.unmodifiableList(relations);
    }

    /**
     * Parses a whole notation text.
     *
     * @param text the notation text, never null
     * @return unmodifiable list of relations, possibly empty
     * @throws MalformedLineException on the first invalid data line
     */
    public static List<Relation> parse(final String text) {
        Preconditions.requireNonNull(text, "Text is required");
        return parse(text.lines().toList());
    }

    /**
     * Writes relations back as notation text, one line per relation.
     *
     * @param relations the relations to serialize
     * @return the notation text, parseable by {@link #parse(String)}
     */
    public static String format(final List<Relation> relations) {
        Preconditions.requireNonNull(relations, "Relations are required");

        final StringBuilder sb = new StringBuilder();
        for (final Relation relation : relations) {
            sb.append(relation.toNotation()).append('\n');
        }
        return sb.toString();
    }

    private static Relation parseLine(final int lineNumber,
            final String raw, final String data) {

        final String[] tokens = data.split("\\s+");
        if (tokens.length != 3) {
            throw new MalformedLineException(lineNumber, raw,
                    "expected 'source sign destination', found "
                            + tokens.length + " token(s)");
        }

        final Polarity polarity = Polarity.fromToken(tokens[1]);
        if (polarity == null) {
            throw new MalformedLineException(lineNumber, raw,
                    "sign must be a single '+' or '-', found '"
                            + tokens[1] + "'");
        }
        if (!Relation.isIdentifier(tokens[0])) {
            throw new MalformedLineException(lineNumber, raw,
                    "invalid source identifier '" + tokens[0] + "'");
        }
        if (!Relation.isIdentifier(tokens[2])) {
            throw new MalformedLineException(lineNumber, raw,
                    "invalid destination identifier '" + tokens[2] + "'");
        }
        return new Relation(tokens[0], polarity, tokens[2]);
    }

    /** Cuts the line at the first '#' that is not preceded by '\'. */
    static String stripComment(final String line) {
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == COMMENT
                    && (i == 0 || line.charAt(i - 1) != ESCAPE)) {
                return line.substring(0, i);
            }
        }
        return line;
    }

}
