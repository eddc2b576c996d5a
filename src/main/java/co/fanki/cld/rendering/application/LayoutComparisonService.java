package co.fanki.cld.rendering.application;

import co.fanki.cld.analysis.domain.DiagramAnalysis;
import co.fanki.cld.rendering.domain.LayoutAlgorithm;
import co.fanki.cld.rendering.domain.RenderOptions;
import co.fanki.cld.shared.DomainException;
import co.fanki.cld.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Renders the same diagram with several layouts, side by side.
 *
 * <p>Two sets are produced next to the main output:</p>
 * <ul>
 *   <li><b>normal</b>: circo, fdp, neato and twopi, with the crossing
 *       setting of the run.</li>
 *   <li><b>optimized</b>: sfdp, fdp, circo and neato, always with the
 *       anti-crossing hints.</li>
 * </ul>
 *
 * <p>A layout that fails is logged and skipped; the others still run.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class LayoutComparisonService {

    private static final Logger LOG = LoggerFactory.getLogger(
            LayoutComparisonService.class);

    /** Layouts of the plain comparison set. */
    public static final List<LayoutAlgorithm> NORMAL_LAYOUTS = List.of(
            LayoutAlgorithm.CIRCO, LayoutAlgorithm.FDP,
            LayoutAlgorithm.NEATO, LayoutAlgorithm.TWOPI);

    /** Layouts of the anti-crossing comparison set. */
    public static final List<LayoutAlgorithm> OPTIMIZED_LAYOUTS = List.of(
            LayoutAlgorithm.SFDP, LayoutAlgorithm.FDP,
            LayoutAlgorithm.CIRCO, LayoutAlgorithm.NEATO);

    /**
     * One rendered comparison file.
     *
     * @param file the written file
     * @param layout the layout used
     * @param optimized whether the anti-crossing hints were forced on
     */
    public record ComparisonResult(Path file, LayoutAlgorithm layout,
            boolean optimized) {}

    private final DiagramExportService exportService;

    /**
     * Creates a new LayoutComparisonService.
     *
     * @param theExportService writes each comparison file
     */
    public LayoutComparisonService(
            final DiagramExportService theExportService) {
        this.exportService = theExportService;
    }

    /**
     * Renders both comparison sets as SVG files.
     *
     * @param analysis the annotated graph
     * @param mainOutput the main output file; its name, without extension,
     *        is the base of the comparison file names
     * @param minimizeCrossings the crossing setting for the normal set
     * @return the files that were rendered successfully
     */
    public List<ComparisonResult> compare(final DiagramAnalysis analysis,
            final Path mainOutput, final boolean minimizeCrossings) {
        Preconditions.requireNonNull(analysis, "Analysis is required");
        Preconditions.requireNonNull(mainOutput, "Main output is required");

        final String base = baseName(mainOutput);
        final List<ComparisonResult> results = new ArrayList<>();

        LOG.info("Generating layout comparison for {}", base);
        // The normal set honours --no-crossings so it shows what the run
        // asked for; the optimized set below is the hinted counterpart.
        for (final LayoutAlgorithm layout : NORMAL_LAYOUTS) {
            renderOne(analysis, mainOutput.resolveSibling(
                    base + "_normal_" + layout.engineName() + ".svg"),
                    new RenderOptions(layout, minimizeCrossings), false,
                    results);
        }
        for (final LayoutAlgorithm layout : OPTIMIZED_LAYOUTS) {
            renderOne(analysis, mainOutput.resolveSibling(
                    base + "_optimized_" + layout.engineName() + ".svg"),
                    new RenderOptions(layout, true), true, results);
        }
        return Collections.unmodifiableList(results);
    }

    private void renderOne(final DiagramAnalysis analysis, final Path file,
            final RenderOptions options, final boolean optimized,
            final List<ComparisonResult> results) {
        LOG.info("Creating {} ({})", options.layout().description(), file);
        try {
            final Path written = exportService.export(analysis, options, file);
            results.add(new ComparisonResult(written, options.layout(),
                    optimized));
        } catch (final DomainException e) {
            LOG.warn("Error in layout {}: {}", options.layout().engineName(),
                    e.getMessage());
        }
    }

    private static String baseName(final Path file) {
        final String name = file.getFileName().toString();
        final int dot = name.lastIndexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }

}
