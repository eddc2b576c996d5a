package co.fanki.cld.cli;

import co.fanki.cld.analysis.application.AnalysisReportFormatter;
import co.fanki.cld.analysis.application.DiagramAnalysisService;
import co.fanki.cld.analysis.domain.DiagramAnalysis;
import co.fanki.cld.rendering.application.DiagramExportService;
import co.fanki.cld.rendering.application.LayoutComparisonService;
import co.fanki.cld.rendering.application.LayoutComparisonService.ComparisonResult;
import co.fanki.cld.rendering.domain.RenderOptions;
import co.fanki.cld.shared.DomainException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

/**
 * Command line entry point: analyzes a notation file, renders the diagram
 * and prints the system report.
 *
 * <p>When no layout is given on the command line and
 * {@code cld.render.compare-layouts} is on, a set of comparison diagrams
 * is rendered next to the main output as well.</p>
 *
 * <p>Every failure ends the run with the exit status mapped by
 * {@link ExitCode}; nothing is retried.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
@ConditionalOnProperty(name = "cld.cli.enabled", havingValue = "true",
        matchIfMissing = true)
public class DiagramCommandRunner implements CommandLineRunner,
        ExitCodeGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(
            DiagramCommandRunner.class);

    private final DiagramAnalysisService analysisService;

    private final DiagramExportService exportService;

    private final LayoutComparisonService comparisonService;

    private final String defaultOutput;

    private final String defaultLayout;

    private final boolean compareLayouts;

    private final PrintStream out;

    private final PrintStream err;

    private ExitCode exitCode = ExitCode.SUCCESS;

    /**
     * Creates a new DiagramCommandRunner writing to the standard streams.
     *
     * @param theAnalysisService runs the analysis
     * @param theExportService writes the main diagram
     * @param theComparisonService renders the layout comparison
     * @param theDefaultOutput output file when none is given
     * @param theDefaultLayout layout when none is given
     * @param theCompareLayouts whether to render the comparison set
     */
    @Autowired
    public DiagramCommandRunner(
            final DiagramAnalysisService theAnalysisService,
            final DiagramExportService theExportService,
            final LayoutComparisonService theComparisonService,
            @Value("${cld.render.default-output:cld_graphviz.svg}")
            final String theDefaultOutput,
            @Value("${cld.render.default-layout:circo}")
            final String theDefaultLayout,
            @Value("${cld.render.compare-layouts:true}")
            final boolean theCompareLayouts) {
        this(theAnalysisService, theExportService, theComparisonService,
                theDefaultOutput, theDefaultLayout, theCompareLayouts,
                System.out, System.err);
    }

    DiagramCommandRunner(
            final DiagramAnalysisService theAnalysisService,
            final DiagramExportService theExportService,
            final LayoutComparisonService theComparisonService,
            final String theDefaultOutput,
            final String theDefaultLayout,
            final boolean theCompareLayouts,
            final PrintStream theOut,
            final PrintStream theErr) {
        this.analysisService = theAnalysisService;
        this.exportService = theExportService;
        this.comparisonService = theComparisonService;
        this.defaultOutput = theDefaultOutput;
        this.defaultLayout = theDefaultLayout;
        this.compareLayouts = theCompareLayouts;
        this.out = theOut;
        this.err = theErr;
    }

    @Override
    public void run(final String... args) {
        try {
            execute(args);
            exitCode = ExitCode.SUCCESS;
        } catch (final DomainException e) {
            exitCode = ExitCode.of(e);
            LOG.debug("Run failed with {}", e.getErrorCode(), e);
            err.println("Error [" + e.getErrorCode() + "]: " + e.getMessage());
        }
    }

    @Override
    public int getExitCode() {
        return exitCode.code();
    }

    /**
     * Returns the status of the last run.
     *
     * @return the exit code
     */
    public ExitCode exitCode() {
        return exitCode;
    }

    private void execute(final String[] args) {
        final CommandLineArguments arguments = CommandLineArguments.parse(
                args, defaultOutput, defaultLayout);

        final DiagramAnalysis analysis =
                analysisService.analyzeFile(arguments.inputFile());

        final RenderOptions options = new RenderOptions(arguments.layout(),
                arguments.minimizeCrossings());
        final Path written = exportService.export(analysis, options,
                arguments.outputFile());

        // Nothing reaches stdout until the diagram is on disk.
        out.println("System with " + analysis.metrics().variableCount()
                + " variables and " + analysis.metrics().relationCount()
                + " relations");
        out.println(arguments.minimizeCrossings()
                ? "Anti-crossing mode ACTIVE"
                : "Anti-crossing mode DISABLED");
        out.println("Diagram saved to: " + written);
        out.println();
        out.print(AnalysisReportFormatter.format(analysis,
                arguments.layout().engineName()));

        if (!arguments.layoutSpecified() && compareLayouts) {
            printComparison(comparisonService.compare(analysis, written,
                    arguments.minimizeCrossings()));
        }
    }

    private void printComparison(final List<ComparisonResult> results) {
        out.println();
        out.println("RECOMMENDATIONS TO MINIMIZE CROSSINGS:");
        out.println("   1. 'sfdp' (scalable force) for the fewest crossings");
        out.println("   2. 'fdp' (force-directed)");
        out.println("   3. optimized 'circo' for smaller diagrams");
        out.println("   4. 'dot' with orthogonal splines for hierarchies");
        out.println();
        out.println("Generated comparison files:");
        for (final ComparisonResult result : results) {
            out.println("   - " + result.file() + " - "
                    + result.layout().description()
                    + (result.optimized() ? " (anti-crossing)" : ""));
        }
        if (results.isEmpty()) {
            out.println("   (none, see log for errors)");
        }
    }

}
