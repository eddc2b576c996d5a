package co.fanki.cld;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Causal Loop Diagram analyzer.
 *
 * <p>Reads a file of signed causal relations, finds and classifies its
 * feedback loops, ranks its variables by connectivity and renders the
 * diagram through Graphviz. The process exits with the status of the
 * command line run.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class CausalLoopDiagramApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        System.exit(SpringApplication.exit(
                SpringApplication.run(CausalLoopDiagramApplication.class,
                        args)));
    }

}
