package co.fanki.cld.analysis.domain;

import co.fanki.cld.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Enumerates the elementary feedback loops of a {@link CausalGraph}.
 *
 * <p>Runs a depth-first search from every variable, in ascending
 * identifier order. A search rooted at {@code s} only steps into
 * variables greater than {@code s} that are not already on the current
 * path, and records a loop whenever an influence leads back to {@code s}.
 * Every cycle is therefore found exactly once, starting at its smallest
 * variable, and no rotation of it is ever reported.</p>
 *
 * <p>The search walks influence records rather than neighbor nodes, so
 * parallel influences along the same node sequence yield distinct loops.
 * The stack is explicit to stay clear of recursion depth limits.</p>
 *
 * <p>Loops are reported by ascending starting variable, then in the
 * declaration order of the influences explored.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class LoopDetector {

    private static final Logger LOG = LoggerFactory.getLogger(
            LoopDetector.class);

    private final LoopClassifier classifier;

    /**
     * Creates a new LoopDetector.
     *
     * @param theClassifier classifies each loop as it is found
     */
    public LoopDetector(final LoopClassifier theClassifier) {
        this.classifier = Preconditions.requireNonNull(theClassifier,
                "Loop classifier is required");
    }

    /**
     * Finds every elementary cycle of the graph.
     *
     * @param graph the causal graph
     * @return unmodifiable list of classified loops, empty if acyclic
     */
    public List<FeedbackLoop> detect(final CausalGraph graph) {
        Preconditions.requireNonNull(graph, "Graph is required");

        final List<String> roots = new ArrayList<>(graph.nodes());
        Collections.sort(roots);

        final List<FeedbackLoop> loops = new ArrayList<>();
        for (final String root : roots) {
            searchFrom(graph, root, loops);
        }

        LOG.debug("Detected {} loops over {} variables", loops.size(),
                graph.nodeCount());
        return Collections.unmodifiableList(loops);
    }

    private void searchFrom(final CausalGraph graph, final String root,
            final List<FeedbackLoop> loops) {

        final Deque<Frame> stack = new ArrayDeque<>();
        final List<String> pathNodes = new ArrayList<>();
        final List<Influence> pathInfluences = new ArrayList<>();
        final Set<String> onPath = new HashSet<>();

        stack.push(new Frame(root, graph.outgoing(root).iterator()));
        pathNodes.add(root);
        onPath.add(root);

        while (!stack.isEmpty()) {
            final Frame frame = stack.peek();

            if (!frame.remaining().hasNext()) {
                stack.pop();
                onPath.remove(frame.node());
                pathNodes.remove(pathNodes.size() - 1);
                if (!pathInfluences.isEmpty()) {
                    pathInfluences.remove(pathInfluences.size() - 1);
                }
                continue;
            }

            final Influence influence = frame.remaining().next();
            final String next = influence.destination();

            if (next.equals(root)) {
                final List<Influence> traversed =
                        new ArrayList<>(pathInfluences);
                traversed.add(influence);
                loops.add(classifier.toLoop(pathNodes, traversed));
            } else if (next.compareTo(root) > 0 && !onPath.contains(next)) {
                pathInfluences.add(influence);
                pathNodes.add(next);
                onPath.add(next);
                stack.push(new Frame(next, graph.outgoing(next).iterator()));
            }
        }
    }

    /** A variable on the current path and the influences left to try. */
    private record Frame(String node, Iterator<Influence> remaining) {}

}
