package co.fanki.cld.analysis.domain;

import co.fanki.cld.notation.domain.Polarity;
import co.fanki.cld.notation.domain.Relation;
import co.fanki.cld.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable directed multigraph of variables and signed influences.
 *
 * <p>Nodes are kept in order of first appearance and influences in
 * declaration order. Influences are stored as a list of records, not as a
 * map keyed by node pair, so parallel relations and self-loops survive
 * construction. Nothing is added or removed once the graph is built.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CausalGraph {

    /** All variables, in order of first appearance. */
    private final Set<String> nodes;

    /** All influences, in declaration order. */
    private final List<Influence> influences;

    /** Maps a variable to its outgoing influences. */
    private final Map<String, List<Influence>> outgoing;

    /** Maps a variable to its incoming influences. */
    private final Map<String, List<Influence>> incoming;

    private CausalGraph(final Set<String> theNodes,
            final List<Influence> theInfluences) {
        this.nodes = Collections.unmodifiableSet(theNodes);
        this.influences = Collections.unmodifiableList(theInfluences);

        final Map<String, List<Influence>> out = new LinkedHashMap<>();
        final Map<String, List<Influence>> in = new LinkedHashMap<>();
        for (final String node : theNodes) {
            out.put(node, new ArrayList<>());
            in.put(node, new ArrayList<>());
        }
        for (final Influence influence : theInfluences) {
            out.get(influence.source()).add(influence);
            in.get(influence.destination()).add(influence);
        }
        out.replaceAll((k, v) -> Collections.unmodifiableList(v));
        in.replaceAll((k, v) -> Collections.unmodifiableList(v));
        this.outgoing = Collections.unmodifiableMap(out);
        this.incoming = Collections.unmodifiableMap(in);
    }

    /**
     * Builds the graph from parsed relations.
     *
     * <p>Every identifier mentioned by a relation becomes a node.</p>
     *
     * @param relations the relations in declaration order
     * @return the graph
     */
    public static CausalGraph fromRelations(final List<Relation> relations) {
        Preconditions.requireNonNull(relations, "Relations are required");

        final Set<String> theNodes = new LinkedHashSet<>();
        final List<Influence> theInfluences = new ArrayList<>();
        for (final Relation relation : relations) {
            theNodes.add(relation.source());
            theNodes.add(relation.destination());
            theInfluences.add(new Influence(theInfluences.size(),
                    relation.source(), relation.destination(),
                    relation.polarity()));
        }
        return new CausalGraph(theNodes, theInfluences);
    }

    /**
     * Returns all variables, in order of first appearance.
     *
     * @return unmodifiable set of identifiers
     */
    public Set<String> nodes() {
        return nodes;
    }

    /**
     * Returns all influences, in declaration order.
     *
     * @return unmodifiable list of influences
     */
    public List<Influence> influences() {
        return influences;
    }

    /**
     * Checks if the given variable is part of the graph.
     *
     * @param identifier the variable identifier
     * @return true if the graph contains it
     */
    public boolean contains(final String identifier) {
        return identifier != null && nodes.contains(identifier);
    }

    /**
     * Returns the influences leaving a variable.
     *
     * @param identifier the variable identifier
     * @return unmodifiable list in declaration order, empty if unknown
     */
    public List<Influence> outgoing(final String identifier) {
        if (identifier == null) {
            return List.of();
        }
        return outgoing.getOrDefault(identifier, List.of());
    }

    /**
     * Returns the influences arriving at a variable.
     *
     * @param identifier the variable identifier
     * @return unmodifiable list in declaration order, empty if unknown
     */
    public List<Influence> incoming(final String identifier) {
        if (identifier == null) {
            return List.of();
        }
        return incoming.getOrDefault(identifier, List.of());
    }

    /**
     * Returns the distinct variables this one directly influences.
     *
     * @param identifier the variable identifier
     * @return unmodifiable set of successors, empty if unknown
     */
    public Set<String> successors(final String identifier) {
        final Set<String> result = new LinkedHashSet<>();
        for (final Influence influence : outgoing(identifier)) {
            result.add(influence.destination());
        }
        return Collections.unmodifiableSet(result);
    }

    /**
     * Returns the distinct variables that directly influence this one.
     *
     * @param identifier the variable identifier
     * @return unmodifiable set of predecessors, empty if unknown
     */
    public Set<String> predecessors(final String identifier) {
        final Set<String> result = new LinkedHashSet<>();
        for (final Influence influence : incoming(identifier)) {
            result.add(influence.source());
        }
        return Collections.unmodifiableSet(result);
    }

    /** Number of incoming influences, parallel ones counted separately. */
    public int inDegree(final String identifier) {
        return incoming(identifier).size();
    }

    /** Number of outgoing influences, parallel ones counted separately. */
    public int outDegree(final String identifier) {
        return outgoing(identifier).size();
    }

    /**
     * Looks up the polarity of an influence by declaration index.
     *
     * @param index the influence index
     * @return the polarity
     * @throws IllegalArgumentException if no influence has that index
     */
    public Polarity polarityOf(final int index) {
        Preconditions.require(index >= 0 && index < influences.size(),
                "No influence with index " + index);
        return influences.get(index).polarity();
    }

    /**
     * Returns the number of variables.
     *
     * @return the node count
     */
    public int nodeCount() {
        return nodes.size();
    }

    /**
     * Returns the number of influences.
     *
     * @return the edge count
     */
    public int influenceCount() {
        return influences.size();
    }

    /**
     * Checks if the graph has no influences at all.
     *
     * @return true if empty
     */
    public boolean isEmpty() {
        return influences.isEmpty();
    }

}
