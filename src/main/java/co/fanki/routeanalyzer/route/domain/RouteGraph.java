package co.fanki.routeanalyzer.route.domain;

import co.fanki.routeanalyzer.shared.Preconditions;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

/**
 * Directed graph of the narrative states of a script.
 *
 * <p>Nodes live in an arena indexed by id and keep their discovery order;
 * edges keep insertion order. An edge may point at the reserved
 * {@link #UNKNOWN_NODE_ID} sentinel, which stands for every target that
 * could not be resolved. The sentinel is never stored as a node.</p>
 *
 * <p>The graph is filled by {@link RouteGraphBuilder} and then sealed.
 * Once sealed it rejects further changes, so a graph held by an analysis
 * result can be read from any thread.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonAutoDetect(getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class RouteGraph {

    /** Reserved id for unresolved transfer targets. */
    public static final String UNKNOWN_NODE_ID = "__unknown__";

    /** Maps node id to node, in discovery order. */
    private final Map<String, RouteNode> nodes = new LinkedHashMap<>();

    private final List<RouteEdge> edges = new ArrayList<>();

    /** Maps node id to its outgoing edges. */
    private final Map<String, List<RouteEdge>> outgoing = new HashMap<>();

    /** Maps label name to the id of its first declaration. */
    private final Map<String, String> labelsByName = new HashMap<>();

    private boolean sealed;

    /**
     * Adds a node.
     *
     * @param node the node, its id must not be taken yet
     */
    public void addNode(final RouteNode node) {
        requireOpen();
        Preconditions.requireNonNull(node, "Node is required");
        Preconditions.require(!UNKNOWN_NODE_ID.equals(node.id()),
                "Node id is reserved: " + node.id());
        Preconditions.require(!nodes.containsKey(node.id()),
                "Duplicate node id: " + node.id());

        nodes.put(node.id(), node);
        if (node.isLabel()) {
            labelsByName.putIfAbsent(node.name(), node.id());
        }
    }

    /**
     * Adds an edge.
     *
     * @param edge the edge; its source must be a node of this graph and its
     *        target a node or the unknown sentinel
     */
    public void addEdge(final RouteEdge edge) {
        requireOpen();
        Preconditions.requireNonNull(edge, "Edge is required");
        Preconditions.require(nodes.containsKey(edge.from()),
                "Unknown edge source: " + edge.from());
        Preconditions.require(isEndpoint(edge.to()),
                "Unknown edge target: " + edge.to());

        edges.add(edge);
        outgoing.computeIfAbsent(edge.from(), k -> new ArrayList<>())
                .add(edge);
    }

    /** Rejects any further change. */
    public void seal() {
        sealed = true;
    }

    /**
     * Checks if an id may be used as an edge endpoint.
     *
     * @param id the id to check
     * @return true for node ids and the unknown sentinel
     */
    public boolean isEndpoint(final String id) {
        return UNKNOWN_NODE_ID.equals(id) || nodes.containsKey(id);
    }

    /**
     * Checks if the graph contains a node.
     *
     * @param id the node id
     * @return true if present
     */
    public boolean contains(final String id) {
        return id != null && nodes.containsKey(id);
    }

    /**
     * Returns a node by id.
     *
     * @param id the node id
     * @return the node, or null if absent
     */
    public RouteNode node(final String id) {
        return nodes.get(id);
    }

    /**
     * Finds the node a live execution position refers to.
     *
     * <p>Node ids take precedence, then label names, so both a qualified
     * id and the plain name of a label whose id was disambiguated
     * resolve.</p>
     *
     * @param position the current label reported by the interpreter
     * @return the node, or null when nothing matches
     */
    public RouteNode locate(final String position) {
        if (position == null) {
            return null;
        }
        final RouteNode byId = nodes.get(position);
        if (byId != null) {
            return byId;
        }
        final String id = labelsByName.get(position);
        return id == null ? null : nodes.get(id);
    }

    /**
     * Returns the nodes in discovery order.
     *
     * @return unmodifiable view of the nodes
     */
    @JsonProperty("nodes")
    public Collection<RouteNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    /**
     * Returns the edges in insertion order.
     *
     * @return unmodifiable view of the edges
     */
    @JsonProperty("edges")
    public List<RouteEdge> edges() {
        return Collections.unmodifiableList(edges);
    }

    /**
     * Returns the edges leaving a node.
     *
     * @param id the source node id
     * @return unmodifiable list, empty if none
     */
    public List<RouteEdge> outgoing(final String id) {
        return Collections.unmodifiableList(
                outgoing.getOrDefault(id, List.of()));
    }

    /**
     * Collects every node reachable from a start node, the start included.
     *
     * <p>Breadth-first over all edge kinds with an explicit visited set,
     * so cycles through jump and call back-edges terminate. The unknown
     * sentinel is never part of the result.</p>
     *
     * @param startId the node to start from
     * @return the reachable node ids in visiting order, empty if the start
     *         is not a node
     */
    public Set<String> reachableFrom(final String startId) {
        if (!contains(startId)) {
            return Set.of();
        }

        final Set<String> visited = new LinkedHashSet<>();
        final Queue<String> queue = new ArrayDeque<>();
        visited.add(startId);
        queue.add(startId);

        while (!queue.isEmpty()) {
            final String current = queue.poll();
            for (final RouteEdge edge : outgoing(current)) {
                final String target = edge.to();
                if (nodes.containsKey(target) && visited.add(target)) {
                    queue.add(target);
                }
            }
        }
        return Collections.unmodifiableSet(visited);
    }

    /**
     * Counts nodes of one kind.
     *
     * @param kind the node kind
     * @return the count
     */
    public int count(final NodeKind kind) {
        return (int) nodes.values().stream()
                .filter(n -> n.kind() == kind)
                .count();
    }

    /**
     * Counts edges of one kind.
     *
     * @param kind the edge kind
     * @return the count
     */
    public int count(final EdgeKind kind) {
        return (int) edges.stream()
                .filter(e -> e.kind() == kind)
                .count();
    }

    /**
     * Counts edges leading to the unknown sentinel.
     *
     * @return the count
     */
    public int unresolvedCount() {
        return (int) edges.stream().filter(RouteEdge::isUnresolved).count();
    }

    /**
     * Returns the number of nodes.
     *
     * @return the node count
     */
    public int nodeCount() {
        return nodes.size();
    }

    /**
     * Returns the number of edges.
     *
     * @return the edge count
     */
    public int edgeCount() {
        return edges.size();
    }

    private void requireOpen() {
        if (sealed) {
            throw new IllegalStateException("Route graph is sealed");
        }
    }

}
