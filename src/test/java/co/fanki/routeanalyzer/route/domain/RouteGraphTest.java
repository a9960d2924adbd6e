package co.fanki.routeanalyzer.route.domain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link RouteGraph}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class RouteGraphTest {

    private RouteGraph graph;

    @BeforeEach
    void setUp() {
        graph = new RouteGraph();
        graph.addNode(RouteNode.label("start", "start", "script.rpy", 1));
        graph.addNode(RouteNode.label("middle", "middle", "script.rpy", 5));
        graph.addNode(RouteNode.label("end", "end", "script.rpy", 9));
        graph.addNode(RouteNode.label("unused", "unused", "script.rpy", 12));
    }

    @Test
    void whenTraversing_givenCycle_shouldTerminateAndVisitEachNodeOnce() {
        graph.addEdge(RouteEdge.sequence("start", "middle"));
        graph.addEdge(RouteEdge.jump("middle", "start"));
        graph.addEdge(RouteEdge.call("middle", "end"));
        graph.addEdge(RouteEdge.jump("end", "middle"));
        graph.seal();

        final Set<String> reachable = graph.reachableFrom("start");

        assertEquals(List.of("start", "middle", "end"),
                List.copyOf(reachable));
    }

    @Test
    void whenTraversing_givenUnknownTarget_shouldSkipSentinel() {
        graph.addEdge(RouteEdge.jump("start", RouteGraph.UNKNOWN_NODE_ID));
        graph.seal();

        assertEquals(Set.of("start"), graph.reachableFrom("start"));
        assertEquals(1, graph.unresolvedCount());
    }

    @Test
    void whenTraversing_givenUnknownStart_shouldReturnEmpty() {
        assertTrue(graph.reachableFrom("nowhere").isEmpty());
    }

    @Test
    void whenAddingEdge_givenUndeclaredTarget_shouldReject() {
        assertThrows(IllegalArgumentException.class,
                () -> graph.addEdge(RouteEdge.jump("start", "ghost")));
    }

    @Test
    void whenAddingNode_givenDuplicateOrReservedId_shouldReject() {
        assertThrows(IllegalArgumentException.class, () -> graph.addNode(
                RouteNode.label("start", "start", "other.rpy", 1)));
        assertThrows(IllegalArgumentException.class, () -> graph.addNode(
                RouteNode.label(RouteGraph.UNKNOWN_NODE_ID, "x", "a.rpy", 1)));
    }

    @Test
    void whenMutating_givenSealedGraph_shouldThrow() {
        graph.seal();

        assertThrows(IllegalStateException.class,
                () -> graph.addEdge(RouteEdge.sequence("start", "end")));
    }

    @Test
    void whenLocating_givenIdOrLabelName_shouldFindNode() {
        graph.addNode(RouteNode.label("start@other.rpy:3", "start",
                "other.rpy", 3));

        assertEquals("start@other.rpy:3",
                graph.locate("start@other.rpy:3").id());
        assertEquals("start", graph.locate("start").id());
        assertNull(graph.locate("missing"));
        assertNull(graph.locate(null));
    }

    @Test
    void whenCounting_givenMixedEdges_shouldCountByKind() {
        graph.addNode(RouteNode.menu("start_menu_1", "start", "script.rpy", 2,
                List.of(new Choice(0, "Go", null, "middle"))));
        graph.addEdge(RouteEdge.sequence("start", "start_menu_1"));
        graph.addEdge(RouteEdge.choice("start_menu_1", "middle", 0, "Go"));
        graph.addEdge(RouteEdge.jump("middle", "end"));

        assertEquals(4, graph.count(NodeKind.LABEL));
        assertEquals(1, graph.count(NodeKind.MENU));
        assertEquals(1, graph.count(EdgeKind.CHOICE));
        assertEquals(1, graph.count(EdgeKind.JUMP));
        assertEquals(3, graph.edgeCount());
        assertEquals(3, graph.outgoing("start").size()
                + graph.outgoing("start_menu_1").size()
                + graph.outgoing("middle").size());
    }

}
