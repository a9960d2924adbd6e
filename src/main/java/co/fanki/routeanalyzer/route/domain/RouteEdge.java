package co.fanki.routeanalyzer.route.domain;

import co.fanki.routeanalyzer.shared.Preconditions;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A directed control transfer between two nodes.
 *
 * @param from the source node id
 * @param to the target node id, or {@link RouteGraph#UNKNOWN_NODE_ID}
 * @param kind the transfer kind, serialized as {@code type}
 * @param choiceIndex the choice position for choice edges, else null
 * @param choiceText the choice display text for choice edges, else null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RouteEdge(
        String from,
        String to,
        @JsonProperty("type") EdgeKind kind,
        @JsonProperty("choice_index") Integer choiceIndex,
        @JsonProperty("choice_text") String choiceText) {

    /** Compact constructor. */
    public RouteEdge {
        Preconditions.requireNonBlank(from, "Edge source is required");
        Preconditions.requireNonBlank(to, "Edge target is required");
        Preconditions.requireNonNull(kind, "Edge kind is required");
    }

    public static RouteEdge sequence(final String from, final String to) {
        return new RouteEdge(from, to, EdgeKind.SEQUENCE, null, null);
    }

    public static RouteEdge jump(final String from, final String to) {
        return new RouteEdge(from, to, EdgeKind.JUMP, null, null);
    }

    public static RouteEdge call(final String from, final String to) {
        return new RouteEdge(from, to, EdgeKind.CALL, null, null);
    }

    public static RouteEdge choice(final String from, final String to,
            final int index, final String text) {
        return new RouteEdge(from, to, EdgeKind.CHOICE, index, text);
    }

    /**
     * Checks if this edge leads to the unknown sentinel.
     *
     * @return true for unresolved targets
     */
    @JsonIgnore
    public boolean isUnresolved() {
        return RouteGraph.UNKNOWN_NODE_ID.equals(to);
    }

}
