package co.fanki.routeanalyzer.route.domain;

import co.fanki.routeanalyzer.shared.Preconditions;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A node of the route graph: a label or a menu.
 *
 * @param id the id, unique within its graph
 * @param kind the node kind, serialized as {@code type}
 * @param name the label name, or a display name for menus
 * @param filename the script file declaring the node
 * @param line the 1-based line of the declaration
 * @param choices the menu entries, null for labels
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RouteNode(
        String id,
        @JsonProperty("type") NodeKind kind,
        String name,
        String filename,
        int line,
        List<Choice> choices) {

    /** Compact constructor. */
    public RouteNode {
        Preconditions.requireNonBlank(id, "Node id is required");
        Preconditions.requireNonNull(kind, "Node kind is required");
        Preconditions.require(kind == NodeKind.MENU || choices == null,
                "Only menus carry choices");
        if (kind == NodeKind.MENU) {
            choices = choices == null ? List.of() : List.copyOf(choices);
        }
    }

    /**
     * Creates a label node.
     *
     * @param id the node id
     * @param name the qualified label name
     * @param filename the declaring file
     * @param line the declaration line
     * @return the node
     */
    public static RouteNode label(final String id, final String name,
            final String filename, final int line) {
        return new RouteNode(id, NodeKind.LABEL, name, filename, line, null);
    }

    /**
     * Creates a menu node.
     *
     * @param id the synthesized menu id
     * @param parentLabel the name of the enclosing label
     * @param filename the declaring file
     * @param line the declaration line
     * @param choices the menu entries
     * @return the node
     */
    public static RouteNode menu(final String id, final String parentLabel,
            final String filename, final int line,
            final List<Choice> choices) {
        return new RouteNode(id, NodeKind.MENU, "Choice at " + parentLabel,
                filename, line, choices);
    }

    /** Checks if this node is a label. */
    @JsonIgnore
    public boolean isLabel() {
        return kind == NodeKind.LABEL;
    }

}
