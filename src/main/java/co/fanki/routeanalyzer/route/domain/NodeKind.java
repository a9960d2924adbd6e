package co.fanki.routeanalyzer.route.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of nodes in a {@link RouteGraph}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum NodeKind {

    /** A named entry point of the script. */
    LABEL("label"),

    /** A choice point inside a label. */
    MENU("menu");

    private final String wireName;

    NodeKind(final String theWireName) {
        this.wireName = theWireName;
    }

    /**
     * Returns the name used in serialized graphs.
     *
     * @return the lower-case wire name
     */
    @JsonValue
    public String wireName() {
        return wireName;
    }

}
