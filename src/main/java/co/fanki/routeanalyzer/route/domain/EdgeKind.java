package co.fanki.routeanalyzer.route.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of control transfer modeled by a {@link RouteEdge}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum EdgeKind {

    /** Textual fall-through between consecutive nodes. */
    SEQUENCE("sequence"),

    /** A menu choice leading to its target. */
    CHOICE("choice"),

    /** Unconditional transfer without return. */
    JUMP("jump"),

    /** Forward part of a call; the return is not modeled. */
    CALL("call");

    private final String wireName;

    EdgeKind(final String theWireName) {
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
