package co.fanki.routeanalyzer.route.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One entry of a menu node.
 *
 * @param index the position of the choice inside its menu, 0-based
 * @param text the display text as written in the script
 * @param condition the raw guard expression, null when unguarded
 * @param target the id of the node the choice leads to, null when the
 *        choice ends the flow
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Choice(int index, String text, String condition,
        String target) {

    /**
     * Checks if the choice carries a guard.
     *
     * @return true when a condition is present
     */
    @JsonIgnore
    public boolean isGuarded() {
        return condition != null;
    }

}
