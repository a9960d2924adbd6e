package co.fanki.routeanalyzer.route.domain;

import co.fanki.routeanalyzer.shared.Preconditions;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * What a guarded choice needs to become available.
 *
 * <p>Built by {@link ConditionParser} from the raw guard text. A guard
 * that cannot be lexed is kept verbatim with {@code malformed} set and
 * nothing else filled in.</p>
 *
 * @param menuId the menu owning the choice
 * @param choiceIndex the choice position inside the menu
 * @param choiceText the choice display text
 * @param rawCondition the guard as written
 * @param referencedVariables the variables the guard reads, in order of
 *        first appearance, without duplicates
 * @param operator the comparison operator of a single-comparison guard
 * @param comparedValue the right-hand side of that comparison
 * @param booleanConnectors the top-level {@code and}, {@code or} and
 *        {@code not} keywords, left to right
 * @param malformed true if the guard could not be lexed
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Requirement(
        @JsonProperty("menu_id") String menuId,
        @JsonProperty("choice_index") int choiceIndex,
        @JsonProperty("choice_text") String choiceText,
        @JsonProperty("raw_condition") String rawCondition,
        @JsonProperty("referenced_variables") List<String> referencedVariables,
        @JsonProperty("operator") String operator,
        @JsonProperty("compared_value") String comparedValue,
        @JsonProperty("boolean_connectors") List<String> booleanConnectors,
        @JsonProperty("malformed") boolean malformed) {

    /** Compact constructor. */
    public Requirement {
        Preconditions.requireNonBlank(menuId, "Menu id is required");
        Preconditions.requireNonNull(rawCondition, "Condition is required");
        referencedVariables = referencedVariables == null
                ? List.of() : List.copyOf(referencedVariables);
        booleanConnectors = booleanConnectors == null
                ? List.of() : List.copyOf(booleanConnectors);
    }

    /**
     * Creates the requirement of a guard that could not be lexed.
     *
     * @param menuId the menu id
     * @param choiceIndex the choice position
     * @param choiceText the choice text
     * @param rawCondition the guard as written
     * @return a raw-only requirement
     */
    public static Requirement malformed(final String menuId,
            final int choiceIndex, final String choiceText,
            final String rawCondition) {
        return new Requirement(menuId, choiceIndex, choiceText, rawCondition,
                List.of(), null, null, List.of(), true);
    }

    /**
     * Builds the identifier of a choice.
     *
     * @param menuId the menu id
     * @param choiceIndex the choice position
     * @return {@code <menuId>_choice_<index>}
     */
    public static String choiceId(final String menuId,
            final int choiceIndex) {
        return menuId + "_choice_" + choiceIndex;
    }

    /** Returns the identifier of the guarded choice. */
    @JsonIgnore
    public String choiceId() {
        return choiceId(menuId, choiceIndex);
    }

}
