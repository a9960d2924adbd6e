package co.fanki.routeanalyzer.route.domain;

import co.fanki.routeanalyzer.script.domain.Statement;

import java.util.List;

/**
 * A label found while scanning the script, before its body is walked.
 *
 * @param id the node id, the qualified name unless it collided
 * @param name the qualified label name
 * @param scope the global label that local targets ({@code .x}) are
 *        qualified with
 * @param filename the declaring file
 * @param line the declaration line
 * @param body the label's top-level statements
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record LabelDeclaration(
        String id,
        String name,
        String scope,
        String filename,
        int line,
        List<Statement> body) {

    /**
     * Qualifies a jump or call target written inside this label.
     *
     * @param target the target as written
     * @return the qualified target name
     */
    public String qualify(final String target) {
        return target.startsWith(".") ? scope + target : target;
    }

}
