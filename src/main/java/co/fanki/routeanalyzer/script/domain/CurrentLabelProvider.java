package co.fanki.routeanalyzer.script.domain;

import java.util.Optional;

/**
 * Port to the interpreter's live execution position.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface CurrentLabelProvider {

    /**
     * Returns the label the interpreter is currently executing.
     *
     * @return the label name, or empty when nothing is running
     */
    Optional<String> currentLabel();

}
