package co.fanki.routeanalyzer.script.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Current label pushed in from outside, typically by the interpreter
 * reporting each label it enters through the REST layer.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class InMemoryCurrentLabelProvider implements CurrentLabelProvider {

    private static final Logger LOG = LoggerFactory.getLogger(
            InMemoryCurrentLabelProvider.class);

    private final AtomicReference<String> current = new AtomicReference<>();

    /** {@inheritDoc} */
    @Override
    public Optional<String> currentLabel() {
        return Optional.ofNullable(current.get());
    }

    /**
     * Records a new execution position.
     *
     * @param label the label entered, blank or null clears the position
     */
    public void moveTo(final String label) {
        if (label == null || label.isBlank()) {
            clear();
            return;
        }
        LOG.debug("Current label is now {}", label);
        current.set(label.trim());
    }

    /** Forgets the execution position. */
    public void clear() {
        LOG.debug("Current label cleared");
        current.set(null);
    }

}
