package co.fanki.routeanalyzer.route.domain;

import co.fanki.routeanalyzer.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Estimates reading progress from the interpreter's current label.
 *
 * <p>Every label reachable from the current position, the current label
 * included, counts as still to be read, whether or not the branches
 * leading there exclude each other. The estimate therefore errs on the
 * side of more remaining words in heavily branching scripts.</p>
 *
 * <p>Reads only the committed analysis result and never mutates it.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ProgressTracker {

    private static final Logger LOG = LoggerFactory.getLogger(
            ProgressTracker.class);

    private final ReadingSpeed readingSpeed;

    /**
     * Creates a tracker.
     *
     * @param theReadingSpeed the speed remaining words are read at
     */
    public ProgressTracker(final ReadingSpeed theReadingSpeed) {
        readingSpeed = Preconditions.requireNonNull(theReadingSpeed,
                "Reading speed is required");
    }

    /**
     * Computes a progress snapshot.
     *
     * @param result the committed analysis
     * @param currentLabel the current label, null when unknown
     * @return the snapshot; zero progress when the label is not in the
     *         graph
     */
    public ProgressSnapshot track(final AnalysisResult result,
            final String currentLabel) {
        Preconditions.requireNonNull(result, "Analysis result is required");

        final WordCounts counts = result.wordCounts();
        final long total = counts.total();
        final RouteNode start = result.routeGraph().locate(currentLabel);

        if (start == null) {
            if (currentLabel != null) {
                LOG.debug("Current label {} is not in the route graph",
                        currentLabel);
            }
            return new ProgressSnapshot(currentLabel, 0.0, total,
                    readingSpeed.minutes(total), total);
        }

        final Set<String> labels = new LinkedHashSet<>();
        for (final String id : result.routeGraph().reachableFrom(start.id())) {
            final RouteNode node = result.routeGraph().node(id);
            if (node.isLabel()) {
                labels.add(node.name());
            }
        }

        final long remaining = counts.sum(labels);
        return new ProgressSnapshot(currentLabel,
                percentage(total, remaining), remaining,
                readingSpeed.minutes(remaining), total);
    }

    private static double percentage(final long total, final long remaining) {
        if (total == 0) {
            return 0.0;
        }
        final double raw = 100.0 * (total - remaining) / total;
        return ReadingSpeed.round(Math.max(0.0, Math.min(100.0, raw)), 2);
    }

}
