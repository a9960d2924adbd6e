package co.fanki.routeanalyzer.route.domain;

import co.fanki.routeanalyzer.shared.Preconditions;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Words per label name, in label declaration order.
 *
 * <p>The total is always the sum of the per-label counts. Serialized as
 * a plain {@code {label: count}} object.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class WordCounts {

    private final Map<String, Integer> counts;

    private final long total;

    /**
     * Creates the counts.
     *
     * @param theCounts label name to non-negative word count
     */
    public WordCounts(final Map<String, Integer> theCounts) {
        Preconditions.requireNonNull(theCounts, "Counts are required");
        long sum = 0;
        for (final Map.Entry<String, Integer> entry : theCounts.entrySet()) {
            Preconditions.requireNonNegative(entry.getValue(),
                    "Word count of " + entry.getKey());
            sum += entry.getValue();
        }
        counts = Collections.unmodifiableMap(new LinkedHashMap<>(theCounts));
        total = sum;
    }

    /** Creates empty counts. */
    public static WordCounts empty() {
        return new WordCounts(Map.of());
    }

    /**
     * Returns the words of one label.
     *
     * @param label the label name
     * @return the count, 0 for unknown labels
     */
    public int of(final String label) {
        return counts.getOrDefault(label, 0);
    }

    /**
     * Sums the words of a set of labels.
     *
     * @param labels the label names, unknown names count as 0
     * @return the sum
     */
    public long sum(final Collection<String> labels) {
        long sum = 0;
        for (final String label : labels) {
            sum += of(label);
        }
        return sum;
    }

    /** Returns the total words of every label. */
    public long total() {
        return total;
    }

    /** Counts the labels carrying at least one word. */
    public int labelsWithContent() {
        return (int) counts.values().stream().filter(c -> c > 0).count();
    }

    @JsonValue
    public Map<String, Integer> asMap() {
        return counts;
    }

    @Override
    public boolean equals(final Object other) {
        return other instanceof WordCounts that && counts.equals(that.counts);
    }

    @Override
    public int hashCode() {
        return counts.hashCode();
    }

    @Override
    public String toString() {
        return counts.toString();
    }

}
