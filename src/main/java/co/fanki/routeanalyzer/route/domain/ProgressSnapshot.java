package co.fanki.routeanalyzer.route.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How far the reader is through the script.
 *
 * @param currentLabel the label reported by the interpreter, may be null
 * @param progressPercentage the share of words already behind, 0 to 100
 * @param estimatedRemainingWords words in labels still reachable
 * @param estimatedReadingTimeMinutes reading time of the remaining words
 * @param totalWords words in the whole script
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ProgressSnapshot(
        @JsonProperty("current_label") String currentLabel,
        @JsonProperty("progress_percentage") double progressPercentage,
        @JsonProperty("estimated_remaining_words")
                long estimatedRemainingWords,
        @JsonProperty("estimated_reading_time_minutes")
                double estimatedReadingTimeMinutes,
        @JsonProperty("total_words") long totalWords) {
}
