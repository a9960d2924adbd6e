package co.fanki.routeanalyzer.route.domain;

import co.fanki.routeanalyzer.shared.Preconditions;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The complete, immutable product of one analysis.
 *
 * @param routeGraph the sealed route graph
 * @param wordCounts words per label name
 * @param choiceRequirements choice id to requirement, guarded choices only
 * @param metadata aggregate counts
 * @param partial true if some file could not be tokenized
 * @param failedFiles the files that could not be tokenized
 * @param analyzedAt ISO-8601 instant the analysis finished
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record AnalysisResult(
        @JsonProperty("route_graph") RouteGraph routeGraph,
        @JsonProperty("word_counts") WordCounts wordCounts,
        @JsonProperty("choice_requirements")
                Map<String, Requirement> choiceRequirements,
        @JsonProperty("metadata") AnalysisMetadata metadata,
        @JsonProperty("partial") boolean partial,
        @JsonProperty("failed_files") List<String> failedFiles,
        @JsonProperty("analyzed_at") String analyzedAt) {

    /** Compact constructor. */
    public AnalysisResult {
        Preconditions.requireNonNull(routeGraph, "Route graph is required");
        Preconditions.requireNonNull(wordCounts, "Word counts are required");
        Preconditions.requireNonNull(metadata, "Metadata is required");
        choiceRequirements = choiceRequirements == null
                ? Map.of()
                : Collections.unmodifiableMap(
                        new LinkedHashMap<>(choiceRequirements));
        failedFiles = failedFiles == null ? List.of()
                : List.copyOf(failedFiles);
    }

}
