package co.fanki.routeanalyzer.route.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregate counts of one analysis.
 *
 * @param totalLabels label nodes
 * @param totalMenus menu nodes
 * @param totalChoices choice entries across every menu
 * @param totalJumps jump edges, unresolved ones included
 * @param totalCalls call edges, unresolved ones included
 * @param totalUnresolved edges leading to the unknown sentinel
 * @param totalWords the sum of the per-label word counts
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record AnalysisMetadata(
        @JsonProperty("total_labels") int totalLabels,
        @JsonProperty("total_menus") int totalMenus,
        @JsonProperty("total_choices") int totalChoices,
        @JsonProperty("total_jumps") int totalJumps,
        @JsonProperty("total_calls") int totalCalls,
        @JsonProperty("total_unresolved") int totalUnresolved,
        @JsonProperty("total_words") long totalWords) {

    /**
     * Derives the metadata of a graph and its word counts.
     *
     * @param graph the route graph
     * @param wordCounts the word counts of the same analysis
     * @return the metadata
     */
    public static AnalysisMetadata of(final RouteGraph graph,
            final WordCounts wordCounts) {
        final int choices = graph.nodes().stream()
                .filter(n -> !n.isLabel())
                .mapToInt(n -> n.choices().size())
                .sum();
        return new AnalysisMetadata(
                graph.count(NodeKind.LABEL),
                graph.count(NodeKind.MENU),
                choices,
                graph.count(EdgeKind.JUMP),
                graph.count(EdgeKind.CALL),
                graph.unresolvedCount(),
                wordCounts.total());
    }

}
