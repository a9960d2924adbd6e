package co.fanki.routeanalyzer.route.application;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * State of the analysis cache.
 *
 * @param cached true if a result is committed
 * @param fingerprint the corpus fingerprint the result was built from
 * @param builtAt ISO-8601 instant of the commit, null when empty
 * @param rebuildCount the number of committed rebuilds so far
 * @param rebuilding true while a rebuild holds the writer lock
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CacheStatus(
        @JsonProperty("cached") boolean cached,
        @JsonProperty("fingerprint") String fingerprint,
        @JsonProperty("built_at") String builtAt,
        @JsonProperty("rebuild_count") long rebuildCount,
        @JsonProperty("rebuilding") boolean rebuilding) {
}
