package co.fanki.routeanalyzer.route.application;

import co.fanki.routeanalyzer.route.domain.AnalysisMetadata;
import co.fanki.routeanalyzer.route.domain.AnalysisResult;
import co.fanki.routeanalyzer.route.domain.ProgressSnapshot;
import co.fanki.routeanalyzer.route.domain.ProgressTracker;
import co.fanki.routeanalyzer.route.domain.ReadingSpeed;
import co.fanki.routeanalyzer.route.domain.Requirement;
import co.fanki.routeanalyzer.route.domain.RouteGraph;
import co.fanki.routeanalyzer.script.domain.CurrentLabelProvider;
import co.fanki.routeanalyzer.script.domain.InMemoryCurrentLabelProvider;
import co.fanki.routeanalyzer.script.domain.StatementSourceUnavailableException;
import co.fanki.routeanalyzer.shared.DomainException;
import co.fanki.routeanalyzer.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationStartedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Query façade over the route analysis of the configured script.
 *
 * <p>Every query is answered from the {@link AnalysisCache}; only
 * {@link #analyze(boolean)} and {@link #getWordCounts(boolean)} can ask
 * for a forced rebuild. A statement source that is unavailable is the
 * only failure callers see, it propagates unchanged.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class RouteAnalysisService {

    private static final Logger LOG = LoggerFactory.getLogger(
            RouteAnalysisService.class);

    private final AnalysisCache cache;

    private final ProgressTracker progressTracker;

    private final CurrentLabelProvider currentLabelProvider;

    private final ReadingSpeed readingSpeed;

    private final boolean warmUp;

    /**
     * Creates a new RouteAnalysisService.
     *
     * @param theCache the analysis cache
     * @param theProgressTracker computes progress snapshots
     * @param theCurrentLabelProvider reports the interpreter position
     * @param theReadingSpeed converts words into minutes
     * @param theWarmUp whether to analyze once at startup
     */
    public RouteAnalysisService(final AnalysisCache theCache,
            final ProgressTracker theProgressTracker,
            final CurrentLabelProvider theCurrentLabelProvider,
            final ReadingSpeed theReadingSpeed,
            @Value("${route.warm-up:true}") final boolean theWarmUp) {
        this.cache = Preconditions.requireNonNull(theCache,
                "Analysis cache is required");
        this.progressTracker = Preconditions.requireNonNull(
                theProgressTracker, "Progress tracker is required");
        this.currentLabelProvider = Preconditions.requireNonNull(
                theCurrentLabelProvider, "Current label provider is required");
        this.readingSpeed = Preconditions.requireNonNull(theReadingSpeed,
                "Reading speed is required");
        this.warmUp = theWarmUp;
    }

    /**
     * Analyzes the script once the application is started, so the first
     * query finds the cache filled.
     */
    @EventListener(ApplicationStartedEvent.class)
    public void warmUp() {
        if (!warmUp) {
            return;
        }
        try {
            final AnalysisResult result = cache.analyze(false);
            LOG.info("Route analysis warmed up: {} nodes, {} edges",
                    result.routeGraph().nodeCount(),
                    result.routeGraph().edgeCount());
        } catch (final StatementSourceUnavailableException e) {
            LOG.warn("Route analysis warm-up skipped: {}", e.getMessage());
        }
    }

    /**
     * Returns the full analysis.
     *
     * @param forceRefresh rebuild even if the script did not change
     * @return the analysis result
     */
    public AnalysisResult analyze(final boolean forceRefresh) {
        return cache.analyze(forceRefresh);
    }

    /** Returns the route graph of the current analysis. */
    public RouteGraph getRouteGraph() {
        return cache.analyze(false).routeGraph();
    }

    /** Returns the progress at the interpreter's current label. */
    public ProgressSnapshot getProgress() {
        final AnalysisResult result = cache.analyze(false);
        return progressTracker.track(result,
                currentLabelProvider.currentLabel().orElse(null));
    }

    /**
     * Returns the word counts with their total and reading time.
     *
     * @param forceRefresh rebuild even if the script did not change
     * @return word_counts, total_words, estimated_reading_time_minutes,
     *         labels_with_content and cache_refreshed
     */
    public Map<String, Object> getWordCounts(final boolean forceRefresh) {
        final long before = cache.rebuildCount();
        final AnalysisResult result = cache.analyze(forceRefresh);
        final long total = result.wordCounts().total();

        final Map<String, Object> response = new LinkedHashMap<>();
        response.put("word_counts", result.wordCounts());
        response.put("total_words", total);
        response.put("estimated_reading_time_minutes",
                readingSpeed.minutes(total));
        response.put("labels_with_content",
                result.wordCounts().labelsWithContent());
        response.put("cache_refreshed", cache.rebuildCount() != before);
        return response;
    }

    /** Returns the word counts without refreshing. */
    public Map<String, Object> getWordCounts() {
        return getWordCounts(false);
    }

    /**
     * Returns the requirements of the guarded choices.
     *
     * @return choice_requirements keyed by choice id,
     *         requirements_by_menu grouping the choice ids per menu, and
     *         total_conditional_choices
     */
    public Map<String, Object> getChoiceRequirements() {
        final Map<String, Requirement> requirements =
                cache.analyze(false).choiceRequirements();

        final Map<String, List<String>> byMenu = new LinkedHashMap<>();
        for (final Requirement requirement : requirements.values()) {
            byMenu.computeIfAbsent(requirement.menuId(),
                    k -> new ArrayList<>()).add(requirement.choiceId());
        }

        final Map<String, Object> response = new LinkedHashMap<>();
        response.put("choice_requirements", requirements);
        response.put("requirements_by_menu", byMenu);
        response.put("total_conditional_choices", requirements.size());
        return response;
    }

    /** Returns the aggregate counts and the total reading time. */
    public Map<String, Object> getSummary() {
        final AnalysisResult result = cache.analyze(false);
        final AnalysisMetadata metadata = result.metadata();

        final Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total_labels", metadata.totalLabels());
        summary.put("total_menus", metadata.totalMenus());
        summary.put("total_choices", metadata.totalChoices());
        summary.put("total_jumps", metadata.totalJumps());
        summary.put("total_calls", metadata.totalCalls());
        summary.put("total_unresolved", metadata.totalUnresolved());
        summary.put("total_words", metadata.totalWords());
        summary.put("estimated_reading_time_minutes",
                readingSpeed.minutes(metadata.totalWords()));
        summary.put("nodes_count", result.routeGraph().nodeCount());
        summary.put("edges_count", result.routeGraph().edgeCount());
        summary.put("partial", result.partial());
        return summary;
    }

    /** Drops the cached analysis. */
    public void invalidateCache() {
        cache.invalidate();
    }

    /** Returns the state of the analysis cache. */
    public CacheStatus getCacheStatus() {
        return cache.status();
    }

    /**
     * Records the interpreter's new position.
     *
     * @param label the label entered, blank clears the position
     * @throws DomainException if the position is not settable
     */
    public void moveTo(final String label) {
        if (!(currentLabelProvider
                instanceof InMemoryCurrentLabelProvider provider)) {
            throw new DomainException(
                    "Current label is reported by the interpreter",
                    "POSITION_READ_ONLY");
        }
        provider.moveTo(label);
    }

}
