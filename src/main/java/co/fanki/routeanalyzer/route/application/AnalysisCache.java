package co.fanki.routeanalyzer.route.application;

import co.fanki.routeanalyzer.route.domain.AnalysisResult;
import co.fanki.routeanalyzer.route.domain.RouteAnalyzer;
import co.fanki.routeanalyzer.script.domain.StatementSource;
import co.fanki.routeanalyzer.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-slot cache of the latest analysis of one statement source.
 *
 * <p>The slot holds the result together with the corpus fingerprint it
 * was built from and is replaced in one atomic swap, so readers see
 * either the previous or the new complete result. At most one rebuild
 * runs at a time.</p>
 *
 * <p>A caller that does not force a refresh and finds a committed result
 * never waits: if another thread is rebuilding it gets the committed
 * result right away, otherwise the fingerprint decides whether the result
 * is still current. Forcing callers, and callers that find the slot
 * empty, wait for the writer lock. A rebuild that fails leaves the slot
 * untouched, and one overtaken by {@link #invalidate()} is not kept.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class AnalysisCache {

    private static final Logger LOG = LoggerFactory.getLogger(
            AnalysisCache.class);

    /** A committed result. */
    private record Entry(AnalysisResult result, String fingerprint,
            Instant builtAt) {}

    private final AtomicReference<Entry> slot = new AtomicReference<>();

    private final ReentrantLock writer = new ReentrantLock();

    private final AtomicLong rebuildCount = new AtomicLong();

    /** Bumped by every invalidation; a rebuild that saw it move is dropped. */
    private final AtomicLong generation = new AtomicLong();

    private final RouteAnalyzer analyzer;

    private final StatementSource source;

    /**
     * Creates an empty cache.
     *
     * @param theAnalyzer runs the analysis
     * @param theSource the statement source to analyze
     */
    public AnalysisCache(final RouteAnalyzer theAnalyzer,
            final StatementSource theSource) {
        this.analyzer = Preconditions.requireNonNull(theAnalyzer,
                "Route analyzer is required");
        this.source = Preconditions.requireNonNull(theSource,
                "Statement source is required");
    }

    /**
     * Returns the current analysis, rebuilding it when needed.
     *
     * @param forceRefresh rebuild even if the corpus did not change
     * @return the committed analysis
     * @throws co.fanki.routeanalyzer.script.domain
     *         .StatementSourceUnavailableException if the source is down
     */
    public AnalysisResult analyze(final boolean forceRefresh) {
        final Entry cached = slot.get();

        if (!forceRefresh && cached != null) {
            if (!writer.tryLock()) {
                LOG.debug("Rebuild in progress, serving committed analysis");
                return cached.result();
            }
            try {
                return currentOrRebuild();
            } finally {
                writer.unlock();
            }
        }

        writer.lock();
        try {
            if (!forceRefresh) {
                // another caller may have filled the slot while we waited
                return currentOrRebuild();
            }
            return rebuild(source.fingerprint());
        } finally {
            writer.unlock();
        }
    }

    /**
     * Returns the committed analysis without checking the corpus.
     *
     * @return the analysis, or null when the slot is empty
     */
    public AnalysisResult peek() {
        final Entry entry = slot.get();
        return entry == null ? null : entry.result();
    }

    /**
     * Empties the slot; the next call rebuilds. A rebuild already running
     * is returned to its caller but not committed.
     */
    public void invalidate() {
        generation.incrementAndGet();
        slot.set(null);
        LOG.info("Route analysis cache invalidated");
    }

    /** Returns the number of committed rebuilds. */
    public long rebuildCount() {
        return rebuildCount.get();
    }

    /** Returns the state of the cache. */
    public CacheStatus status() {
        final Entry entry = slot.get();
        return new CacheStatus(entry != null,
                entry == null ? null : entry.fingerprint(),
                entry == null ? null : entry.builtAt().toString(),
                rebuildCount.get(), writer.isLocked());
    }

    /** Must be called with the writer lock held. */
    private AnalysisResult currentOrRebuild() {
        final Entry entry = slot.get();
        final String fingerprint = source.fingerprint();
        if (entry != null && entry.fingerprint().equals(fingerprint)) {
            return entry.result();
        }
        if (entry != null) {
            LOG.info("Script corpus changed, rebuilding route analysis");
        }
        return rebuild(fingerprint);
    }

    /** Must be called with the writer lock held. */
    private AnalysisResult rebuild(final String fingerprint) {
        LOG.info("Rebuilding route analysis");
        final long started = generation.get();
        final AnalysisResult result = analyzer.analyze(source);

        final Entry entry = new Entry(result, fingerprint, Instant.now());
        slot.set(entry);
        if (generation.get() != started) {
            slot.compareAndSet(entry, null);
            LOG.info("Cache invalidated during rebuild, result not committed");
            return result;
        }
        final long count = rebuildCount.incrementAndGet();
        LOG.info("Route analysis committed (rebuild #{})", count);
        return result;
    }

}
