package co.fanki.routeanalyzer.script.domain;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Statement source over script text held in memory, for tests.
 *
 * <p>Files are tokenized with {@link RpyStatementSource#parse}. The
 * fingerprint changes on every {@link #put}. A source can be told to
 * block its next load until released, to hold a rebuild in flight.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class InMemoryStatementSource implements StatementSource {

    private final Map<String, String> files = new LinkedHashMap<>();

    private final AtomicInteger version = new AtomicInteger();

    private final AtomicInteger loads = new AtomicInteger();

    private volatile boolean available = true;

    private volatile CountDownLatch entered;

    private volatile CountDownLatch release;

    /**
     * Adds or replaces a file.
     *
     * @param filename the file name
     * @param content the script text
     * @return this source
     */
    public InMemoryStatementSource put(final String filename,
            final String content) {
        files.put(filename, content);
        version.incrementAndGet();
        return this;
    }

    /**
     * Makes the source fail as a whole.
     *
     * @param isAvailable false to fail every call
     */
    public void available(final boolean isAvailable) {
        available = isAvailable;
    }

    /**
     * Blocks the next file load until {@link #release()} is called.
     *
     * @return a latch counted down once a load is blocked
     */
    public CountDownLatch blockNextLoad() {
        entered = new CountDownLatch(1);
        release = new CountDownLatch(1);
        return entered;
    }

    /** Lets a blocked load continue. */
    public void release() {
        release.countDown();
    }

    /** Returns how many files were loaded so far. */
    public int loads() {
        return loads.get();
    }

    @Override
    public List<String> filenames() {
        requireAvailable();
        return new ArrayList<>(files.keySet());
    }

    @Override
    public List<Statement> statements(final String filename)
            throws ScriptParseException {
        requireAvailable();
        loads.incrementAndGet();
        awaitRelease();
        return RpyStatementSource.parse(filename,
                List.of(files.get(filename).split("\n", -1)));
    }

    @Override
    public String fingerprint() {
        requireAvailable();
        return "v" + version.get();
    }

    private void requireAvailable() {
        if (!available) {
            throw new StatementSourceUnavailableException(
                    "Script store is offline");
        }
    }

    private void awaitRelease() {
        final CountDownLatch gate = release;
        if (gate == null) {
            return;
        }
        entered.countDown();
        try {
            if (!gate.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("Load was never released");
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while blocked", e);
        } finally {
            release = null;
        }
    }

}
