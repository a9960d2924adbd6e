package co.fanki.routeanalyzer.route.domain;

import co.fanki.routeanalyzer.script.domain.InMemoryStatementSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ProgressTracker}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ProgressTrackerTest {

    private static final String LINEAR = """
            label one:
                "a b c d e f g h i j"
            label two:
                "a b c d e f g h i j"
            label three:
                "a b c d e f g h i j"
            label four:
                "a b c d e f g h i j"
            """;

    private final ProgressTracker tracker = new ProgressTracker(
            ReadingSpeed.standard());

    private AnalysisResult linear;

    @BeforeEach
    void setUp() {
        linear = analyze(LINEAR);
    }

    @Test
    void whenTracking_givenLinearScript_shouldNeverDecreaseAlongTheRoute() {
        double previous = -1;
        for (final String label : List.of("one", "two", "three", "four")) {
            final double current = tracker.track(linear, label)
                    .progressPercentage();
            assertTrue(current >= previous, label);
            previous = current;
        }
        assertEquals(75.0, previous);
    }

    @Test
    void whenTracking_givenSecondLabel_shouldCountItAsRemaining() {
        final ProgressSnapshot snapshot = tracker.track(linear, "two");

        assertEquals("two", snapshot.currentLabel());
        assertEquals(25.0, snapshot.progressPercentage());
        assertEquals(30, snapshot.estimatedRemainingWords());
        assertEquals(0.2, snapshot.estimatedReadingTimeMinutes());
        assertEquals(40, snapshot.totalWords());
    }

    @Test
    void whenTracking_givenUnknownLabel_shouldReportNoProgress() {
        final ProgressSnapshot snapshot = tracker.track(linear, "nowhere");

        assertEquals(0.0, snapshot.progressPercentage());
        assertEquals(40, snapshot.estimatedRemainingWords());
        assertEquals(40, snapshot.totalWords());
    }

    @Test
    void whenTracking_givenNoCurrentLabel_shouldReportNoProgress() {
        final ProgressSnapshot snapshot = tracker.track(linear, null);

        assertNull(snapshot.currentLabel());
        assertEquals(0.0, snapshot.progressPercentage());
        assertEquals(snapshot.totalWords(),
                snapshot.estimatedRemainingWords());
    }

    @Test
    void whenTracking_givenCycle_shouldTerminateAndCountEachLabelOnce() {
        final AnalysisResult result = analyze("""
                label a:
                    "x y"
                    jump b
                label b:
                    "z"
                    jump a
                label epilogue:
                    "the end of it all"
                """);

        final ProgressSnapshot snapshot = tracker.track(result, "b");

        assertEquals(3, snapshot.estimatedRemainingWords());
        assertEquals(62.5, snapshot.progressPercentage());
    }

    @Test
    void whenTracking_givenBranchTaken_shouldIgnoreOtherBranch() {
        final AnalysisResult result = analyze("""
                label start:
                    "Pick one."
                    menu:
                        "A":
                            jump path_a
                        "B" if flag:
                            jump path_b
                label path_a:
                    "Alpha words."
                    return
                label path_b:
                    "Beta has more words."
                    return
                """);

        assertEquals(result.wordCounts().total(),
                tracker.track(result, "start").estimatedRemainingWords());
        assertEquals(2, tracker.track(result, "path_a")
                .estimatedRemainingWords());
    }

    @Test
    void whenTracking_givenScriptWithoutWords_shouldReportZero() {
        final AnalysisResult result = analyze("label start:\n    return\n");

        assertEquals(0.0, tracker.track(result, "start")
                .progressPercentage());
    }

    private static AnalysisResult analyze(final String script) {
        return new RouteAnalyzer().analyze(new InMemoryStatementSource()
                .put("script.rpy", script));
    }

}
