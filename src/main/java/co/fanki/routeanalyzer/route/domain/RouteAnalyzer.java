package co.fanki.routeanalyzer.route.domain;

import co.fanki.routeanalyzer.script.domain.StatementSource;
import co.fanki.routeanalyzer.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;

/**
 * Runs one full analysis of a statement source.
 *
 * <p>Builds the route graph, counts words per label and reads the choice
 * guards, then assembles them into one {@link AnalysisResult}. Only a
 * source that is unavailable as a whole makes the analysis fail; files
 * that cannot be tokenized mark the result partial.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class RouteAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(
            RouteAnalyzer.class);

    private final RouteGraphBuilder graphBuilder;

    private final WordCounter wordCounter;

    private final ConditionParser conditionParser;

    /**
     * Creates an analyzer.
     *
     * @param theGraphBuilder builds the route graph
     * @param theWordCounter counts words per label
     * @param theConditionParser reads choice guards
     */
    public RouteAnalyzer(final RouteGraphBuilder theGraphBuilder,
            final WordCounter theWordCounter,
            final ConditionParser theConditionParser) {
        graphBuilder = Preconditions.requireNonNull(theGraphBuilder,
                "Graph builder is required");
        wordCounter = Preconditions.requireNonNull(theWordCounter,
                "Word counter is required");
        conditionParser = Preconditions.requireNonNull(theConditionParser,
                "Condition parser is required");
    }

    /** Creates an analyzer with the default collaborators. */
    public RouteAnalyzer() {
        this(new RouteGraphBuilder(), new WordCounter(),
                new ConditionParser());
    }

    /**
     * Analyzes every file of a source.
     *
     * @param source the statement source
     * @return the analysis result
     * @throws co.fanki.routeanalyzer.script.domain
     *         .StatementSourceUnavailableException if the source is down
     */
    public AnalysisResult analyze(final StatementSource source) {
        final long started = System.currentTimeMillis();

        final RouteGraphBuilder.Outcome outcome = graphBuilder.build(source);
        final WordCounts wordCounts = wordCounter.count(outcome.labels());
        final Map<String, Requirement> requirements =
                conditionParser.requirementsOf(outcome.graph());
        final AnalysisMetadata metadata = AnalysisMetadata.of(
                outcome.graph(), wordCounts);

        LOG.info("Analysis finished in {} ms: {} labels, {} menus, {} words,"
                        + " {} guarded choices{}",
                System.currentTimeMillis() - started,
                metadata.totalLabels(), metadata.totalMenus(),
                metadata.totalWords(), requirements.size(),
                outcome.partial() ? " (partial)" : "");

        return new AnalysisResult(outcome.graph(), wordCounts, requirements,
                metadata, outcome.partial(), outcome.failedFiles(),
                Instant.now().toString());
    }

}
