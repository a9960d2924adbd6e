package co.fanki.routeanalyzer.config;

import co.fanki.routeanalyzer.route.application.AnalysisCache;
import co.fanki.routeanalyzer.route.domain.ProgressTracker;
import co.fanki.routeanalyzer.route.domain.ReadingSpeed;
import co.fanki.routeanalyzer.route.domain.RouteAnalyzer;
import co.fanki.routeanalyzer.script.domain.CurrentLabelProvider;
import co.fanki.routeanalyzer.script.domain.InMemoryCurrentLabelProvider;
import co.fanki.routeanalyzer.script.domain.RpyStatementSource;
import co.fanki.routeanalyzer.script.domain.StatementSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Wires the route analysis from the {@code route.*} properties.
 *
 * <p>The analysis cache is a single bean owned by the application
 * context, shared by every request.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class RouteAnalyzerConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            RouteAnalyzerConfiguration.class);

    @Bean
    public StatementSource statementSource(
            @Value("${route.script-dir:game}") final String scriptDir,
            @Value("${route.file-extension:.rpy}") final String extension) {
        final Path root = Path.of(scriptDir).toAbsolutePath().normalize();
        LOG.info("Analyzing {} scripts under {}", extension, root);
        return new RpyStatementSource(root, extension);
    }

    @Bean
    public CurrentLabelProvider currentLabelProvider() {
        return new InMemoryCurrentLabelProvider();
    }

    @Bean
    public ReadingSpeed readingSpeed(
            @Value("${route.words-per-minute:200}") final int wordsPerMinute) {
        return new ReadingSpeed(wordsPerMinute);
    }

    @Bean
    public RouteAnalyzer routeAnalyzer() {
        return new RouteAnalyzer();
    }

    @Bean
    public ProgressTracker progressTracker(final ReadingSpeed readingSpeed) {
        return new ProgressTracker(readingSpeed);
    }

    /**
     * Creates the cache holding the latest analysis.
     *
     * @param routeAnalyzer runs the analysis
     * @param statementSource the script to analyze
     * @return the empty cache
     */
    @Bean
    public AnalysisCache analysisCache(final RouteAnalyzer routeAnalyzer,
            final StatementSource statementSource) {
        return new AnalysisCache(routeAnalyzer, statementSource);
    }

}
