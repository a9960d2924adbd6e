package co.fanki.routeanalyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Script Route Analyzer Application.
 *
 * <p>Parses a branching interactive-fiction script into a route graph
 * and serves word counts, choice requirements and reading progress over
 * HTTP.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class RouteAnalyzerApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(RouteAnalyzerApplication.class, args);
    }

}
