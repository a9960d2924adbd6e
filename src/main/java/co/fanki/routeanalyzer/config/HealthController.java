package co.fanki.routeanalyzer.config;

import co.fanki.routeanalyzer.route.application.AnalysisCache;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health check endpoint.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
public class HealthController {

    private final AnalysisCache analysisCache;

    /**
     * Creates a new HealthController.
     *
     * @param theAnalysisCache the analysis cache
     */
    public HealthController(final AnalysisCache theAnalysisCache) {
        this.analysisCache = theAnalysisCache;
    }

    /**
     * Returns health status.
     *
     * @return status "up" and whether an analysis is cached
     */
    @GetMapping("/health")
    public Map<String, Object> health() {
        final Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "up");
        health.put("analysis_cached", analysisCache.peek() != null);
        return health;
    }

}
