package co.fanki.routeanalyzer.route.application;

import co.fanki.routeanalyzer.script.domain.StatementSourceUnavailableException;
import co.fanki.routeanalyzer.shared.DomainException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.function.Supplier;

/**
 * REST controller exposing the route analysis.
 *
 * <p>All reads are answered from the analysis cache. When the script
 * directory cannot be read the endpoints answer 503 so the caller can
 * retry.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/route")
@Tag(name = "Route Analysis",
        description = "Route graph, word counts and reading progress")
public class RouteAnalysisController {

    private static final Logger LOG = LoggerFactory.getLogger(
            RouteAnalysisController.class);

    private final RouteAnalysisService routeAnalysisService;

    /**
     * Creates a new RouteAnalysisController.
     *
     * @param theRouteAnalysisService the route analysis service
     */
    public RouteAnalysisController(
            final RouteAnalysisService theRouteAnalysisService) {
        this.routeAnalysisService = theRouteAnalysisService;
    }

    @GetMapping("/analyze")
    @Operation(summary = "Complete route analysis",
            description = "Route graph, word counts, choice requirements"
                    + " and metadata")
    public ResponseEntity<?> analyze(
            @RequestParam(name = "force_refresh", defaultValue = "false")
            final boolean forceRefresh) {
        return respond(() -> routeAnalysisService.analyze(forceRefresh));
    }

    @GetMapping("/graph")
    @Operation(summary = "Route graph",
            description = "Nodes and edges for visualization")
    public ResponseEntity<?> graph() {
        return respond(() -> Map.of("route_graph",
                routeAnalysisService.getRouteGraph()));
    }

    @GetMapping("/progress")
    @Operation(summary = "Reading progress",
            description = "Progress at the interpreter's current label")
    public ResponseEntity<?> progress() {
        return respond(routeAnalysisService::getProgress);
    }

    @GetMapping("/wordcount")
    @Operation(summary = "Word counts",
            description = "Words per label, total and reading time")
    public ResponseEntity<?> wordCount(
            @RequestParam(name = "force_refresh", defaultValue = "false")
            final boolean forceRefresh) {
        return respond(() -> routeAnalysisService.getWordCounts(
                forceRefresh));
    }

    @GetMapping("/requirements")
    @Operation(summary = "Choice requirements",
            description = "Variables and comparisons of guarded choices")
    public ResponseEntity<?> requirements() {
        return respond(routeAnalysisService::getChoiceRequirements);
    }

    @GetMapping("/summary")
    @Operation(summary = "Route summary",
            description = "Aggregate counts and total reading time")
    public ResponseEntity<?> summary() {
        return respond(routeAnalysisService::getSummary);
    }

    @GetMapping("/cache-status")
    @Operation(summary = "Analysis cache status")
    public ResponseEntity<?> cacheStatus() {
        return ResponseEntity.ok(routeAnalysisService.getCacheStatus());
    }

    @PostMapping("/invalidate")
    @Operation(summary = "Invalidate the analysis cache",
            description = "The next query rebuilds the analysis")
    public ResponseEntity<?> invalidate() {
        routeAnalysisService.invalidateCache();
        return ResponseEntity.ok(Map.of("status", "invalidated"));
    }

    /**
     * Moves the current position, as reported by the interpreter.
     *
     * @param request the label entered
     * @return the new position
     */
    @PutMapping("/position")
    @Operation(summary = "Set the current label",
            description = "Called by the interpreter when it enters a"
                    + " label")
    public ResponseEntity<?> position(
            @RequestBody final PositionRequest request) {
        try {
            routeAnalysisService.moveTo(request.label());
            return ResponseEntity.ok(Map.of("current_label",
                    request.label() == null ? "" : request.label()));
        } catch (final DomainException e) {
            LOG.warn("Position update rejected: {}", e.getMessage());
            return ResponseEntity.badRequest().body(error(e));
        }
    }

    private ResponseEntity<?> respond(final Supplier<?> query) {
        try {
            return ResponseEntity.ok(query.get());
        } catch (final StatementSourceUnavailableException e) {
            LOG.warn("Route analysis unavailable: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(error(e));
        } catch (final DomainException e) {
            LOG.warn("Route analysis failed: {}", e.getMessage());
            return ResponseEntity.internalServerError().body(error(e));
        }
    }

    private static Map<String, String> error(final DomainException e) {
        return Map.of("error", e.getMessage(),
                "errorCode", e.getErrorCode());
    }

    /**
     * Request body for a position update.
     *
     * @param label the label entered, blank clears the position
     */
    public record PositionRequest(String label) {}
}
