package co.fanki.routeanalyzer.route.application;

import co.fanki.routeanalyzer.route.domain.ProgressSnapshot;
import co.fanki.routeanalyzer.script.domain.StatementSourceUnavailableException;
import co.fanki.routeanalyzer.shared.DomainException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link RouteAnalysisController}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class RouteAnalysisControllerTest {

    private RouteAnalysisService service;

    private RouteAnalysisController controller;

    @BeforeEach
    void setUp() {
        service = mock(RouteAnalysisService.class);
        controller = new RouteAnalysisController(service);
    }

    @Test
    void whenGettingProgress_givenSnapshot_shouldReturnOk() {
        final ProgressSnapshot snapshot = new ProgressSnapshot("start", 0.0,
                10, 0.1, 10);
        when(service.getProgress()).thenReturn(snapshot);

        final ResponseEntity<?> response = controller.progress();

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertSame(snapshot, response.getBody());
    }

    @Test
    void whenAnalyzing_givenUnavailableSource_shouldReturnServiceUnavailable() {
        when(service.analyze(true)).thenThrow(
                new StatementSourceUnavailableException("Script dir gone"));

        final ResponseEntity<?> response = controller.analyze(true);

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
        assertEquals(Map.of("error", "Script dir gone",
                "errorCode", StatementSourceUnavailableException.ERROR_CODE),
                response.getBody());
    }

    @Test
    void whenGettingSummary_givenCancelledRebuild_shouldReturnServerError() {
        when(service.getSummary()).thenThrow(
                new DomainException("Route analysis cancelled",
                        "ANALYSIS_CANCELLED"));

        final ResponseEntity<?> response = controller.summary();

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR,
                response.getStatusCode());
    }

    @Test
    void whenInvalidating_givenRequest_shouldDelegate() {
        final ResponseEntity<?> response = controller.invalidate();

        assertEquals(HttpStatus.OK, response.getStatusCode());
        verify(service).invalidateCache();
    }

    @Test
    void whenMovingPosition_givenReadOnlyProvider_shouldReturnBadRequest() {
        doThrow(new DomainException("read only", "POSITION_READ_ONLY"))
                .when(service).moveTo("start");

        final ResponseEntity<?> response = controller.position(
                new RouteAnalysisController.PositionRequest("start"));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
    }

    @Test
    void whenMovingPosition_givenLabel_shouldEchoIt() {
        final ResponseEntity<?> response = controller.position(
                new RouteAnalysisController.PositionRequest("chapter_two"));

        verify(service).moveTo("chapter_two");
        assertEquals(Map.of("current_label", "chapter_two"),
                response.getBody());
    }

}
