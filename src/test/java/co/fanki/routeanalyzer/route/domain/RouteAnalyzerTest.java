package co.fanki.routeanalyzer.route.domain;

import co.fanki.routeanalyzer.script.domain.InMemoryStatementSource;
import co.fanki.routeanalyzer.script.domain.StatementSourceUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link RouteAnalyzer} and the serialized shape of its
 * result.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class RouteAnalyzerTest {

    private static final String SCRIPT = """
            label start:
                "Welcome to the story."
                menu:
                    "Go left":
                        jump path_a
                    "Go right" if flag:
                        jump path_b
                    "Stay" if days > 3 and not tired:
                        call missing
            label path_a:
                "Left."
                return
            label path_b:
                "Right."
                return
            """;

    private final RouteAnalyzer analyzer = new RouteAnalyzer();

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void whenAnalyzing_givenScript_shouldAssembleMetadata() {
        final AnalysisResult result = analyze();
        final AnalysisMetadata metadata = result.metadata();

        assertEquals(3, metadata.totalLabels());
        assertEquals(1, metadata.totalMenus());
        assertEquals(3, metadata.totalChoices());
        assertEquals(0, metadata.totalJumps());
        assertEquals(0, metadata.totalCalls());
        assertEquals(1, metadata.totalUnresolved());
        assertEquals(result.wordCounts().total(), metadata.totalWords());
        assertEquals(result.wordCounts().asMap().values().stream()
                .mapToLong(Integer::longValue).sum(), metadata.totalWords());
        assertFalse(result.partial());
        assertNotNull(result.analyzedAt());
    }

    @Test
    void whenAnalyzing_givenGuardedChoices_shouldProduceRequirements() {
        final AnalysisResult result = analyze();

        assertEquals(Set.of("start_menu_1_choice_1", "start_menu_1_choice_2"),
                result.choiceRequirements().keySet());
        assertEquals(List.of("flag"), result.choiceRequirements()
                .get("start_menu_1_choice_1").referencedVariables());
        assertEquals(List.of("days", "tired"), result.choiceRequirements()
                .get("start_menu_1_choice_2").referencedVariables());
    }

    @Test
    void whenSerializing_givenResult_shouldUseWireFieldNames()
            throws Exception {
        final JsonNode json = mapper.readTree(
                mapper.writeValueAsString(analyze()));

        assertTrue(json.has("route_graph"));
        assertTrue(json.has("word_counts"));
        assertTrue(json.has("choice_requirements"));
        assertTrue(json.has("failed_files"));
        assertEquals(3, json.get("metadata").get("total_choices").asInt());
        assertEquals(9, json.get("word_counts").get("start").asInt());

        final JsonNode nodes = json.get("route_graph").get("nodes");
        final JsonNode label = nodes.get(0);
        assertEquals("start", label.get("id").asText());
        assertEquals("label", label.get("type").asText());
        assertEquals("script.rpy", label.get("filename").asText());
        assertEquals(1, label.get("line").asInt());
        assertFalse(label.has("choices"));

        final JsonNode menu = nodes.get(1);
        assertEquals("menu", menu.get("type").asText());
        assertEquals("flag",
                menu.get("choices").get(1).get("condition").asText());

        final JsonNode choiceEdge = json.get("route_graph").get("edges")
                .get(0);
        assertEquals("start_menu_1", choiceEdge.get("from").asText());
        assertEquals("path_a", choiceEdge.get("to").asText());
        assertEquals("choice", choiceEdge.get("type").asText());
        assertEquals(0, choiceEdge.get("choice_index").asInt());
        assertEquals("Go left", choiceEdge.get("choice_text").asText());

        final JsonNode requirement = json.get("choice_requirements")
                .get("start_menu_1_choice_2");
        assertEquals("days > 3 and not tired",
                requirement.get("raw_condition").asText());
        assertEquals("and",
                requirement.get("boolean_connectors").get(0).asText());
    }

    @Test
    void whenSerializing_givenProgress_shouldUseSnakeCase() throws Exception {
        final JsonNode json = mapper.readTree(mapper.writeValueAsString(
                new ProgressTracker(ReadingSpeed.standard())
                        .track(analyze(), "path_a")));

        assertEquals("path_a", json.get("current_label").asText());
        assertTrue(json.has("progress_percentage"));
        assertTrue(json.has("estimated_remaining_words"));
        assertTrue(json.has("estimated_reading_time_minutes"));
        assertTrue(json.has("total_words"));
    }

    @Test
    void whenAnalyzing_givenUnavailableSource_shouldPropagate() {
        final InMemoryStatementSource source = new InMemoryStatementSource();
        source.available(false);

        assertThrows(StatementSourceUnavailableException.class,
                () -> analyzer.analyze(source));
    }

    private AnalysisResult analyze() {
        return analyzer.analyze(new InMemoryStatementSource()
                .put("script.rpy", SCRIPT));
    }

}
