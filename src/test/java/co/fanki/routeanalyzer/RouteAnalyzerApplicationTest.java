package co.fanki.routeanalyzer;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Boots the application against a temporary script directory and drives
 * the route endpoints end to end.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootTest
@AutoConfigureMockMvc
class RouteAnalyzerApplicationTest {

    @TempDir
    static Path scripts;

    @Autowired
    private MockMvc mockMvc;

    @DynamicPropertySource
    static void routeProperties(final DynamicPropertyRegistry registry) {
        registry.add("route.script-dir", () -> scripts.toString());
        registry.add("route.warm-up", () -> "false");
    }

    @BeforeAll
    static void writeScript() throws IOException {
        Files.writeString(scripts.resolve("script.rpy"), """
                label start:
                    "Ten words of dialogue to read before the big choice."
                    menu:
                        "Help" if kindness > 2:
                            jump ending
                label ending:
                    "The end."
                    return
                """);
    }

    @Test
    void whenQueryingSummary_givenScriptDirectory_shouldServeCounts()
            throws Exception {
        mockMvc.perform(get("/api/route/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_labels").value(2))
                .andExpect(jsonPath("$.total_menus").value(1))
                .andExpect(jsonPath("$.total_words").value(13))
                .andExpect(jsonPath("$.partial").value(false));
    }

    @Test
    void whenQueryingGraph_givenScriptDirectory_shouldUseWireNames()
            throws Exception {
        mockMvc.perform(get("/api/route/graph"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.route_graph.nodes[0].id")
                        .value("start"))
                .andExpect(jsonPath("$.route_graph.nodes[1].type")
                        .value("menu"))
                .andExpect(jsonPath("$.route_graph.edges[0].choice_index")
                        .value(0));
    }

    @Test
    void whenMovingPosition_givenLabel_shouldDriveProgress()
            throws Exception {
        mockMvc.perform(put("/api/route/position")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"label\": \"ending\"}"))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/route/progress"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.current_label").value("ending"))
                .andExpect(jsonPath("$.estimated_remaining_words").value(2))
                .andExpect(jsonPath("$.total_words").value(13));
    }

    @Test
    void whenQueryingRequirements_givenGuardedChoice_shouldListVariables()
            throws Exception {
        mockMvc.perform(get("/api/route/requirements"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_conditional_choices").value(1))
                .andExpect(jsonPath("$.choice_requirements"
                        + ".start_menu_1_choice_0.referenced_variables[0]")
                        .value("kindness"));
    }

    @Test
    void whenCheckingHealth_givenRunningApplication_shouldReportUp()
            throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("up"));
    }

}
