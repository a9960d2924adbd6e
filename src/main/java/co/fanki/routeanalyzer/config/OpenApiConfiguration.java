package co.fanki.routeanalyzer.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for the Script Route Analyzer.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class OpenApiConfiguration {

    @Value("${server.port:8080}")
    private int serverPort;

    /**
     * Configures the OpenAPI specification.
     *
     * @return the OpenAPI configuration
     */
    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Script Route Analyzer API")
                        .description("""
                                Script Route Analyzer - static analysis of branching
                                interactive-fiction scripts.

                                ## Features
                                - **Route Graph**: labels, menus and the jumps, calls and choices between them
                                - **Word Counts**: words per label and estimated reading time
                                - **Choice Requirements**: variables and comparisons behind guarded choices
                                - **Progress**: remaining words from the interpreter's current label
                                """)
                        .version("0.0.1"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")));
    }

}
