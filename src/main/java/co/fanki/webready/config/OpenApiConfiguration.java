package co.fanki.webready.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for the Web-Readiness Analyzer.
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
                        .title("Web-Readiness Analyzer API")
                        .description("""
                                Web-Readiness Analyzer - Static analysis of Python desktop GUI
                                projects (PyQt, PySide, Tkinter, wxPython) that measures how much
                                of the code can be reused unchanged by a web application.

                                ## Features
                                - **Toolkit Detection**: Finds the GUI toolkits each file imports
                                - **Purity Analysis**: Separates UI-bound functions from pure logic
                                - **File Classification**: Labels files as UI, Logic or Mixed
                                - **Suggestions**: Extraction and refactoring candidates per function
                                - **Conversion Guide**: Web-readiness score and migration advice

                                ## Endpoints
                                - `POST /api/analyses` - Submit a project for analysis
                                - `GET /api/analyses/{id}/events` - Follow progress (SSE)
                                - `GET /api/analyses/{id}/result` - Fetch the result
                                - `GET /api/analyses/{id}/export/{json|csv|zip}` - Export the result
                                """)
                        .version("0.0.1")
                        .contact(new Contact()
                                .name("Fanki")
                                .email("emiliano@fanki.co")
                                .url("https://fanki.co"))
                        .license(new License()
                                .name("Proprietary")
                                .url("https://fanki.co")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")));
    }

}
