package co.fanki.webready;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Web-Readiness Analyzer Application.
 *
 * <p>This is the main entry point for the analyzer, which inspects Python
 * desktop GUI projects and measures how much of their code can be reused
 * unchanged behind a web front end. Analyses are submitted and followed
 * through the REST API.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class WebReadinessApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(WebReadinessApplication.class, args);
    }

}
