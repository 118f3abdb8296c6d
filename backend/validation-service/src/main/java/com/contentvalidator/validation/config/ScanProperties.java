package com.contentvalidator.validation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Tunables of the scan pipeline, progress streaming and collaborator clients.
 */
@Configuration
@ConfigurationProperties(prefix = "scan")
@Data
public class ScanProperties {

    private Pipeline pipeline = new Pipeline();

    private Timeouts timeouts = new Timeouts();

    private Discovery discovery = new Discovery();

    private Progress progress = new Progress();

    private Clients clients = new Clients();

    @Data
    public static class Pipeline {
        /** Pages validated in parallel within one job */
        private int validationConcurrency = 4;

        /** Pages audited by axe in parallel within one job */
        private int accessibilityConcurrency = 2;
    }

    @Data
    public static class Timeouts {
        private Duration scrape = Duration.ofSeconds(30);
        private Duration validator = Duration.ofSeconds(120);
        private Duration axe = Duration.ofSeconds(60);
    }

    @Data
    public static class Discovery {
        private int maxPages = 50;
        private boolean useSitemap = true;
    }

    @Data
    public static class Progress {
        /** How long a finished job's channel stays in memory */
        private Duration channelRetention = Duration.ofMinutes(5);

        private Duration pollInterval = Duration.ofSeconds(2);

        private Duration heartbeatInterval = Duration.ofSeconds(15);
    }

    @Data
    public static class Clients {
        /** LLM/RAG validator base URL; blank disables the LLM source */
        private String llmBaseUrl = "";

        /** axe runner base URL; blank disables the axe source */
        private String axeBaseUrl = "";
    }
}
