package com.whereq.dispatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration properties for WhereQ Dispatch.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "dispatch")
@Data
public class DispatchProperties {

    /**
     * Service root of the search REST API, e.g. https://splunk.example.com:8089/services
     */
    private String baseUrl = "https://localhost:8089/services";

    /**
     * Bearer token. Takes precedence over basic credentials.
     */
    private String token;

    private String username;

    private String password;

    /**
     * Path of the search jobs collection, relative to the service root.
     */
    private String jobsPath = "/search/v2/jobs";

    /**
     * Timeout of a single REST call.
     */
    private Duration requestTimeout = Duration.ofSeconds(30);

    /**
     * Maximum buffered response size in bytes.
     */
    private int maxInMemorySize = 16 * 1024 * 1024;

    private PollConfig poll = new PollConfig();

    private ListingConfig listing = new ListingConfig();

    @Data
    public static class PollConfig {
        /**
         * Fixed delay between status polls.
         */
        private Duration interval = Duration.ofSeconds(1);

        /**
         * Default wait budget when the caller does not give one.
         */
        private Duration timeout = Duration.ofSeconds(300);
    }

    @Data
    public static class ListingConfig {
        /**
         * Page size used when listing jobs.
         */
        private int defaultCount = 50;
    }
}
