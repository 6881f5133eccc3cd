package com.platform.planner.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the capacity planner.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "planner")
public class PlannerProperties {
    
    private Remote remote = new Remote();
    
    private Run run = new Run();
    
    /**
     * System markets that plans may never delete.
     */
    private List<String> protectedMarkets = new ArrayList<>(List.of("Market", "Market_Default"));
    
    /**
     * Remote analysis service connection.
     */
    @Data
    public static class Remote {
        /**
         * API base URL, e.g. https://host/api/v3.
         */
        private String baseUrl = "http://localhost:8080/api/v3";
        
        /**
         * Connection timeout in milliseconds.
         */
        private int connectionTimeoutMs = 5000;
        
        /**
         * Read timeout in milliseconds.
         */
        private int readTimeoutMs = 30000;
        
        private String username;
        
        private String password;
        
        /**
         * Protocol version override. When unset the version reported by the
         * service is used.
         */
        private String version;
    }
    
    /**
     * Default plan run options.
     */
    @Data
    public static class Run {
        /**
         * Plan timeout in minutes, 0 disables the timeout.
         */
        private int timeoutMinutes = 0;
        
        /**
         * Status polling interval in seconds, 0 selects an adaptive interval.
         */
        private int pollIntervalSeconds = 0;
        
        private int abortTimeoutMinutes = 5;
        
        private int abortPollSeconds = 5;
        
        /**
         * Attempts made before a run fails for good.
         */
        private int maxAttempts = 3;
        
        private String baseMarket = "Market";
        
        /**
         * Delete the market and scenario of a failed attempt before retrying.
         */
        private boolean cleanupAbandonedAttempts = false;
    }
}
