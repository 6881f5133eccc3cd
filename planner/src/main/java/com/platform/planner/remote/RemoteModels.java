package com.platform.planner.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * DTOs for remote analysis service communication.
 */
public class RemoteModels {
    
    private static final DateTimeFormatter SERVER_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssZ");
    
    /**
     * Scenario resource as returned on creation.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ScenarioInfo {
        private String uuid;
        private String displayName;
    }
    
    /**
     * Market resource.
     */
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MarketInfo {
        private String uuid;
        private String displayName;
        private String state;
        private String runDate;
        private String runCompleteDate;
        private Boolean unplacedEntities;
        
        public MarketInfo(String uuid, String displayName, String state) {
            this.uuid = uuid;
            this.displayName = displayName;
            this.state = state;
        }
        
        /**
         * Parsed state, null when the reported state is not recognized.
         */
        public MarketState marketState() {
            return MarketState.fromName(state);
        }
        
        /**
         * Server side run time, when both run dates were reported.
         */
        public Optional<Duration> serverDuration() {
            Optional<OffsetDateTime> start = parseDate(runDate);
            Optional<OffsetDateTime> end = parseDate(runCompleteDate);
            if (start.isEmpty() || end.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(Duration.between(start.get(), end.get()));
        }
    }
    
    /**
     * Entity or group found by search.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EntityInfo {
        private String uuid;
        private String displayName;
        private String className;
    }
    
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class UserInfo {
        private String uuid;
        private String username;
    }
    
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VersionInfo {
        private String version;
        private String versionInfo;
    }
    
    static Optional<OffsetDateTime> parseDate(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(OffsetDateTime.parse(value, SERVER_DATE));
        } catch (DateTimeParseException e) {
            try {
                return Optional.of(OffsetDateTime.parse(value));
            } catch (DateTimeParseException ignored) {
                return Optional.empty();
            }
        }
    }
}
