package org.carball.sqlinspector.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

@Data
@Builder(toBuilder = true)
@Slf4j
public class InspectorConfig {

    public static final String DEFAULT_READ_ONLY_KEYWORD = "select";
    public static final int DEFAULT_CACHE_CAPACITY = 5;

    /** Secret the query tokens are signed with. Must come from the hosting environment. */
    private String secretKey;

    @Builder.Default
    private String readOnlyKeyword = DEFAULT_READ_ONLY_KEYWORD;

    /** Number of recent requests whose aggregation stays retrievable. */
    @Builder.Default
    private int cacheCapacity = DEFAULT_CACHE_CAPACITY;

    @Builder.Default
    private GroupingMode groupingMode = GroupingMode.STATEMENT;

    /** Whether a query executor is wired in, enabling "select again" and "explain". */
    @Builder.Default
    private boolean executionAvailable = false;

    @Builder.Default
    private List<String> internalFramePrefixes = List.of(
            "java.", "javax.", "jdk.", "sun.", "com.sun.",
            "org.hibernate.", "org.springframework.", "com.zaxxer.hikari.");

    @Builder.Default
    private List<String> renderingKeywords = List.of("render");

    private String jdbcUrl;

    public static InspectorConfig defaults(String secretKey) {
        return InspectorConfig.builder()
                .secretKey(secretKey)
                .build();
    }

    /**
     * Rejects settings the inspector cannot run with and warns about questionable ones.
     */
    public void validate() {
        if (secretKey == null || secretKey.isBlank()) {
            throw new IllegalArgumentException("A secret key is required to sign query tokens");
        }
        if (cacheCapacity <= 0) {
            throw new IllegalArgumentException("Cache capacity must be positive, got " + cacheCapacity);
        }
        if (readOnlyKeyword == null || readOnlyKeyword.isBlank()) {
            throw new IllegalArgumentException("Read-only keyword must not be empty");
        }

        if (secretKey.length() < 16) {
            log.warn("Secret key is only {} characters long; tokens are easier to forge with short secrets",
                    secretKey.length());
        }
        if (!DEFAULT_READ_ONLY_KEYWORD.equalsIgnoreCase(readOnlyKeyword.trim())) {
            log.warn("Read-only keyword changed from '{}' to '{}'", DEFAULT_READ_ONLY_KEYWORD, readOnlyKeyword);
        }
        if (executionAvailable && (jdbcUrl == null || jdbcUrl.isBlank())) {
            log.debug("Execution enabled without a JDBC URL; an executor must be supplied programmatically");
        }

        log.debug("Using inspector config - capacity: {}, grouping: {}, execution: {}",
                cacheCapacity, groupingMode, executionAvailable);
    }

    /**
     * Describes the configuration without revealing the secret.
     */
    public String getConfigurationSummary() {
        return String.format("Grouping: %s | Cache capacity: %d | Read-only keyword: %s | Execution: %s",
                groupingMode, cacheCapacity, readOnlyKeyword, executionAvailable ? "available" : "unavailable");
    }

    @Override
    public String toString() {
        return "InspectorConfig{" + getConfigurationSummary() + "}";
    }
}
