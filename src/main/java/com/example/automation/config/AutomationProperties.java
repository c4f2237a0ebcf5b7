package com.example.automation.config;

import com.example.automation.domain.enums.JobCategory;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the automation engine.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "automation")
public class AutomationProperties {

    /**
     * Zone used for cron triggers and next-run projection
     */
    @NotBlank
    private String timeZone = "Asia/Jerusalem";

    /**
     * Number of threads backing job timers and retry timers
     */
    @Min(1)
    private int schedulerPoolSize = 4;

    /**
     * Maximum automatic retries for jobs that do not set their own
     */
    @Min(0)
    private int defaultMaxRetries = 3;

    /**
     * Delay before each automatic retry; attempts beyond the list reuse the last entry
     */
    @NotEmpty
    private List<Duration> retryBackoff = new ArrayList<>(List.of(
            Duration.ofSeconds(60), Duration.ofSeconds(300), Duration.ofSeconds(900)));

    /**
     * Age in minutes after which a RUNNING log found at startup is marked interrupted
     */
    @Min(1)
    private int staleRunThresholdMinutes = 60;

    /**
     * Completed run logs older than this are purged by the cleanup job
     */
    @Min(1)
    private int runLogRetentionDays = 90;

    /**
     * Job catalog seeded into the config store when absent, keyed by job name
     */
    @Valid
    private Map<String, JobDefinition> jobs = new LinkedHashMap<>();

    public ZoneId getZoneId() {
        return ZoneId.of(timeZone);
    }

    @Data
    public static class JobDefinition {

        @NotBlank
        private String displayName;

        private String description;

        @NotNull
        private JobCategory category = JobCategory.SYSTEM;

        @NotBlank
        private String schedule;

        /**
         * Overrides {@link AutomationProperties#getDefaultMaxRetries()} when set
         */
        @Min(0)
        private Integer maxRetries;

        /**
         * Initial enabled flag; only applied when the job is first seeded
         */
        private boolean enabled = true;
    }
}
