package com.example.automation.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Aggregate run statistics for the admin dashboard
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AutomationStatistics {

    private WindowStats today;
    private WindowStats week;
    private WindowStats month;

    /**
     * Percentage of successful completed runs over the last 30 days; 100 when there were none
     */
    private int successRate;

    private JobActivity mostActive;
    private JobActivity mostFailed;
    private List<DailyRuns> runsOverTime;
    private JobCounts jobCounts;
    private Instant generatedAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class WindowStats {
        private long count;
        private long successCount;
        private long failedCount;
        private long totalProcessed;
        private long totalCreated;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class JobActivity {
        private String jobName;
        private String displayName;
        private long count;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DailyRuns {
        private LocalDate date;
        private long total;
        private long success;
        private long failed;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class JobCounts {
        private long total;
        private long enabled;
        private long disabled;
    }
}
