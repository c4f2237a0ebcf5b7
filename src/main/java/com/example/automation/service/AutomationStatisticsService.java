package com.example.automation.service;

import com.example.automation.domain.entity.JobConfig;
import com.example.automation.domain.enums.RunStatus;
import com.example.automation.domain.repository.JobConfigRepository;
import com.example.automation.domain.repository.JobRunLogRepository;
import com.example.automation.dto.AutomationStatistics;
import com.example.automation.dto.AutomationStatistics.DailyRuns;
import com.example.automation.dto.AutomationStatistics.JobActivity;
import com.example.automation.dto.AutomationStatistics.JobCounts;
import com.example.automation.dto.AutomationStatistics.WindowStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates run history into dashboard statistics.
 * Counting is done by grouped repository queries; windows are computed in the engine's time zone.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AutomationStatisticsService {

    static final int MONTH_DAYS = 30;
    static final int WEEK_DAYS = 7;
    static final int SERIES_DAYS = 14;

    private final JobRunLogRepository runLogRepository;
    private final JobConfigRepository configRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public AutomationStatistics getStatistics() {
        var now = clock.instant();
        var zone = clock.getZone();
        var today = LocalDate.now(clock);

        var monthStart = now.minus(Duration.ofDays(MONTH_DAYS));
        var weekStart = now.minus(Duration.ofDays(WEEK_DAYS));
        var todayStart = today.atStartOfDay(zone).toInstant();
        var tomorrowStart = today.plusDays(1).atStartOfDay(zone).toInstant();

        var monthStats = windowStats(monthStart, tomorrowStart);

        // Per-job counts over the month window
        var runsByJob = new HashMap<String, Long>();
        var failuresByJob = new HashMap<String, Long>();
        for (var row : runLogRepository.countByJobAndStatusSince(monthStart)) {
            var jobName = (String) row[0];
            var status = (RunStatus) row[1];
            var count = ((Number) row[2]).longValue();
            runsByJob.merge(jobName, count, Long::sum);
            if (status == RunStatus.FAILED) {
                failuresByJob.merge(jobName, count, Long::sum);
            }
        }

        var total = configRepository.count();
        var enabled = configRepository.countByEnabled(true);

        log.debug("Computed statistics over {} runs in the last {} days", monthStats.getCount(), MONTH_DAYS);

        return AutomationStatistics.builder()
                .today(windowStats(todayStart, tomorrowStart))
                .week(windowStats(weekStart, tomorrowStart))
                .month(monthStats)
                .successRate(successRate(monthStats))
                .mostActive(topJob(runsByJob))
                .mostFailed(topJob(failuresByJob))
                .runsOverTime(dailySeries(today))
                .jobCounts(JobCounts.builder()
                        .total(total)
                        .enabled(enabled)
                        .disabled(total - enabled)
                        .build())
                .generatedAt(now)
                .build();
    }

    private WindowStats windowStats(Instant start, Instant end) {
        var stats = WindowStats.builder().build();
        for (var row : runLogRepository.summarizeByStatus(start, end)) {
            var status = (RunStatus) row[0];
            var count = ((Number) row[1]).longValue();
            stats.setCount(stats.getCount() + count);
            stats.setTotalProcessed(stats.getTotalProcessed() + ((Number) row[2]).longValue());
            stats.setTotalCreated(stats.getTotalCreated() + ((Number) row[3]).longValue());
            if (status == RunStatus.SUCCESS) {
                stats.setSuccessCount(count);
            } else if (status == RunStatus.FAILED) {
                stats.setFailedCount(count);
            }
        }
        return stats;
    }

    /**
     * Rounded percentage of successful runs among completed ones; 100 when none completed
     */
    private int successRate(WindowStats stats) {
        var completed = stats.getSuccessCount() + stats.getFailedCount();
        if (completed == 0) {
            return 100;
        }
        return (int) Math.round(stats.getSuccessCount() * 100.0 / completed);
    }

    /**
     * Job with the highest count; ties go to the first name alphabetically
     */
    private JobActivity topJob(Map<String, Long> counts) {
        return counts.entrySet().stream()
                .max(Map.Entry.<String, Long>comparingByValue()
                        .thenComparing(Map.Entry.<String, Long>comparingByKey(Comparator.reverseOrder())))
                .map(entry -> JobActivity.builder()
                        .jobName(entry.getKey())
                        .displayName(configRepository.findById(entry.getKey())
                                .map(JobConfig::getDisplayName)
                                .orElse(entry.getKey()))
                        .count(entry.getValue())
                        .build())
                .orElse(null);
    }

    private List<DailyRuns> dailySeries(LocalDate today) {
        var zone = clock.getZone();
        var series = new ArrayList<DailyRuns>();
        for (var date = today.minusDays(SERIES_DAYS - 1); !date.isAfter(today); date = date.plusDays(1)) {
            var day = windowStats(date.atStartOfDay(zone).toInstant(), date.plusDays(1).atStartOfDay(zone).toInstant());
            series.add(DailyRuns.builder()
                    .date(date)
                    .total(day.getCount())
                    .success(day.getSuccessCount())
                    .failed(day.getFailedCount())
                    .build());
        }
        return series;
    }
}
