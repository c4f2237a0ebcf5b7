package com.example.automation.service.handler;

import com.example.automation.config.AutomationProperties;
import com.example.automation.domain.repository.JobRunLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Built-in job purging completed run logs past the retention window.
 * Running entries are kept regardless of age.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RunLogRetentionJob implements ScheduledJob {

    public static final String JOB_NAME = "automation-log-cleanup";

    private final JobRunLogRepository runLogRepository;
    private final AutomationProperties properties;
    private final Clock clock;

    @Override
    public String getJobName() {
        return JOB_NAME;
    }

    @Override
    public JobResult execute() {
        var retentionDays = properties.getRunLogRetentionDays();
        var cutoff = clock.instant().minus(Duration.ofDays(retentionDays));

        var deleted = runLogRepository.deleteCompletedBefore(cutoff);
        log.info("Deleted {} run logs older than {} days", deleted, retentionDays);

        return JobResult.processed(deleted)
                .withDetails(String.format("Deleted %d run logs started before %s", deleted, cutoff));
    }
}
