package com.example.automation.service;

import com.example.automation.config.AutomationProperties;
import com.example.automation.config.AutomationProperties.JobDefinition;
import com.example.automation.domain.entity.JobConfig;
import com.example.automation.domain.repository.JobConfigRepository;
import com.example.automation.service.cron.CronExpressionEvaluator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Creates job config rows and keeps their derived next-run field current.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobConfigService {

    private final JobConfigRepository configRepository;
    private final CronExpressionEvaluator cronEvaluator;
    private final AutomationProperties properties;
    private final Clock clock;

    /**
     * Insert the config row for a job unless one already exists.
     * An existing row is returned untouched, so operator changes survive restarts.
     */
    public JobConfig seedIfAbsent(String jobName, JobDefinition definition) {
        var existing = configRepository.findById(jobName);
        if (existing.isPresent()) {
            log.debug("Config for job {} already present, not seeding", jobName);
            return existing.get();
        }

        var maxRetries = definition.getMaxRetries() != null ? definition.getMaxRetries() : properties.getDefaultMaxRetries();
        var config = JobConfig.builder()
                .jobName(jobName)
                .displayName(definition.getDisplayName())
                .description(definition.getDescription())
                .category(definition.getCategory())
                .cronSchedule(definition.getSchedule())
                .enabled(definition.isEnabled())
                .retryCount(0)
                .maxRetries(maxRetries)
                .build();
        refreshNextRun(config);

        log.info("Seeded config for job {} (schedule '{}', enabled: {})", jobName, config.getCronSchedule(), config.isEnabled());
        return configRepository.save(config);
    }

    /**
     * Recompute the advisory next run of a config from its current schedule.
     * Disabled jobs have no next run. Does not save.
     */
    public void refreshNextRun(JobConfig config) {
        config.setNextRunAt(config.isEnabled() ? cronEvaluator.nextRun(config.getCronSchedule(), clock.instant()) : null);
    }
}
