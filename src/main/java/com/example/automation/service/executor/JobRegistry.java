package com.example.automation.service.executor;

import com.example.automation.domain.entity.JobConfig;
import com.example.automation.domain.enums.TriggerSource;
import com.example.automation.domain.repository.JobConfigRepository;
import com.example.automation.service.cron.CronExpressionEvaluator;
import com.example.automation.service.handler.JobHandler;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Live wiring of job names to handlers and cron timers.
 * <p>
 * The registry is the only owner of cron timer handles. An entry may exist with its
 * timer stopped (paused job); {@link #isActive(String)} tells the two apart.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobRegistry {

    private final TaskScheduler taskScheduler;
    private final CronExpressionEvaluator cronEvaluator;
    private final JobExecutor jobExecutor;
    private final JobConfigRepository configRepository;

    private final Map<String, RegistryEntry> entries = new ConcurrentHashMap<>();

    /**
     * Register a job, replacing any previous registration under the same name.
     * The timer is left stopped when the job's config is disabled.
     *
     * @throws IllegalArgumentException if the schedule is not a valid cron expression
     */
    public synchronized void register(String jobName, String schedule, JobHandler handler) {
        if (!cronEvaluator.isValid(schedule)) {
            throw new IllegalArgumentException("Invalid cron expression for job " + jobName + ": " + schedule);
        }

        var previous = entries.remove(jobName);
        if (previous != null) {
            previous.cancelTimer();
            log.info("Replacing registration of job {}", jobName);
        }

        var entry = new RegistryEntry(jobName, schedule, handler);
        entries.put(jobName, entry);

        var enabled = configRepository.findById(jobName).map(JobConfig::isEnabled).orElse(true);
        if (enabled) {
            arm(entry);
            log.info("Registered job {} with schedule '{}'", jobName, schedule);
        } else {
            log.info("Registered job {} with schedule '{}' (disabled, timer stopped)", jobName, schedule);
        }
    }

    /**
     * Start the timer of a registered job
     *
     * @return false if the job is not registered
     */
    public synchronized boolean start(String jobName) {
        var entry = entries.get(jobName);
        if (entry == null) {
            return false;
        }
        if (!entry.isActive()) {
            arm(entry);
            log.info("Started timer for job {}", jobName);
        }
        return true;
    }

    /**
     * Stop the timer of a registered job; an in-flight run is not interrupted
     *
     * @return false if the job is not registered
     */
    public synchronized boolean stop(String jobName) {
        var entry = entries.get(jobName);
        if (entry == null) {
            return false;
        }
        if (entry.cancelTimer()) {
            log.info("Stopped timer for job {}", jobName);
        }
        return true;
    }

    /**
     * Replace the schedule of a registered job. A stopped timer stays stopped.
     *
     * @return false if the job is not registered
     * @throws IllegalArgumentException if the schedule is not a valid cron expression
     */
    public synchronized boolean reschedule(String jobName, String schedule) {
        if (!cronEvaluator.isValid(schedule)) {
            throw new IllegalArgumentException("Invalid cron expression for job " + jobName + ": " + schedule);
        }
        var entry = entries.get(jobName);
        if (entry == null) {
            return false;
        }

        var wasActive = entry.isActive();
        entry.cancelTimer();
        entry.schedule = schedule;
        if (wasActive) {
            arm(entry);
        }
        log.info("Rescheduled job {} to '{}'", jobName, schedule);
        return true;
    }

    /**
     * Stop every timer and forget all registrations
     */
    public synchronized void unregisterAll() {
        entries.values().forEach(RegistryEntry::cancelTimer);
        log.info("Unregistered {} jobs", entries.size());
        entries.clear();
    }

    public boolean isRegistered(String jobName) {
        return entries.containsKey(jobName);
    }

    public boolean isActive(String jobName) {
        var entry = entries.get(jobName);
        return entry != null && entry.isActive();
    }

    public Optional<JobHandler> getHandler(String jobName) {
        return Optional.ofNullable(entries.get(jobName)).map(RegistryEntry::getHandler);
    }

    public Optional<String> getSchedule(String jobName) {
        return Optional.ofNullable(entries.get(jobName)).map(RegistryEntry::getSchedule);
    }

    public Set<String> getRegisteredJobNames() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    private void arm(RegistryEntry entry) {
        var trigger = new CronTrigger(cronEvaluator.toSpringExpression(entry.getSchedule()), cronEvaluator.getZoneId());
        entry.timerHandle = taskScheduler.schedule(() -> fire(entry.getJobName(), entry.getHandler()), trigger);
    }

    private void fire(String jobName, JobHandler handler) {
        try {
            jobExecutor.execute(jobName, handler, TriggerSource.SCHEDULED);
        } catch (Throwable t) {
            log.error("Unexpected error in scheduled run of job {}: {}", jobName, t.getMessage(), t);
        }
    }

    /**
     * Registration of one job; transient, rebuilt on every startup
     */
    @Getter
    static final class RegistryEntry {

        private final String jobName;
        private final JobHandler handler;
        private volatile String schedule;
        private volatile ScheduledFuture<?> timerHandle;

        RegistryEntry(String jobName, String schedule, JobHandler handler) {
            this.jobName = jobName;
            this.schedule = schedule;
            this.handler = handler;
        }

        boolean isActive() {
            var handle = timerHandle;
            return handle != null && !handle.isCancelled();
        }

        /**
         * @return true if a live timer was cancelled
         */
        boolean cancelTimer() {
            var handle = timerHandle;
            timerHandle = null;
            return handle != null && handle.cancel(false);
        }
    }
}
