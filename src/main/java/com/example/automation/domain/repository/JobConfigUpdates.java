package com.example.automation.domain.repository;

import com.example.automation.domain.entity.JobConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Read-modify-write of a job config row under optimistic locking.
 * <p>
 * The change is applied to a freshly loaded row. When another writer saved the row
 * in between, the row is reloaded and the change applied again, so the change
 * function must only touch the fields it owns.
 */
@Slf4j
public final class JobConfigUpdates {

    static final int MAX_ATTEMPTS = 5;

    private JobConfigUpdates() {
    }

    /**
     * Apply a change to the config row of a job and save it.
     *
     * @param repository The config repository
     * @param jobName    The job whose row is changed
     * @param change     Mutation applied to the loaded row, possibly more than once
     * @return The changed row, or empty if the job has no config row
     * @throws ObjectOptimisticLockingFailureException if every attempt lost the race
     */
    public static Optional<JobConfig> update(JobConfigRepository repository, String jobName, Consumer<JobConfig> change) {
        for (int attempt = 1; ; attempt++) {
            var loaded = repository.findById(jobName);
            if (loaded.isEmpty()) {
                return Optional.empty();
            }

            var config = loaded.get();
            change.accept(config);
            try {
                repository.save(config);
                return Optional.of(config);
            } catch (ObjectOptimisticLockingFailureException e) {
                if (attempt >= MAX_ATTEMPTS) {
                    log.error("Giving up updating config of job {} after {} conflicting writes", jobName, attempt);
                    throw e;
                }
                log.debug("Config of job {} changed concurrently, reapplying update (attempt {}/{})",
                        jobName, attempt + 1, MAX_ATTEMPTS);
            }
        }
    }
}
