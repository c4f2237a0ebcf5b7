package com.example.automation.service.handler;

/**
 * Opaque unit of work run by the automation engine.
 * <p>
 * Implementations perform the business side of a job (notifications, shift
 * generation, invoicing, ...) and report what they did. Any exception thrown
 * marks the attempt as failed and is subject to automatic retry.
 * <p>
 * Handlers should:
 * - Be safe to run again after a failure
 * - Not manage engine state (run logs and job config are handled by the executor)
 */
@FunctionalInterface
public interface JobHandler {

    /**
     * Run the job once
     *
     * @return summary of the work done; {@code null} is treated as an empty result
     * @throws Exception on failure
     */
    JobResult execute() throws Exception;
}
