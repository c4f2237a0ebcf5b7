package com.example.automation.service.handler;

/**
 * A {@link JobHandler} contributed as a Spring bean and bound to a job name.
 * <p>
 * Every bean of this type is registered on startup under the schedule stored in
 * the job's configuration row.
 */
public interface ScheduledJob extends JobHandler {

    /**
     * Name of the job this handler runs, matching a key of the job catalog
     */
    String getJobName();
}
