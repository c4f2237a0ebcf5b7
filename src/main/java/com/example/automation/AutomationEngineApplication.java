package com.example.automation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Automation Engine Application
 * <p>
 * Runs the recurring background jobs of the staffing CRM (shift reminders,
 * auto-invoicing, escalation checks, ...) with persisted configuration,
 * an execution audit trail and bounded automatic retries.
 * <p>
 * Features:
 * - Cron-driven job timers reconciled with durable job config
 * - Per-job mutual exclusion between scheduled, retry and manual runs
 * - Backoff retries with Slack alerting when retries are exhausted
 * - Admin API for pause, resume, manual run and reschedule
 */
@EnableScheduling
@SpringBootApplication
public class AutomationEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(AutomationEngineApplication.class, args);
    }
}
