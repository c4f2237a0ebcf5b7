package com.example.automation.service.handler;

import lombok.Builder;
import lombok.Data;

/**
 * Summary returned by a job handler.
 * <p>
 * Counts default to zero and details to {@code null}. The executor passes every
 * result through {@link #normalize(JobResult)} before recording it.
 */
@Data
@Builder
public class JobResult {

    private static final int MAX_DETAILS_LENGTH = 4000;

    /**
     * Items examined or handled
     */
    @Builder.Default
    private int processed = 0;

    /**
     * Items created (shifts, invoices, notifications, ...)
     */
    @Builder.Default
    private int created = 0;

    /**
     * Items deliberately left untouched
     */
    @Builder.Default
    private int skipped = 0;

    /**
     * Free-form summary message
     */
    private String details;

    /**
     * Create an empty result
     */
    public static JobResult empty() {
        return JobResult.builder().build();
    }

    /**
     * Create a result with only a processed count
     */
    public static JobResult processed(int processed) {
        return JobResult.builder().processed(processed).build();
    }

    public static JobResult of(int processed, int created, int skipped) {
        return JobResult.builder().processed(processed).created(created).skipped(skipped).build();
    }

    /**
     * Replace missing results with an empty one, clamp negative counts to zero
     * and truncate oversized details
     */
    public static JobResult normalize(JobResult result) {
        if (result == null) {
            return empty();
        }
        return JobResult.builder()
                .processed(Math.max(0, result.getProcessed()))
                .created(Math.max(0, result.getCreated()))
                .skipped(Math.max(0, result.getSkipped()))
                .details(truncate(result.getDetails()))
                .build();
    }

    /**
     * Add details message
     */
    public JobResult withDetails(String details) {
        this.details = details;
        return this;
    }

    /**
     * One-line summary stored as the job's last run details
     */
    public String toSummary() {
        var counts = String.format("processed=%d, created=%d, skipped=%d", processed, created, skipped);
        return details != null && !details.isBlank() ? counts + ": " + details : counts;
    }

    private static String truncate(String text) {
        if (text == null || text.length() <= MAX_DETAILS_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_DETAILS_LENGTH) + "...";
    }
}
