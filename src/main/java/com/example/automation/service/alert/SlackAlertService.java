package com.example.automation.service.alert;

import com.example.automation.config.SlackProperties;
import com.example.automation.domain.entity.JobConfig;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;

/**
 * Service for sending alerts to Slack when automation jobs exhaust their retries.
 * <p>
 * Sends formatted messages to the configured channel with job details
 * so that an operator can investigate and trigger the job manually.
 */
@Slf4j
@Service
public class SlackAlertService {

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z").withZone(ZoneId.systemDefault());

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Value("${spring.application.name:automation-engine}")
    private String applicationName;

    @Autowired
    public SlackAlertService(SlackProperties slackProperties) {
        this(slackProperties, Slack.getInstance());
    }

    SlackAlertService(SlackProperties slackProperties, Slack slack) {
        this.slackProperties = slackProperties;
        this.slack = slack;
    }

    /**
     * Send alert for a job whose automatic retries are exhausted.
     * Runs asynchronously to not block the retry path.
     */
    @Async
    public void sendMaxRetriesExceededAlert(JobConfig config, String lastError) {
        if (!isConfigured()) {
            log.warn("Slack alerting is disabled or webhook URL not configured. Job {} reached max retries but no alert was sent.", config.getJobName());
            return;
        }

        try {
            var payload = buildMaxRetriesPayload(config, lastError);
            var response = slack.send(slackProperties.getWebhookUrl(), payload);

            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert. Response code: {}, body: {}", response.getCode(), response.getBody());
            } else {
                log.info("Slack alert sent for job {} max retries exceeded", config.getJobName());
            }
        } catch (Exception e) {
            log.error("Error sending Slack alert for job {}: {}", config.getJobName(), e.getMessage(), e);
        }
    }

    /**
     * Send generic error alert
     */
    @Async
    public void sendErrorAlert(String title, String message, String details) {
        if (!isConfigured()) {
            log.warn("Slack alerting disabled. Error alert not sent: {}", title);
            return;
        }

        try {
            var payload = Payload.builder()
                    .channel(slackProperties.getChannel())
                    .username(applicationName)
                    .iconEmoji(":warning:")
                    .text(":warning: *" + title + "*")
                    .attachments(List.of(
                            Attachment.builder()
                                    .color("warning")
                                    .text(message)
                                    .fields(details != null ? List.of(
                                            Field.builder()
                                                    .title("Details")
                                                    .value(truncate(details, 500))
                                                    .valueShortEnough(false)
                                                    .build()
                                    ) : List.of())
                                    .footer(applicationName)
                                    .ts(String.valueOf(Instant.now().getEpochSecond()))
                                    .build()
                    ))
                    .build();

            slack.send(slackProperties.getWebhookUrl(), payload);
        } catch (Exception e) {
            log.error("Error sending Slack error alert: {}", e.getMessage(), e);
        }
    }

    private boolean isConfigured() {
        return slackProperties.isEnabled() && slackProperties.getWebhookUrl() != null && !slackProperties.getWebhookUrl().isBlank();
    }

    private Payload buildMaxRetriesPayload(JobConfig config, String lastError) {
        var jobName = config.getJobName();
        var lastRunAt = config.getLastRunAt() != null ? DATE_FORMATTER.format(config.getLastRunAt()) : "never";

        return Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":rotating_light:")
                .text(":rotating_light: *Automation Job Failed After Max Retries - Manual Trigger Required*")
                .attachments(List.of(
                        Attachment.builder()
                                .color("danger")
                                .title(config.getDisplayName() + " (" + jobName + ")")
                                .titleLink(buildJobLink(jobName))
                                .fields(Arrays.asList(
                                        Field.builder()
                                                .title("Category")
                                                .value(config.getCategory().getDisplayName())
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Schedule")
                                                .value(config.getCronSchedule())
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Retries")
                                                .value(config.getRetryCount() + " / " + config.getMaxRetries())
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Last Run")
                                                .value(lastRunAt)
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Last Error")
                                                .value("```" + truncate(lastError != null ? lastError : "Unknown error", 400) + "```")
                                                .valueShortEnough(false)
                                                .build()
                                ))
                                .footer(applicationName + " | Please investigate and run the job manually")
                                .ts(String.valueOf(Instant.now().getEpochSecond()))
                                .build()
                ))
                .build();
    }

    private String buildJobLink(String jobName) {
        return slackProperties.getDashboardBaseUrl() + "/automation/" + jobName;
    }

    private String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
