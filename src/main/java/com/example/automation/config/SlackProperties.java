package com.example.automation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Slack configuration properties
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "slack")
public class SlackProperties {
    private String webhookUrl;
    private String channel = "#automation-alerts";
    private boolean enabled = true;

    /**
     * Base URL of the admin dashboard, used for links in alerts
     */
    private String dashboardBaseUrl = "http://localhost:3000";
}
