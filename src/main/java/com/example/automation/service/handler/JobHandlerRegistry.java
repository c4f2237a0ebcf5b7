package com.example.automation.service.handler;

import com.example.automation.config.AutomationProperties;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Registry for job handlers.
 * <p>
 * Automatically discovers all ScheduledJob beans.
 * Provides lookup by job name.
 */
@Slf4j
@Component
public class JobHandlerRegistry {

    private final Map<String, ScheduledJob> handlers = new LinkedHashMap<>();
    private final List<ScheduledJob> handlerBeans;
    private final AutomationProperties properties;

    public JobHandlerRegistry(List<ScheduledJob> handlerBeans, AutomationProperties properties) {
        this.handlerBeans = handlerBeans;
        this.properties = properties;
    }

    @PostConstruct
    public void initialize() {
        for (var handler : handlerBeans) {
            var name = handler.getJobName();
            if (handlers.containsKey(name)) {
                log.warn("Duplicate handler for job {}: {} will override {}",
                        name, handler.getClass().getSimpleName(),
                        handlers.get(name).getClass().getSimpleName());
            }
            handlers.put(name, handler);
            log.info("Discovered handler for job {}: {}", name, handler.getClass().getSimpleName());
        }

        for (var name : properties.getJobs().keySet()) {
            if (!handlers.containsKey(name)) {
                log.warn("No handler available for catalog job: {}", name);
            }
        }
        for (var name : handlers.keySet()) {
            if (!properties.getJobs().containsKey(name)) {
                log.warn("Handler for job {} has no catalog entry and will not be scheduled", name);
            }
        }
    }

    /**
     * Get handler for a job
     *
     * @param jobName The job name
     * @return Optional containing the handler if found
     */
    public Optional<ScheduledJob> getHandler(String jobName) {
        return Optional.ofNullable(handlers.get(jobName));
    }

    public boolean hasHandler(String jobName) {
        return handlers.containsKey(jobName);
    }

    /**
     * Get all handlers in discovery order
     */
    public Collection<ScheduledJob> getHandlers() {
        return Collections.unmodifiableCollection(handlers.values());
    }

    public int getHandlerCount() {
        return handlers.size();
    }
}
