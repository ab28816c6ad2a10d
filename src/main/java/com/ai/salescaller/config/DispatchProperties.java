package com.ai.salescaller.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Outcome dispatch: worker pool, retry/backoff and the workflow endpoint ({@code dispatch.*}).
 */
@Component
@ConfigurationProperties(prefix = "dispatch")
public class DispatchProperties {

    private int workers = 2;

    /** Un-started jobs kept before the oldest is shed. */
    private int queueCapacity = 100;

    private int maxAttempts = 5;

    private Duration baseBackoff = Duration.ofSeconds(1);

    private double backoffFactor = 2.0;

    private Duration maxBackoff = Duration.ofSeconds(30);

    /** Blank disables the workflow notification. */
    private String workflowUrl = "";

    private Duration workflowTimeout = Duration.ofSeconds(15);

    public int getWorkers() {
        return workers;
    }

    public void setWorkers(int workers) {
        this.workers = workers;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getBaseBackoff() {
        return baseBackoff;
    }

    public void setBaseBackoff(Duration baseBackoff) {
        this.baseBackoff = baseBackoff;
    }

    public double getBackoffFactor() {
        return backoffFactor;
    }

    public void setBackoffFactor(double backoffFactor) {
        this.backoffFactor = backoffFactor;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
        this.maxBackoff = maxBackoff;
    }

    public String getWorkflowUrl() {
        return workflowUrl;
    }

    public void setWorkflowUrl(String workflowUrl) {
        this.workflowUrl = workflowUrl;
    }

    public Duration getWorkflowTimeout() {
        return workflowTimeout;
    }

    public void setWorkflowTimeout(Duration workflowTimeout) {
        this.workflowTimeout = workflowTimeout;
    }
}
