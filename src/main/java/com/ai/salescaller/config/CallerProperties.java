package com.ai.salescaller.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Conversation thresholds and script personalization ({@code caller.*}).
 *
 * <p>The low-confidence threshold and retry count are tuning knobs, not invariants.
 */
@Component
@ConfigurationProperties(prefix = "caller")
public class CallerProperties {

    /** Speech recognized below this confidence is treated as not heard. */
    private double confidenceThreshold = 0.5;

    /** Re-prompts allowed per step before taking the "unknown" branch. */
    private int maxRetriesPerStep = 1;

    /** Consecutive provider/extractor failures that end the call with system_error. */
    private int maxConsecutiveFailures = 3;

    private Duration sessionTtl = Duration.ofMinutes(10);

    private Duration sweepInterval = Duration.ofSeconds(60);

    /** How long the id of an ended call is remembered, so late webhooks for it are turned away. */
    private Duration finishedCallRetention = Duration.ofHours(1);

    /** Pause between consecutive calls of a bulk request, unless the request names its own. */
    private Duration bulkCallSpacing = Duration.ofSeconds(5);

    private int bulkMaxCustomers = 50;

    private String botName = "Sarah";

    private String dealershipName = "Premier Auto";

    private String defaultCarModel = "one of our vehicles";

    private String defaultCustomerName = "Valued Customer";

    /** Built-in voice of the telephony provider, used for degraded prompts. */
    private String voice = "Polly.Joanna-Neural";

    private int gatherTimeoutSeconds = 8;

    private boolean seedDemoCustomers = false;

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public void setConfidenceThreshold(double confidenceThreshold) {
        this.confidenceThreshold = confidenceThreshold;
    }

    public int getMaxRetriesPerStep() {
        return maxRetriesPerStep;
    }

    public void setMaxRetriesPerStep(int maxRetriesPerStep) {
        this.maxRetriesPerStep = maxRetriesPerStep;
    }

    public int getMaxConsecutiveFailures() {
        return maxConsecutiveFailures;
    }

    public void setMaxConsecutiveFailures(int maxConsecutiveFailures) {
        this.maxConsecutiveFailures = maxConsecutiveFailures;
    }

    public Duration getSessionTtl() {
        return sessionTtl;
    }

    public void setSessionTtl(Duration sessionTtl) {
        this.sessionTtl = sessionTtl;
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    public void setSweepInterval(Duration sweepInterval) {
        this.sweepInterval = sweepInterval;
    }

    public String getBotName() {
        return botName;
    }

    public void setBotName(String botName) {
        this.botName = botName;
    }

    public String getDealershipName() {
        return dealershipName;
    }

    public void setDealershipName(String dealershipName) {
        this.dealershipName = dealershipName;
    }

    public String getDefaultCarModel() {
        return defaultCarModel;
    }

    public void setDefaultCarModel(String defaultCarModel) {
        this.defaultCarModel = defaultCarModel;
    }

    public String getDefaultCustomerName() {
        return defaultCustomerName;
    }

    public void setDefaultCustomerName(String defaultCustomerName) {
        this.defaultCustomerName = defaultCustomerName;
    }

    public String getVoice() {
        return voice;
    }

    public void setVoice(String voice) {
        this.voice = voice;
    }

    public int getGatherTimeoutSeconds() {
        return gatherTimeoutSeconds;
    }

    public void setGatherTimeoutSeconds(int gatherTimeoutSeconds) {
        this.gatherTimeoutSeconds = gatherTimeoutSeconds;
    }

    public boolean isSeedDemoCustomers() {
        return seedDemoCustomers;
    }

    public void setSeedDemoCustomers(boolean seedDemoCustomers) {
        this.seedDemoCustomers = seedDemoCustomers;
    }

    public Duration getFinishedCallRetention() {
        return finishedCallRetention;
    }

    public void setFinishedCallRetention(Duration finishedCallRetention) {
        this.finishedCallRetention = finishedCallRetention;
    }

    public Duration getBulkCallSpacing() {
        return bulkCallSpacing;
    }

    public void setBulkCallSpacing(Duration bulkCallSpacing) {
        this.bulkCallSpacing = bulkCallSpacing;
    }

    public int getBulkMaxCustomers() {
        return bulkMaxCustomers;
    }

    public void setBulkMaxCustomers(int bulkMaxCustomers) {
        this.bulkMaxCustomers = bulkMaxCustomers;
    }
}
