package io.mailagenda.config;

import io.mailagenda.core.InFlightRecoveryPolicy;
import io.mailagenda.core.InvalidRowPolicy;

import java.time.Duration;

/**
 * Runtime configuration for scheduling, rate limiting and retry behavior.
 *
 * <p>Plain bean; the Spring Boot starter binds it to the {@code mail-agenda} prefix.
 */
public class MailAgendaProperties {
    private boolean enabled = true;
    private Duration processEvery = Duration.ofSeconds(5);
    private int batchSize = 50;
    private int maxConcurrency = 1; // 1 = deliver inline on the poller thread

    // rate limiting, global across all jobs
    private int ratePerWindow = 8;
    private Duration rateWindow = Duration.ofMinutes(1);
    private int burst = 0; // 0 = no burst ceiling below ratePerWindow

    // retry
    private int maxAttempts = 4;
    private Duration initialRetryDelay = Duration.ofMinutes(1);
    private double retryMultiplier = 2.0;
    private Duration maxRetryDelay = Duration.ofHours(1);
    private double retryJitter = 0.2;

    private InFlightRecoveryPolicy inFlightRecovery = InFlightRecoveryPolicy.FAIL_TRANSIENT;
    private InvalidRowPolicy invalidRowPolicy = InvalidRowPolicy.RECORD_FAILED;
    private String timezone = "UTC";
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private boolean ensureIndexesOnStartup = false;
    private String from;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getProcessEvery() {
        return processEvery;
    }

    public void setProcessEvery(Duration processEvery) {
        this.processEvery = processEvery;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public int getRatePerWindow() {
        return ratePerWindow;
    }

    public void setRatePerWindow(int ratePerWindow) {
        this.ratePerWindow = ratePerWindow;
    }

    public Duration getRateWindow() {
        return rateWindow;
    }

    public void setRateWindow(Duration rateWindow) {
        this.rateWindow = rateWindow;
    }

    public int getBurst() {
        return burst;
    }

    public void setBurst(int burst) {
        this.burst = burst;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getInitialRetryDelay() {
        return initialRetryDelay;
    }

    public void setInitialRetryDelay(Duration initialRetryDelay) {
        this.initialRetryDelay = initialRetryDelay;
    }

    public double getRetryMultiplier() {
        return retryMultiplier;
    }

    public void setRetryMultiplier(double retryMultiplier) {
        this.retryMultiplier = retryMultiplier;
    }

    public Duration getMaxRetryDelay() {
        return maxRetryDelay;
    }

    public void setMaxRetryDelay(Duration maxRetryDelay) {
        this.maxRetryDelay = maxRetryDelay;
    }

    public double getRetryJitter() {
        return retryJitter;
    }

    public void setRetryJitter(double retryJitter) {
        this.retryJitter = retryJitter;
    }

    public InFlightRecoveryPolicy getInFlightRecovery() {
        return inFlightRecovery;
    }

    public void setInFlightRecovery(InFlightRecoveryPolicy inFlightRecovery) {
        this.inFlightRecovery = inFlightRecovery;
    }

    public InvalidRowPolicy getInvalidRowPolicy() {
        return invalidRowPolicy;
    }

    public void setInvalidRowPolicy(InvalidRowPolicy invalidRowPolicy) {
        this.invalidRowPolicy = invalidRowPolicy;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public String getFrom() {
        return from;
    }

    public void setFrom(String from) {
        this.from = from;
    }
}
