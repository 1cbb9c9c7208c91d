package io.tempo4j.config;

import java.time.Duration;
import java.time.Period;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for the tempo4j scheduler.
 */
@ConfigurationProperties(prefix = "tempo")
public class SchedulerProperties {
    private boolean enabled = true;
    private int maxConcurrency = 0; // 0 = unbounded worker pool
    private Duration askTimeout = Duration.ofMinutes(10);
    private Period searchHorizon = Period.ofYears(5);
    private String defaultTimezone = "UTC";
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private boolean ensureIndexesOnStartup = false;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public Duration getAskTimeout() {
        return askTimeout;
    }

    public void setAskTimeout(Duration askTimeout) {
        this.askTimeout = askTimeout;
    }

    public Period getSearchHorizon() {
        return searchHorizon;
    }

    public void setSearchHorizon(Period searchHorizon) {
        this.searchHorizon = searchHorizon;
    }

    public String getDefaultTimezone() {
        return defaultTimezone;
    }

    public void setDefaultTimezone(String defaultTimezone) {
        this.defaultTimezone = defaultTimezone;
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
}
