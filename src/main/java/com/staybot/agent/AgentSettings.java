package com.staybot.agent;

import com.staybot.config.Config;
import com.staybot.config.ConfigException;
import com.staybot.scheduler.Cadence;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Orchestrator tuning: detection windows, thresholds, retention and task cadences.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class AgentSettings {
    public final Duration newItemsWindow;
    public final double priceDropThresholdPct;
    public final Duration retention;
    public final boolean backupBeforeCleanup;
    public final Path backupDir;
    /** Below-target alert level as a fraction of the max price; 0 disables the alert. */
    public final double targetPriceRatio;
    public final boolean highQualityOnly;
    public final Cadence searchCadence;
    public final Cadence priceAlertCadence;
    public final Cadence cleanupCadence;
    public final Cadence heartbeatCadence;
    public final boolean heartbeatEnabled;

    public static AgentSettings fromConfig(Config config) {
        int windowHours = positive(config, "agent.new_items_window_hours");
        double threshold = config.getDouble("agent.price_drop_threshold_pct");
        if (!(threshold > 0.0) || threshold >= 100.0) {
            throw new ConfigException("agent.price_drop_threshold_pct must be within (0, 100), got " + threshold);
        }
        double ratio = config.getDouble("agent.target_price_ratio");
        if (ratio < 0.0 || ratio > 1.0) {
            throw new ConfigException("agent.target_price_ratio must be within [0, 1], got " + ratio);
        }
        return AgentSettings.builder()
                .newItemsWindow(Duration.ofHours(windowHours))
                .priceDropThresholdPct(threshold)
                .retention(Duration.ofDays(positive(config, "agent.retention_days")))
                .backupBeforeCleanup(config.getBoolean("agent.backup_before_cleanup", true))
                .backupDir(config.getPath("outputs.dir").resolve("backups"))
                .targetPriceRatio(ratio)
                .highQualityOnly(config.getBoolean("search.high_quality_only", false))
                .searchCadence(Cadence.hours(positive(config, "schedule.search_hours")))
                .priceAlertCadence(Cadence.minutes(positive(config, "schedule.price_alert_minutes")))
                .cleanupCadence(Cadence.days(positive(config, "schedule.cleanup_days")))
                .heartbeatCadence(Cadence.minutes(positive(config, "schedule.heartbeat_minutes")))
                .heartbeatEnabled(config.getBoolean("schedule.heartbeat.enabled", true))
                .build();
    }

    private static int positive(Config config, String key) {
        int value = config.getInt(key);
        if (value <= 0) {
            throw new ConfigException(key + " must be a positive integer, got '" + config.getString(key) + "'");
        }
        return value;
    }
}
