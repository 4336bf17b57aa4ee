package com.staybot.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Flat key/value configuration.
 *
 * <p>Lookup order: explicit {@code --config} file, then {@code ./config.properties},
 * then the classpath {@code config.properties}, then the built-in defaults table.
 * Typed getters never throw on malformed values; they fall back instead.
 */
public final class Config {

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

    public static Config load(Path workingDir) {
        return load(workingDir, null);
    }

    public static Config load(Path workingDir, Path explicitFile) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            System.err.println("WARN: failed to read classpath config.properties: " + e.getMessage());
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            config.loadOverride(local);
        }

        if (explicitFile != null) {
            Path resolved = workingDir.resolve(explicitFile).normalize();
            if (!Files.isRegularFile(resolved)) {
                throw new ConfigException("config file not found: " + resolved);
            }
            config.loadOverride(resolved);
        }
        return config;
    }

    /**
     * Build a Config from an in-memory map, bypassing every file source.
     */
    public static Config fromMap(Path workingDir, Map<String, ?> values) {
        Config config = new Config(workingDir);
        if (values != null) {
            for (Map.Entry<String, ?> entry : values.entrySet()) {
                String key = entry.getKey() == null ? "" : entry.getKey().trim();
                if (key.isEmpty()) {
                    continue;
                }
                String value = entry.getValue() == null ? "" : String.valueOf(entry.getValue());
                config.overrideProps.setProperty(key, value);
                config.props.setProperty(key, value);
            }
        }
        return config;
    }

    private void loadOverride(Path file) {
        Properties loaded = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            loaded.load(in);
        } catch (IOException e) {
            throw new ConfigException("failed to read " + file + ": " + e.getMessage(), e);
        }
        overrideProps.putAll(loaded);
        props.putAll(loaded);
    }

    public Path workingDir() {
        return workingDir;
    }

    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public boolean getBoolean(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return false;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    public boolean getBoolean(String key, boolean fallback) {
        if (getString(key).isEmpty()) {
            return fallback;
        }
        return getBoolean(key);
    }

    public int getInt(String key) {
        return getInt(key, parseInt(DEFAULTS.get(key), 0));
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public long getLong(String key, long fallback) {
        String value = getString(key);
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    public double getDouble(String key) {
        return getDouble(key, parseDouble(DEFAULTS.get(key), 0.0));
    }

    public double getDouble(String key, double fallback) {
        return parseDouble(getString(key), fallback);
    }

    /**
     * Resolves the value against the working directory; blank resolves to the working directory itself.
     */
    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String token : value.split("[,;]")) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    public String requireString(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            throw new ConfigException("missing required config: " + key);
        }
        return value;
    }

    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        if (!nonBlank(overrideProps.getProperty(key)).isEmpty()) {
            return "override";
        }
        if (!nonBlank(resourceProps.getProperty(key)).isEmpty()) {
            return "resource";
        }
        return "default";
    }

    public static Map<String, String> defaults() {
        return DEFAULTS;
    }

    private static String nonBlank(String raw) {
        return raw == null ? "" : raw.trim();
    }

    private static int parseInt(String value, int fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    private static double parseDouble(String value, double fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new LinkedHashMap<>();

        defaults.put("outputs.dir", "outputs");
        defaults.put("db.path", "outputs/staybot.db");
        defaults.put("db.busy_timeout_ms", "5000");
        defaults.put("db.sql_log.enabled", "false");

        defaults.put("search.destination", "București, România");
        defaults.put("search.check_in", "");
        defaults.put("search.check_out", "");
        defaults.put("search.days_ahead", "30");
        defaults.put("search.nights", "2");
        defaults.put("search.guests", "2");
        defaults.put("search.max_price", "500");
        defaults.put("search.currency", "RON");
        defaults.put("search.property_types", "hotel,apartment");
        defaults.put("search.min_rating", "7.0");
        defaults.put("search.high_quality_only", "false");
        defaults.put("sources", "booking");

        defaults.put("agent.new_items_window_hours", "24");
        defaults.put("agent.price_drop_threshold_pct", "10");
        defaults.put("agent.retention_days", "30");
        defaults.put("agent.backup_before_cleanup", "true");
        defaults.put("agent.target_price_ratio", "0.8");

        defaults.put("schedule.search_hours", "6");
        defaults.put("schedule.price_alert_minutes", "30");
        defaults.put("schedule.cleanup_days", "1");
        defaults.put("schedule.heartbeat_minutes", "15");
        defaults.put("schedule.heartbeat.enabled", "true");
        defaults.put("scheduler.tick_seconds", "30");
        defaults.put("scheduler.stop_timeout_seconds", "5");

        defaults.put("fetch.timeout_sec", "30");
        defaults.put("fetch.max_results", "25");
        defaults.put("fetch.booking.base_url", "https://www.booking.com");
        defaults.put("fetch.user_agent", "Mozilla/5.0 (X11; Linux x86_64) StayBot/1.0");

        defaults.put("email.enabled", "true");
        defaults.put("email.smtp_host", "smtp.gmail.com");
        defaults.put("email.smtp_port", "587");
        defaults.put("email.subject_prefix", "[StayBot]");
        defaults.put("mail.dry_run", "false");

        defaults.put("currency.rates", "EUR:RON=4.98,USD:RON=4.52,RON:EUR=0.20,RON:USD=0.22,USD:EUR=0.92,EUR:USD=1.09");

        return Collections.unmodifiableMap(defaults);
    }
}
