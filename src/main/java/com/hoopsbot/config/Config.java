package com.hoopsbot.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Array;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Layered key/value configuration.
 *
 * <p>Lookup order: working-directory {@code config.properties}, classpath
 * {@code config.properties}, then the built-in defaults below. Blank values count as unset.
 */
public final class Config {
    private static final Logger LOG = LogManager.getLogger(Config.class);

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            LOG.warn("classpath config.properties unreadable, using defaults: {}", e.getMessage());
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.overrideProps.load(in);
                config.props.putAll(config.overrideProps);
            } catch (IOException e) {
                LOG.warn("failed to read {}: {}", local, e.getMessage());
            }
        }

        return config;
    }

    /**
     * Build Config from a nested map, e.g. {@code Map.of("lineup", Map.of("bench_slots", 4))}.
     * Nested keys are joined with dots; lists become comma separated values.
     */
    public static Config fromConfigurationProperties(Path workingDir, Map<String, ?> rawProperties) {
        Config config = new Config(workingDir);
        flattenInto(config, "", rawProperties);
        return config;
    }

    public static Config defaultsOnly() {
        return new Config(Path.of(".").toAbsolutePath().normalize());
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
        try {
            return Long.parseLong(getString(key).trim());
        } catch (NumberFormatException e) {
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
     * Resolves a path value against the working directory; an unset key yields the
     * working directory itself.
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

    public ResolvedValue resolve(String key) {
        return new ResolvedValue(
                key == null ? "" : key,
                getString(key),
                sourceOf(key)
        );
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

    private String nonBlank(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim();
    }

    private static void flattenInto(Config config, String prefix, Object value) {
        if (config == null || value == null) {
            return;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = entry.getKey() == null ? "" : entry.getKey().toString().trim();
                if (key.isEmpty()) {
                    continue;
                }
                String fullKey = prefix.isEmpty() ? key : prefix + "." + key;
                flattenInto(config, fullKey, entry.getValue());
            }
            return;
        }
        if (value instanceof List<?> list) {
            List<String> parts = new ArrayList<>();
            for (Object item : list) {
                parts.add(stringify(item));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        if (value.getClass().isArray()) {
            int len = Array.getLength(value);
            List<String> parts = new ArrayList<>(len);
            for (int i = 0; i < len; i++) {
                parts.add(stringify(Array.get(value, i)));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        putBoundValue(config, prefix, stringify(value));
    }

    private static void putBoundValue(Config config, String key, String value) {
        if (key == null || key.trim().isEmpty()) {
            return;
        }
        String normalizedKey = key.trim();
        String normalizedValue = value == null ? "" : value;
        config.overrideProps.setProperty(normalizedKey, normalizedValue);
        config.props.setProperty(normalizedKey, normalizedValue);
    }

    private static String stringify(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    private static int parseInt(String value, int fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static double parseDouble(String value, double fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("outputs.dir", "outputs");
        defaults.put("app.zone", "America/New_York");

        defaults.put("snapshot.path", "snapshot.json");
        defaults.put("snapshot.max_free_agents", "150");

        defaults.put("scores.cache.enabled", "true");
        defaults.put("scores.cache.path", "outputs/cache/score_cache.json");
        defaults.put("scores.cache.max_age_hours", "20");

        defaults.put("untouchables.weekday", "");

        defaults.put("match.fuzzy_threshold", "90");

        defaults.put("value.untouchable_bonus", "10000");
        defaults.put("value.missing_rank", "999");

        defaults.put("lineup.slot.C", "C");
        defaults.put("lineup.slot.PG", "PG");
        defaults.put("lineup.slot.SG", "SG");
        defaults.put("lineup.slot.SF", "SF");
        defaults.put("lineup.slot.PF", "PF");
        defaults.put("lineup.slot.G", "PG,SG,G");
        defaults.put("lineup.slot.F", "SF,PF,F");
        defaults.put("lineup.slot.UTIL", "*");
        defaults.put("lineup.display_order", "C,PG,SG,G,SF,PF,F,UTIL");
        defaults.put("lineup.stable_slots", "C,PG,SG,SF,PF");
        defaults.put("lineup.flex_slots", "C,G,F,UTIL,UTIL");
        defaults.put("lineup.bench_slots", "3");
        defaults.put("lineup.il_slots", "3");
        defaults.put("lineup.low_confidence_rank", "60");
        defaults.put("lineup.bench_target", "G:1,F:1,C:1");
        defaults.put("lineup.hard_out_statuses", "INJ,O,NA");

        defaults.put("waiver.disqualify_statuses", "INJ,O,NA,SUSP,IL");
        defaults.put("waiver.require_position_fit", "true");
        defaults.put("waiver.max_swaps", "10");
        defaults.put("waiver.max_rank", "96");
        defaults.put("waiver.min_mpg", "28");
        defaults.put("waiver.min_games_30", "5");

        defaults.put("il.move_statuses", "INJ,O");

        defaults.put("email.enabled", "true");
        defaults.put("email.smtp_host", "smtp.gmail.com");
        defaults.put("email.smtp_port", "587");
        defaults.put("email.smtp_user", "");
        defaults.put("email.smtp_pass", "");
        defaults.put("email.from", "");
        defaults.put("email.to", "");
        defaults.put("email.subject_prefix", "[HoopsBot]");
        defaults.put("mail.dry_run", "false");
        defaults.put("mail.fail_fast", "false");
        defaults.put("mail.dry_run.dir", "outputs/mail_dry_run");

        return Collections.unmodifiableMap(defaults);
    }

    public static final class ResolvedValue {
        public final String key;
        public final String value;
        public final String source;

        public ResolvedValue(String key, String value, String source) {
            this.key = key == null ? "" : key;
            this.value = value == null ? "" : value;
            this.source = source == null ? "default" : source;
        }
    }
}
