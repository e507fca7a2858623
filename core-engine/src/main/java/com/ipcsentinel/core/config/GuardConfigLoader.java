package com.ipcsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Reads guard settings from YAML and lays them over {@link GuardConfig#defaults()}.
 *
 * <p>
 * A document only has to name what it changes. Nested sections are merged key
 * by key, so {@code patterns.automatedAttack.maxVariance: 50} keeps every
 * other pattern setting at its default. Lists ({@code thresholds},
 * {@code reservedChannelPrefixes}, {@code privilegedPrefixes}) replace the
 * default list as a whole. An explicit {@code null} keeps the current value.
 * </p>
 *
 * <p>
 * Unknown keys, values of the wrong type and duplicate keys are rejected.
 * Problems are reported with their dotted path and the source they came from,
 * then {@link GuardConfig#validate()} runs on the merged result.
 * </p>
 *
 * @since 1.0.0
 */
public final class GuardConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(GuardConfigLoader.class);

    /** Environment variable naming an override file. */
    public static final String ENV_CONFIG_PATH = "GUARD_CONFIG_PATH";

    /** Classpath resource bundled with the engine. */
    public static final String DEFAULT_RESOURCE = "guard-defaults.yml";

    private GuardConfigLoader() {
        // utility class — not instantiable
    }

    /**
     * The file named by {@value #ENV_CONFIG_PATH} when the variable is set,
     * the bundled {@value #DEFAULT_RESOURCE} otherwise.
     *
     * @throws IllegalArgumentException if the variable names a missing file
     * @throws IllegalStateException    if the merged configuration is invalid
     */
    public static GuardConfig load() {
        return load(System::getenv);
    }

    static GuardConfig load(UnaryOperator<String> env) {
        String override = env.apply(ENV_CONFIG_PATH);
        if (override != null && !override.isBlank()) {
            LOG.info("{} is set, reading guard settings from {}", ENV_CONFIG_PATH, override);
            return fromFile(override);
        }
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @throws IllegalArgumentException if there is no file at {@code path}
     * @throws IllegalStateException    if the merged configuration is invalid
     */
    public static GuardConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (Reader reader = Files.newBufferedReader(Path.of(path), StandardCharsets.UTF_8)) {
            return merge(GuardConfig.defaults(), reader, path);
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("No guard configuration file at " + path, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read guard configuration " + path, e);
        }
    }

    /**
     * @throws IllegalArgumentException if the resource is not on the classpath
     * @throws IllegalStateException    if the merged configuration is invalid
     */
    public static GuardConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream in = GuardConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Guard configuration resource " + resource
                    + " is not on the classpath");
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return merge(GuardConfig.defaults(), reader, "classpath:" + resource);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read guard configuration classpath:" + resource, e);
        }
    }

    /**
     * Merge an in-memory YAML document over the defaults.
     *
     * @throws IllegalStateException if the merged configuration is invalid
     */
    public static GuardConfig fromYaml(String yaml) {
        Objects.requireNonNull(yaml, "yaml must not be null");
        return merge(GuardConfig.defaults(), new StringReader(yaml), "inline YAML");
    }

    /**
     * Lay the document read from {@code reader} over {@code base} (which is
     * modified) and validate the result.
     *
     * @param source name used in log lines and error messages
     * @return {@code base}
     * @throws IllegalStateException if a key is unknown or mistyped, or the
     *                               merged configuration fails validation
     */
    public static GuardConfig merge(GuardConfig base, Reader reader, String source) {
        Objects.requireNonNull(base, "base config must not be null");
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Object document = new Yaml(new SafeConstructor(options)).load(reader);

        if (document == null) {
            LOG.warn("Guard configuration {} is empty, keeping defaults", source);
        } else {
            Overlay overlay = new Overlay();
            if (document instanceof Map<?, ?> root) {
                overlay.applyRoot(base, root);
            } else {
                overlay.problems.add("document root must be a mapping, got " + describe(document));
            }
            if (!overlay.problems.isEmpty()) {
                throw new IllegalStateException("Guard configuration " + source + " has "
                        + overlay.problems.size() + " problem(s):\n  - "
                        + String.join("\n  - ", overlay.problems));
            }
        }

        try {
            base.validate();
        } catch (IllegalStateException e) {
            throw new IllegalStateException(source + ": " + e.getMessage(), e);
        }

        LOG.info("Guard configuration {} applied: {} threshold(s), maxEvents={}, progressive blacklist {}",
                source, base.getThresholds().size(), base.getMaxEvents(),
                base.getProgressiveBlacklist().isEnabled() ? "on" : "off");
        return base;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + " '" + value + "'";
    }

    // ---------------------------------------------------------------
    // Section merging
    // ---------------------------------------------------------------

    /**
     * Walks one parsed document, writing recognised keys into the target
     * beans and collecting every problem with its dotted path.
     */
    private static final class Overlay {

        private final List<String> problems = new ArrayList<>();

        void applyRoot(GuardConfig target, Map<?, ?> root) {
            root.forEach((rawKey, value) -> {
                String key = String.valueOf(rawKey);
                if (value == null) {
                    return;
                }
                switch (key) {
                    case "maxEvents" -> asInt(key, value).ifPresent(target::setMaxEvents);
                    case "alertDedupWindowMs" -> asLong(key, value).ifPresent(target::setAlertDedupWindowMs);
                    case "eventRetentionMs" -> asLong(key, value).ifPresent(target::setEventRetentionMs);
                    case "requestRetentionMs" -> asLong(key, value).ifPresent(target::setRequestRetentionMs);
                    case "defaultBlacklistDurationMs" ->
                            asLong(key, value).ifPresent(target::setDefaultBlacklistDurationMs);
                    case "progressiveBlacklist" -> applyProgressive(target.getProgressiveBlacklist(), key, value);
                    case "reservedChannelPrefixes" ->
                            asStrings(key, value).ifPresent(target::setReservedChannelPrefixes);
                    case "thresholds" -> asThresholds(key, value).ifPresent(target::setThresholds);
                    case "patterns" -> applyPatterns(target.getPatterns(), key, value);
                    default -> unknown(key);
                }
            });
        }

        private void applyProgressive(ProgressiveBlacklistConfig target, String path, Object value) {
            section(path, value).forEach((rawKey, v) -> {
                String key = path + "." + rawKey;
                if (v == null) {
                    return;
                }
                switch (String.valueOf(rawKey)) {
                    case "enabled" -> asBoolean(key, v).ifPresent(target::setEnabled);
                    case "baseMs" -> asLong(key, v).ifPresent(target::setBaseMs);
                    case "maxMs" -> asLong(key, v).ifPresent(target::setMaxMs);
                    default -> unknown(key);
                }
            });
        }

        private void applyPatterns(PatternSettings target, String path, Object value) {
            section(path, value).forEach((rawKey, v) -> {
                String name = String.valueOf(rawKey);
                String key = path + "." + name;
                if (v == null) {
                    return;
                }
                switch (name) {
                    case "rapidChannelSwitching" -> applyRapidSwitching(target.getRapidChannelSwitching(), key, v);
                    case "privilegeEscalation" -> applyEscalation(target.getPrivilegeEscalation(), key, v);
                    case "ddos" -> applyDdos(target.getDdos(), key, v);
                    case "automatedAttack" -> applyAutomated(target.getAutomatedAttack(), key, v);
                    default -> unknown(key);
                }
            });
        }

        private void applyRapidSwitching(PatternSettings.RapidChannelSwitching target, String path, Object value) {
            section(path, value).forEach((rawKey, v) -> {
                String key = path + "." + rawKey;
                if (v == null) {
                    return;
                }
                switch (String.valueOf(rawKey)) {
                    case "minEvents" -> asInt(key, v).ifPresent(target::setMinEvents);
                    case "lookback" -> asInt(key, v).ifPresent(target::setLookback);
                    case "minDistinctChannels" -> asInt(key, v).ifPresent(target::setMinDistinctChannels);
                    case "maxSpanMs" -> asLong(key, v).ifPresent(target::setMaxSpanMs);
                    default -> unknown(key);
                }
            });
        }

        private void applyEscalation(PatternSettings.PrivilegeEscalation target, String path, Object value) {
            section(path, value).forEach((rawKey, v) -> {
                String key = path + "." + rawKey;
                if (v == null) {
                    return;
                }
                switch (String.valueOf(rawKey)) {
                    case "lookback" -> asInt(key, v).ifPresent(target::setLookback);
                    case "minAttempts" -> asInt(key, v).ifPresent(target::setMinAttempts);
                    case "privilegedPrefixes" -> asStrings(key, v).ifPresent(target::setPrivilegedPrefixes);
                    default -> unknown(key);
                }
            });
        }

        private void applyDdos(PatternSettings.Ddos target, String path, Object value) {
            section(path, value).forEach((rawKey, v) -> {
                String key = path + "." + rawKey;
                if (v == null) {
                    return;
                }
                switch (String.valueOf(rawKey)) {
                    case "lookback" -> asInt(key, v).ifPresent(target::setLookback);
                    case "minRateLimitEvents" -> asInt(key, v).ifPresent(target::setMinRateLimitEvents);
                    case "maxSpanMs" -> asLong(key, v).ifPresent(target::setMaxSpanMs);
                    default -> unknown(key);
                }
            });
        }

        private void applyAutomated(PatternSettings.AutomatedAttack target, String path, Object value) {
            section(path, value).forEach((rawKey, v) -> {
                String key = path + "." + rawKey;
                if (v == null) {
                    return;
                }
                switch (String.valueOf(rawKey)) {
                    case "minEvents" -> asInt(key, v).ifPresent(target::setMinEvents);
                    case "lookback" -> asInt(key, v).ifPresent(target::setLookback);
                    case "maxVariance" -> asDouble(key, v).ifPresent(target::setMaxVariance);
                    default -> unknown(key);
                }
            });
        }

        private Optional<List<ThresholdConfig>> asThresholds(String path, Object value) {
            if (!(value instanceof List<?> entries)) {
                mistyped(path, "a list of thresholds", value);
                return Optional.empty();
            }
            List<ThresholdConfig> thresholds = new ArrayList<>();
            for (int i = 0; i < entries.size(); i++) {
                String entryPath = path + "[" + i + "]";
                ThresholdConfig threshold = new ThresholdConfig();
                section(entryPath, entries.get(i)).forEach((rawKey, v) -> {
                    String key = entryPath + "." + rawKey;
                    switch (String.valueOf(rawKey)) {
                        case "eventType" -> asString(key, v).ifPresent(threshold::setEventType);
                        case "count" -> asInt(key, v).ifPresent(threshold::setCount);
                        case "windowMs" -> asLong(key, v).ifPresent(threshold::setWindowMs);
                        default -> unknown(key);
                    }
                });
                thresholds.add(threshold);
            }
            return Optional.of(thresholds);
        }

        // ---------------------------------------------------------------
        // Scalar coercion
        // ---------------------------------------------------------------

        private Map<?, ?> section(String path, Object value) {
            if (value instanceof Map<?, ?> map) {
                return map;
            }
            mistyped(path, "a mapping", value);
            return Map.of();
        }

        private Optional<Integer> asInt(String path, Object value) {
            if ((value instanceof Integer || value instanceof Long)
                    && ((Number) value).longValue() == ((Number) value).intValue()) {
                return Optional.of(((Number) value).intValue());
            }
            mistyped(path, "an integer", value);
            return Optional.empty();
        }

        private Optional<Long> asLong(String path, Object value) {
            if (value instanceof Integer || value instanceof Long) {
                return Optional.of(((Number) value).longValue());
            }
            mistyped(path, value instanceof BigInteger ? "a 64-bit integer" : "an integer", value);
            return Optional.empty();
        }

        private Optional<Double> asDouble(String path, Object value) {
            if (value instanceof Number n && !(value instanceof BigInteger)) {
                return Optional.of(n.doubleValue());
            }
            mistyped(path, "a number", value);
            return Optional.empty();
        }

        private Optional<Boolean> asBoolean(String path, Object value) {
            if (value instanceof Boolean b) {
                return Optional.of(b);
            }
            mistyped(path, "true or false", value);
            return Optional.empty();
        }

        private Optional<String> asString(String path, Object value) {
            if (value instanceof String s) {
                return Optional.of(s);
            }
            mistyped(path, "a string", value);
            return Optional.empty();
        }

        private Optional<List<String>> asStrings(String path, Object value) {
            if (!(value instanceof List<?> items)) {
                mistyped(path, "a list of strings", value);
                return Optional.empty();
            }
            List<String> strings = new ArrayList<>();
            for (int i = 0; i < items.size(); i++) {
                Object item = items.get(i);
                if (item instanceof String s) {
                    strings.add(s);
                } else {
                    mistyped(path + "[" + i + "]", "a string", item);
                }
            }
            return Optional.of(strings);
        }

        private void mistyped(String path, String expected, Object actual) {
            problems.add("'" + path + "' must be " + expected + ", got " + describe(actual));
        }

        private void unknown(String path) {
            problems.add("unknown key '" + path + "'");
        }
    }
}
