package com.botprobe.verify.config;

import com.botprobe.common.logging.LogLevel;
import com.botprobe.common.logging.SubsystemLogger;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads, caches and resolves the probe configuration file.
 * <p>
 * {@code ${VAR}} and {@code ${VAR:-default}} placeholders are substituted from
 * the environment before the JSON is parsed. A missing file yields an empty
 * config; an unreadable or malformed one is a {@link ProbeConfigException}.
 */
@Slf4j
public class ProbeConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, ProbeConfig> cache;
    private final Path configPath;
    private final Function<String, String> env;

    public ProbeConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System::getenv);
    }

    public ProbeConfigService(Path configPath, Duration cacheTtl) {
        this(configPath, cacheTtl, System::getenv);
    }

    ProbeConfigService(Path configPath, Duration cacheTtl, Function<String, String> env) {
        // Expand ~ to user home directory
        String pathStr = configPath.toString();
        if (pathStr.startsWith("~")) {
            configPath = Path.of(System.getProperty("user.home") + pathStr.substring(1));
        }
        this.configPath = configPath;
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public ProbeConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public ProbeConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    /**
     * Names of the configured probe profiles, in file order.
     */
    public Set<String> profileNames() {
        return loadConfig().getProbes().keySet();
    }

    /**
     * Build validated settings for a profile: built-in defaults, overlaid with
     * the file's {@code defaults}, overlaid with {@code probes[profile]}.
     *
     * @throws ProbeConfigException if the profile is unknown or the merged
     *                              values are invalid
     */
    public ProbeSettings resolveSettings(String profile) {
        ProbeConfig config = loadConfig();
        ProbeConfig.ProbeEntry entry = config.getProbes().get(profile);
        if (entry == null) {
            throw new ProbeConfigException("Unknown probe profile '" + profile + "' in " + configPath
                    + " (known: " + config.getProbes().keySet() + ")");
        }
        ProbeConfig.ProbeEntry defaults = config.getDefaults() != null
                ? config.getDefaults()
                : new ProbeConfig.ProbeEntry();
        try {
            return toSettings(defaults, entry);
        } catch (ProbeConfigException e) {
            throw new ProbeConfigException("Probe profile '" + profile + "': " + e.getMessage(), e);
        }
    }

    /**
     * Apply the file's logging section to the subsystem loggers.
     */
    public void applyLogging() {
        ProbeConfig.LoggingConfig logging = loadConfig().getLogging();
        if (logging == null) {
            return;
        }
        SubsystemLogger.setMinLevel(LogLevel.normalize(logging.getLevel(), LogLevel.TRACE));
        List<String> subsystems = logging.getSubsystems();
        SubsystemLogger.setSubsystemFilter(subsystems != null ? subsystems.toArray(String[]::new) : null);
    }

    // =========================================================================
    // Internals
    // =========================================================================

    private ProbeConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return applyDefaults(new ProbeConfig());
        }
        String raw;
        try {
            raw = Files.readString(configPath);
        } catch (IOException e) {
            throw new ProbeConfigException("Failed to read config from " + configPath, e);
        }
        try {
            ProbeConfig config = objectMapper.readValue(substituteEnvVars(raw), ProbeConfig.class);
            config = config != null ? config : new ProbeConfig();
            log.info("Config loaded from: {}", configPath);
            return applyDefaults(config);
        } catch (JsonProcessingException e) {
            throw new ProbeConfigException("Malformed config " + configPath + ": " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.apply(varName);
            if (value == null) {
                value = defaultValue != null ? defaultValue : "";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    ProbeConfig applyDefaults(ProbeConfig config) {
        if (config.getProbes() == null) {
            config.setProbes(new LinkedHashMap<>());
        }
        return config;
    }

    static ProbeSettings toSettings(ProbeConfig.ProbeEntry defaults, ProbeConfig.ProbeEntry entry) {
        ProbeSettings.Builder builder = ProbeSettings.builder(
                pick(entry.getResponderIdentity(), defaults.getResponderIdentity()),
                pick(entry.getChannelIdentity(), defaults.getChannelIdentity()));

        Integer maxWait = pick(entry.getMaxWaitSeconds(), defaults.getMaxWaitSeconds());
        if (maxWait != null) {
            builder.maxWait(Duration.ofSeconds(maxWait));
        }
        Integer pollInterval = pick(entry.getPollIntervalSeconds(), defaults.getPollIntervalSeconds());
        if (pollInterval != null) {
            builder.pollInterval(Duration.ofSeconds(pollInterval));
        }
        Integer maxRetries = pick(entry.getMaxRetries(), defaults.getMaxRetries());
        if (maxRetries != null) {
            builder.maxRetries(maxRetries);
        }
        Integer retryDelay = pick(entry.getRetryDelaySeconds(), defaults.getRetryDelaySeconds());
        if (retryDelay != null) {
            builder.retryDelay(Duration.ofSeconds(retryDelay));
        }
        Boolean autoDelete = pick(entry.getAutoDeleteOnFailure(), defaults.getAutoDeleteOnFailure());
        if (autoDelete != null) {
            builder.autoDeleteOnFailure(autoDelete);
        }
        Double factor = pick(entry.getRetryBackoffFactor(), defaults.getRetryBackoffFactor());
        if (factor != null) {
            builder.retryBackoffFactor(factor);
        }
        Integer maxRetryDelay = pick(entry.getMaxRetryDelaySeconds(), defaults.getMaxRetryDelaySeconds());
        if (maxRetryDelay != null) {
            builder.maxRetryDelay(Duration.ofSeconds(maxRetryDelay));
        }
        return builder.build();
    }

    private static <T> T pick(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
