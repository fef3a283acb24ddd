package org.javai.jobguard.config;

import org.javai.jobguard.poll.PollConfig;
import org.javai.jobguard.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;

/**
 * Builds {@link RetryConfig} and {@link PollConfig} once, at process start, from environment-style
 * overrides. The resulting values are passed explicitly to executors and pollers; nothing in the
 * retry or poll loops reads the environment.
 *
 * <p>Each setting is resolved from a system property first, then an environment variable:
 * <ul>
 *   <li>{@code jobguard.retry.maxAttempts} / {@code JOBGUARD_RETRY_MAX_ATTEMPTS} (default 3)</li>
 *   <li>{@code jobguard.retry.initialDelay} / {@code JOBGUARD_RETRY_INITIAL_DELAY} (default 5s)</li>
 *   <li>{@code jobguard.retry.maxDelay} / {@code JOBGUARD_RETRY_MAX_DELAY} (default 60s)</li>
 *   <li>{@code jobguard.retry.backoffMultiplier} / {@code JOBGUARD_RETRY_BACKOFF_MULTIPLIER} (default 2.0)</li>
 *   <li>{@code jobguard.poll.interval} / {@code JOBGUARD_POLL_INTERVAL} (default 30s)</li>
 *   <li>{@code jobguard.poll.timeout} / {@code JOBGUARD_POLL_TIMEOUT} (default 30m)</li>
 * </ul>
 * The first three settings also fall back to the older {@code TEST_RETRY_MAX_ATTEMPTS},
 * {@code TEST_RETRY_INITIAL_DELAY} and {@code TEST_RETRY_MAX_DELAY} variables.
 * A value that cannot be parsed is logged and replaced by the default. Values that parse but
 * break the config's invariants (e.g. maxDelay below initialDelay) are rejected.
 */
public final class RetryConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(RetryConfigLoader.class);

    static final Setting MAX_ATTEMPTS = new Setting("jobguard.retry.maxAttempts", "JOBGUARD_RETRY_MAX_ATTEMPTS",
            "TEST_RETRY_MAX_ATTEMPTS");
    static final Setting INITIAL_DELAY = new Setting("jobguard.retry.initialDelay", "JOBGUARD_RETRY_INITIAL_DELAY",
            "TEST_RETRY_INITIAL_DELAY");
    static final Setting MAX_DELAY = new Setting("jobguard.retry.maxDelay", "JOBGUARD_RETRY_MAX_DELAY",
            "TEST_RETRY_MAX_DELAY");
    static final Setting BACKOFF_MULTIPLIER = new Setting("jobguard.retry.backoffMultiplier", "JOBGUARD_RETRY_BACKOFF_MULTIPLIER");
    static final Setting POLL_INTERVAL = new Setting("jobguard.poll.interval", "JOBGUARD_POLL_INTERVAL");
    static final Setting POLL_TIMEOUT = new Setting("jobguard.poll.timeout", "JOBGUARD_POLL_TIMEOUT");

    private final Function<String, String> systemProperties;
    private final Function<String, String> environment;

    /**
     * @param systemProperties looks up a system property, returning null when unset
     * @param environment looks up an environment variable, returning null when unset
     */
    public RetryConfigLoader(Function<String, String> systemProperties, Function<String, String> environment) {
        this.systemProperties = Objects.requireNonNull(systemProperties, "systemProperties must not be null");
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
    }

    /**
     * A loader reading the JVM's system properties and the process environment.
     */
    public static RetryConfigLoader fromSystem() {
        return new RetryConfigLoader(System::getProperty, System::getenv);
    }

    public RetryConfig retryConfig() {
        int maxAttempts = resolve(MAX_ATTEMPTS, RetryConfig.DEFAULT_MAX_ATTEMPTS, Integer::parseInt);
        Duration initialDelay = resolve(INITIAL_DELAY, RetryConfig.DEFAULT_INITIAL_DELAY, DurationParser::parse);
        Duration maxDelay = resolve(MAX_DELAY, RetryConfig.DEFAULT_MAX_DELAY, DurationParser::parse);
        double multiplier = resolve(BACKOFF_MULTIPLIER, RetryConfig.DEFAULT_BACKOFF_MULTIPLIER, Double::parseDouble);

        try {
            RetryConfig config = new RetryConfig(maxAttempts, initialDelay, maxDelay, multiplier);
            logger.debug("Retry config resolved: {}", config);
            return config;
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid retry configuration ("
                    + MAX_ATTEMPTS.envVar() + ", " + INITIAL_DELAY.envVar() + ", "
                    + MAX_DELAY.envVar() + ", " + BACKOFF_MULTIPLIER.envVar() + "): " + e.getMessage(), e);
        }
    }

    public PollConfig pollConfig() {
        Duration interval = resolve(POLL_INTERVAL, PollConfig.DEFAULT_INTERVAL, DurationParser::parse);
        Duration timeout = resolve(POLL_TIMEOUT, PollConfig.DEFAULT_TIMEOUT, DurationParser::parse);

        try {
            PollConfig config = new PollConfig(interval, timeout);
            logger.debug("Poll config resolved: {}", config);
            return config;
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid poll configuration ("
                    + POLL_INTERVAL.envVar() + ", " + POLL_TIMEOUT.envVar() + "): " + e.getMessage(), e);
        }
    }

    private <T> T resolve(Setting setting, T defaultValue, Function<String, T> parser) {
        String source = setting.sysProp();
        String raw = systemProperties.apply(setting.sysProp());
        if (raw == null || raw.isBlank()) {
            source = setting.envVar();
            raw = environment.apply(setting.envVar());
        }
        if ((raw == null || raw.isBlank()) && setting.legacyEnvVar() != null) {
            source = setting.legacyEnvVar();
            raw = environment.apply(setting.legacyEnvVar());
        }
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return parser.apply(raw.trim());
        } catch (IllegalArgumentException e) {
            logger.warn("Ignoring {}={}: {}. Using default {}", source, raw, e.getMessage(), defaultValue);
            return defaultValue;
        }
    }

    /**
     * @param legacyEnvVar older variable name still honoured after {@code envVar}, or null
     */
    record Setting(String sysProp, String envVar, String legacyEnvVar) {

        Setting(String sysProp, String envVar) {
            this(sysProp, envVar, null);
        }
    }
}
