package org.javai.jobguard.config;

import org.javai.jobguard.poll.PollConfig;
import org.javai.jobguard.retry.RetryConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class RetryConfigLoaderTest {

    private final Map<String, String> properties = new HashMap<>();
    private final Map<String, String> environment = new HashMap<>();
    private final RetryConfigLoader loader = new RetryConfigLoader(properties::get, environment::get);

    @Test
    void nothingSet_usesDefaults() {
        assertThat(loader.retryConfig()).isEqualTo(RetryConfig.defaults());
        assertThat(loader.pollConfig()).isEqualTo(PollConfig.defaults());
    }

    @Test
    void environmentOverridesDefaults() {
        environment.put("JOBGUARD_RETRY_MAX_ATTEMPTS", "5");
        environment.put("JOBGUARD_RETRY_INITIAL_DELAY", "500ms");
        environment.put("JOBGUARD_RETRY_MAX_DELAY", "1m30s");
        environment.put("JOBGUARD_RETRY_BACKOFF_MULTIPLIER", "1.5");
        environment.put("JOBGUARD_POLL_INTERVAL", "10s");
        environment.put("JOBGUARD_POLL_TIMEOUT", "PT2H");

        RetryConfig retry = loader.retryConfig();
        PollConfig poll = loader.pollConfig();

        assertThat(retry).isEqualTo(new RetryConfig(5, Duration.ofMillis(500), Duration.ofSeconds(90), 1.5));
        assertThat(poll).isEqualTo(PollConfig.of(Duration.ofSeconds(10), Duration.ofHours(2)));
    }

    @Test
    void legacyTestRetryVariables_areHonoured() {
        environment.put("TEST_RETRY_MAX_ATTEMPTS", "4");
        environment.put("TEST_RETRY_INITIAL_DELAY", "2s");
        environment.put("TEST_RETRY_MAX_DELAY", "20s");

        assertThat(loader.retryConfig()).isEqualTo(RetryConfig.of(4, Duration.ofSeconds(2), Duration.ofSeconds(20)));
    }

    @Test
    void jobguardVariables_winOverLegacyOnes() {
        environment.put("TEST_RETRY_MAX_ATTEMPTS", "4");
        environment.put("JOBGUARD_RETRY_MAX_ATTEMPTS", "6");

        assertThat(loader.retryConfig().maxAttempts()).isEqualTo(6);
    }

    @Test
    void negativeDelay_isRejected() {
        environment.put("JOBGUARD_RETRY_INITIAL_DELAY", "-5s");

        assertThatThrownBy(loader::retryConfig)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("JOBGUARD_RETRY_INITIAL_DELAY");
    }

    @Test
    void systemPropertyWinsOverEnvironment() {
        environment.put("JOBGUARD_RETRY_MAX_ATTEMPTS", "5");
        properties.put("jobguard.retry.maxAttempts", "7");

        assertThat(loader.retryConfig().maxAttempts()).isEqualTo(7);
    }

    @Test
    void blankPropertyFallsThroughToEnvironment() {
        properties.put("jobguard.poll.interval", " ");
        environment.put("JOBGUARD_POLL_INTERVAL", "1m");

        assertThat(loader.pollConfig().interval()).isEqualTo(Duration.ofMinutes(1));
    }

    @Test
    void unparseableValue_fallsBackToDefault() {
        environment.put("JOBGUARD_RETRY_MAX_ATTEMPTS", "lots");
        environment.put("JOBGUARD_RETRY_INITIAL_DELAY", "soon");
        environment.put("JOBGUARD_RETRY_BACKOFF_MULTIPLIER", "double");

        RetryConfig retry = loader.retryConfig();

        assertThat(retry.maxAttempts()).isEqualTo(RetryConfig.DEFAULT_MAX_ATTEMPTS);
        assertThat(retry.initialDelay()).isEqualTo(RetryConfig.DEFAULT_INITIAL_DELAY);
        assertThat(retry.backoffMultiplier()).isEqualTo(RetryConfig.DEFAULT_BACKOFF_MULTIPLIER);
    }

    @Test
    void parseableButInvalidValues_areRejectedNamingTheSettings() {
        environment.put("JOBGUARD_RETRY_INITIAL_DELAY", "2m");
        environment.put("JOBGUARD_RETRY_MAX_DELAY", "1m");

        assertThatThrownBy(loader::retryConfig)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("JOBGUARD_RETRY_MAX_DELAY")
                .hasMessageContaining("maxDelay must be >= initialDelay");
    }

    @Test
    void zeroPollInterval_isRejected() {
        environment.put("JOBGUARD_POLL_INTERVAL", "0");

        assertThatThrownBy(loader::pollConfig)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("JOBGUARD_POLL_INTERVAL");
    }

    @Test
    void fromSystem_readsJvmProperties() {
        String key = "jobguard.retry.maxAttempts";
        String previous = System.getProperty(key);
        System.setProperty(key, "9");
        try {
            assertThat(RetryConfigLoader.fromSystem().retryConfig().maxAttempts()).isEqualTo(9);
        } finally {
            if (previous == null) {
                System.clearProperty(key);
            } else {
                System.setProperty(key, previous);
            }
        }
    }
}
