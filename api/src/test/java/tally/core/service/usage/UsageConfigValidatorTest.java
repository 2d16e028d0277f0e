package tally.core.service.usage;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.when;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tally.core.model.common.ConfigurationException;
import tally.testing.TestConfigs;

@DisplayName("UsageConfigValidator")
class UsageConfigValidatorTest {

    @Test
    @DisplayName("should accept the defaults")
    void shouldAcceptDefaults() {
        assertDoesNotThrow(() -> UsageConfigValidator.validate(TestConfigs.usage(2)));
    }

    @Test
    @DisplayName("should accept a TTL of exactly three intervals")
    void shouldAcceptMinimumTtl() {
        var config = TestConfigs.usage(Duration.ofHours(3), Duration.ofHours(1), 2);

        assertDoesNotThrow(() -> UsageConfigValidator.validate(config));
    }

    @Test
    @DisplayName("should reject a TTL shorter than three intervals")
    void shouldRejectShortTtl() {
        var config = TestConfigs.usage(Duration.ofHours(2), Duration.ofHours(1), 2);

        assertThrows(ConfigurationException.class, () -> UsageConfigValidator.validate(config));
    }

    @Test
    @DisplayName("should reject a non-positive interval")
    void shouldRejectZeroInterval() {
        var config = TestConfigs.usage(Duration.ofDays(7), Duration.ZERO, 2);

        assertThrows(ConfigurationException.class, () -> UsageConfigValidator.validate(config));
    }

    @Test
    @DisplayName("should reject negative retries and empty batches")
    void shouldRejectInvalidAggregationSettings() {
        var negativeRetries = TestConfigs.usage(-1);
        var emptyBatch = TestConfigs.usage(2);
        when(emptyBatch.aggregation().batchSize()).thenReturn(0);

        assertThrows(ConfigurationException.class, () -> UsageConfigValidator.validate(negativeRetries));
        assertThrows(ConfigurationException.class, () -> UsageConfigValidator.validate(emptyBatch));
    }
}
