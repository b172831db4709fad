package com.xbleey.pricewatch.config;

import com.xbleey.pricewatch.support.TestPriceWatchProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalTime;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PriceWatchPropertiesTest {

    @Test
    void defaultsAreValid() {
        assertThatCode(() -> TestPriceWatchProperties.fast().validate()).doesNotThrowAnyException();
    }

    @Test
    void liveQueriesNeedApiUrl() {
        PriceWatchProperties properties = TestPriceWatchProperties.fast();
        properties.getPricing().setApiUrl(null);

        assertThatThrownBy(properties::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("api-url");

        properties.getPricing().setLiveQueryEnabled(false);
        assertThatCode(properties::validate).doesNotThrowAnyException();
    }

    @Test
    void floorAboveRateIsRejected() {
        PriceWatchProperties properties = TestPriceWatchProperties.fast();
        properties.getPricing().setRequestsPerSecond(1.0);
        properties.getPricing().setRequestsPerSecondFloor(2.0);

        assertThatThrownBy(properties::validate).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void floorDefaultsToConfiguredRate() {
        PriceWatchProperties properties = TestPriceWatchProperties.fast();
        properties.getPricing().setRequestsPerSecond(0.5);

        assertThat(properties.getPricing().effectiveFloor()).isEqualTo(0.5);
    }

    @Test
    void nonPositiveDurationsAreRejected() {
        PriceWatchProperties properties = TestPriceWatchProperties.fast();
        properties.getBackoff().setBase(Duration.ZERO);

        assertThatThrownBy(properties::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("backoff.base");
    }

    @Test
    void workersMustBePositive() {
        PriceWatchProperties properties = TestPriceWatchProperties.fast();
        properties.getCheck().setWorkers(0);

        assertThatThrownBy(properties::validate).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void ownerTimeOverridesAreParsed() {
        PriceWatchProperties properties = TestPriceWatchProperties.fast();
        properties.getDailySummary().setOwnerTimes(Map.of("42", "07:45"));

        assertThat(properties.getDailySummary().timeFor("42")).isEqualTo(LocalTime.of(7, 45));
        assertThat(properties.getDailySummary().timeFor("7")).isEqualTo(LocalTime.of(9, 0));
    }

    @Test
    void malformedOwnerTimeIsRejected() {
        PriceWatchProperties properties = TestPriceWatchProperties.fast();
        properties.getDailySummary().setOwnerTimes(Map.of("42", "7 o'clock"));

        assertThatThrownBy(properties::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("owner-times.42");
    }
}
