package com.p14n.pubsub;

import java.time.Duration;
import java.util.Map;

import com.p14n.pubsub.data.BrokerConfig;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AppTest {

    @Test
    void emptyEnvironmentUsesDefaults() {
        var settings = App.settingsFrom(Map.of());

        assertEquals(App.DEFAULT_PORT, settings.port());
        assertEquals(new BrokerConfig(), settings.broker());
        assertNull(settings.otlpEndpoint());
    }

    @Test
    void environmentOverridesDefaults() {
        var settings = App.settingsFrom(Map.of(
                "APP_PORT", "9000",
                "APP_MAX_CONCURRENT_PULLS", "3",
                "APP_MAX_PULL_WAIT_MS", "1500",
                "APP_SWEEP_INTERVAL_MS", "250",
                "APP_PUSH_BATCH_SIZE", "20",
                "APP_OTLP_ENDPOINT", " http://collector:4317 "));

        assertEquals(9000, settings.port());
        assertEquals(new BrokerConfig(3, Duration.ofMillis(1500), Duration.ofMillis(250), 20), settings.broker());
        assertEquals("http://collector:4317", settings.otlpEndpoint());
    }

    @Test
    void malformedNumberNamesTheVariable() {
        var e = assertThrows(IllegalArgumentException.class,
                () -> App.settingsFrom(Map.of("APP_PORT", "eighty")));
        assertTrue(e.getMessage().contains("APP_PORT"));
    }

    @Test
    void invalidLimitsAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> App.settingsFrom(Map.of("APP_MAX_CONCURRENT_PULLS", "0")));
    }
}
