package com.example.aurawatch.config;

import com.example.aurawatch.exception.ConfigException;
import com.example.aurawatch.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MonitorConfig validation and derived values.
 */
class MonitorConfigTest {

    private MonitorConfig config;

    @BeforeEach
    void setUp() {
        config = new MonitorConfig();
        config.setKeystorePath("/data/keystore");
    }

    @Test
    void testDefaultsAreValid() {
        assertDoesNotThrow(config::validate);
        assertEquals(1200, config.scanLength());
        assertFalse(config.isEpochPinned());
        assertEquals("61757261", config.keyTypeTag());
    }

    @Test
    void testScanLengthOverride() {
        config.setSlots(50L);

        assertEquals(50, config.scanLength());
    }

    @Test
    void testMissingKeystoreRejected() {
        config.setKeystorePath(" ");

        ConfigException e = assertThrows(ConfigException.class, config::validate);
        assertEquals(ErrorCode.INVALID_CONFIG, e.getErrorCode());
        assertEquals(2, e.getExitCode());
    }

    @Test
    void testNonPositiveValuesRejected() {
        config.setEpochSize(0);
        assertThrows(ConfigException.class, config::validate);

        config.setEpochSize(6);
        config.setSlots(0L);
        assertThrows(ConfigException.class, config::validate);

        config.setSlots(null);
        config.setWatchSeconds(0);
        assertThrows(ConfigException.class, config::validate);
    }

    @Test
    void testKeyTypeMustBeFourCharacters() {
        config.setKeyType("babe1");

        assertThrows(ConfigException.class, config::validate);
    }

    @Test
    void testOutputZone() {
        config.setTz("utc");
        assertEquals(ZoneOffset.UTC, config.outputZone());

        config.setTz("local");
        assertEquals(ZoneId.systemDefault(), config.outputZone());

        config.setTz("+02:00");
        assertEquals(ZoneOffset.ofHours(2), config.outputZone());

        config.setTz("Europe/Berlin");
        assertEquals(ZoneId.of("Europe/Berlin"), config.outputZone());
    }

    @Test
    void testInvalidZoneRejected() {
        config.setTz("Mars/Olympus");

        ConfigException e = assertThrows(ConfigException.class, config::validate);
        assertTrue(e.getMessage().contains("Mars/Olympus"));
    }

    @Test
    void testPinnedEpochOverflowRejected() {
        config.setEpochSize(6);
        config.setEpoch(Long.MAX_VALUE / 6);

        ConfigException e = assertThrows(ConfigException.class, config::validate);
        assertEquals(ErrorCode.INVALID_CONFIG, e.getErrorCode());

        config.setEpoch(Long.MAX_VALUE / 6 - 1);
        assertDoesNotThrow(config::validate);

        config.setEpoch(Long.MAX_VALUE);
        assertThrows(ConfigException.class, config::validate);
    }

    @Test
    void testScanLengthOverflowRejected() {
        config.setEpochSize(6);
        config.setEpoch(Long.MAX_VALUE / 6 - 1);
        config.setSlots(100L);

        assertThrows(ConfigException.class, config::validate);
    }
}
