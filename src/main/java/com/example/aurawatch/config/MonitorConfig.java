package com.example.aurawatch.config;

import com.example.aurawatch.exception.ConfigException;
import com.example.aurawatch.exception.ErrorCode;
import com.example.aurawatch.model.ColorMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Operator settings, bound from {@code --monitor.*} command-line arguments
 * and {@code application.properties}.
 */
@Configuration
@ConfigurationProperties(prefix = "monitor")
@Data
public class MonitorConfig {

    /**
     * Node RPC endpoint. {@code ws://} and {@code wss://} are accepted and spoken as HTTP.
     */
    private String endpoint = "ws://127.0.0.1:9944";

    /**
     * Node keystore directory; the Aura public key is detected from its file names.
     */
    private String keystorePath;

    /**
     * Four-character key type of the consensus role.
     */
    private String keyType = "aura";

    private long epochSize = 1200;

    /**
     * Pins the monitored epoch instead of following the chain head.
     */
    private Long epoch;

    /**
     * Number of slots scanned from the epoch start, independent of the epoch size.
     */
    private Long slots;

    private long watchSeconds = 30;

    private boolean watch = false;

    /**
     * Output zone: UTC, local, +HH:MM / -HH:MM or an IANA zone id.
     */
    private String tz = "UTC";

    private ColorMode color = ColorMode.AUTO;

    /**
     * Finality marker at startup. Blocks up to and including it are never scanned.
     */
    private long finalityStartBlock = 0;

    private Store store = new Store();

    @Data
    public static class Store {
        private boolean enabled = true;
        private String path = "./aura_schedule";
    }

    public boolean isEpochPinned() {
        return epoch != null;
    }

    public long scanLength() {
        return slots != null ? slots : epochSize;
    }

    /**
     * Hex tag that prefixes keystore file names for {@link #keyType}.
     */
    public String keyTypeTag() {
        StringBuilder sb = new StringBuilder();
        for (byte b : keyType.getBytes(StandardCharsets.US_ASCII)) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }

    public ZoneId outputZone() {
        String s = tz == null ? "" : tz.trim();
        if (s.equalsIgnoreCase("utc")) {
            return ZoneOffset.UTC;
        }
        if (s.equalsIgnoreCase("local")) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(s);
        } catch (DateTimeException e) {
            throw new ConfigException(ErrorCode.INVALID_CONFIG,
                "invalid --monitor.tz '" + s + "' (use UTC | local | +HH:MM | -HH:MM | Area/City)", e);
        }
    }

    /**
     * Checks every parameter before the monitor talks to the node.
     */
    public void validate() {
        if (endpoint == null || endpoint.isBlank()) {
            throw invalid("--monitor.endpoint must not be empty");
        }
        if (keystorePath == null || keystorePath.isBlank()) {
            throw invalid("--monitor.keystore-path is required");
        }
        if (keyType == null || keyType.length() != 4) {
            throw invalid("--monitor.key-type must be exactly 4 characters, got '" + keyType + "'");
        }
        if (epochSize <= 0) {
            throw invalid("--monitor.epoch-size must be positive, got " + epochSize);
        }
        if (epoch != null && epoch < 0) {
            throw invalid("--monitor.epoch must not be negative, got " + epoch);
        }
        if (slots != null && slots <= 0) {
            throw invalid("--monitor.slots must be positive, got " + slots);
        }
        if (epoch != null) {
            try {
                long startSlot = Math.multiplyExact(epoch, epochSize);
                Math.addExact(startSlot, Math.max(epochSize, scanLength()));
            } catch (ArithmeticException e) {
                throw new ConfigException(ErrorCode.INVALID_CONFIG, "--monitor.epoch " + epoch
                    + " is out of range for epoch size " + epochSize + ": its slot numbers overflow", e);
            }
        }
        if (watchSeconds <= 0) {
            throw invalid("--monitor.watch-seconds must be positive, got " + watchSeconds);
        }
        if (finalityStartBlock < 0) {
            throw invalid("--monitor.finality-start-block must not be negative, got " + finalityStartBlock);
        }
        outputZone();
    }

    private static ConfigException invalid(String message) {
        return new ConfigException(ErrorCode.INVALID_CONFIG, message);
    }
}
