package com.example.aurawatch.service;

import com.example.aurawatch.config.MonitorConfig;
import com.example.aurawatch.model.ColorMode;
import com.example.aurawatch.model.EpochWindow;
import com.example.aurawatch.model.PlannedSlot;
import com.example.aurawatch.model.ValidatorIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.function.Supplier;

/**
 * Operator-facing console output: epoch headers and the own-slot schedule.
 */
@Component
@Slf4j
public class ScheduleReporter {
    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    private static final String CYAN = "36";
    private static final String YELLOW = "33";
    private static final String MAGENTA = "35";
    private static final String BLUE = "34";
    private static final String GREEN = "32";
    private static final String DIM = "90";

    private final PrintStream out;
    private final Supplier<ZoneId> zone;
    private final boolean colors;

    /**
     * The output zone is resolved when a schedule is printed, after the runner has validated it.
     */
    @Autowired
    public ScheduleReporter(MonitorConfig config) {
        this(System.out, config::outputZone, colorsEnabled(config.getColor()));
    }

    public ScheduleReporter(PrintStream out, ZoneId zone, boolean colors) {
        this(out, () -> zone, colors);
    }

    private ScheduleReporter(PrintStream out, Supplier<ZoneId> zone, boolean colors) {
        this.out = out;
        this.zone = zone;
        this.colors = colors;
    }

    static boolean colorsEnabled(ColorMode mode) {
        switch (mode) {
            case ALWAYS:
                return true;
            case NEVER:
                return false;
            default:
                return System.console() != null;
        }
    }

    public void epoch(EpochWindow window) {
        out.println();
        out.printf("epoch=%s / start_slot=%s / end_slot=%s%n",
            wrap(String.valueOf(window.getEpoch()), CYAN),
            wrap(String.valueOf(window.getStartSlot()), YELLOW),
            wrap(String.valueOf(window.getEndSlot()), YELLOW));
    }

    public void identity(ValidatorIdentity identity) {
        out.printf("author=%s%n", wrap(identity.toHex(), MAGENTA));
        out.println();
    }

    public void authoritySetChanged(int previousLen, int newLen) {
        out.println();
        out.printf("authority set changed (len %d -> %d)%n", previousLen, newLen);
    }

    public void notAnAuthority(long epoch, int authorities) {
        log.warn("epoch={}, authorities={}; author not in current authorities; skip.", epoch, authorities);
    }

    public void schedule(List<PlannedSlot> slots) {
        ZoneId outputZone = zone.get();
        for (PlannedSlot slot : slots) {
            out.printf("slot %s: %s (UTC %s)%n",
                wrap(String.valueOf(slot.getSlot()), BLUE),
                wrap(format(slot.getPlannedTime(), outputZone), GREEN),
                wrap(format(slot.getPlannedTime(), ZoneOffset.UTC), DIM));
        }
    }

    static String format(Instant instant, ZoneId zone) {
        return FORMATTER.format(instant.atZone(zone));
    }

    private String wrap(String s, String code) {
        if (!colors) {
            return s;
        }
        return "\u001b[" + code + "m" + s + "\u001b[0m";
    }
}
