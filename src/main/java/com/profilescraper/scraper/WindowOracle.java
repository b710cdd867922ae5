package com.profilescraper.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Answers "may the scraper run right now?" against a configured {@link OperatingWindow}.
 * <p>
 * A timestamp is permitted iff its weekday is one of the window's days and its minute of day lies in
 * {@code [start, end]}, both ends inclusive. The timezone is resolved once at construction; an unknown
 * zone name falls back to UTC and is logged, never thrown.
 *
 * @since 1.0
 */
public class WindowOracle {
    private static final Logger logger = LoggerFactory.getLogger(WindowOracle.class);
    private static final DateTimeFormatter HM = DateTimeFormatter.ofPattern("HH:mm");

    private final OperatingWindow window;
    private final ZoneId zone;
    private final Clock clock;

    public WindowOracle(OperatingWindow window) {
        this(window, Clock.systemUTC());
    }

    public WindowOracle(OperatingWindow window, Clock clock) {
        this.window = window;
        this.zone = resolveZone(window.zoneName());
        this.clock = clock;
    }

    /**
     * Evaluates the current instant of this oracle's clock.
     */
    public WindowDecision evaluateNow() {
        return evaluate(clock.instant());
    }

    public WindowDecision evaluate(Instant now) {
        return evaluate(now.atZone(zone));
    }

    /**
     * Evaluates a timestamp after converting it into the configured zone.
     * @param now timestamp in any zone
     * @return decision with a reason distinguishing wrong day, before window and after window
     */
    public WindowDecision evaluate(ZonedDateTime now) {
        ZonedDateTime local = now.withZoneSameInstant(zone);
        String dayName = local.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH);
        LocalTime minute = local.toLocalTime().withSecond(0).withNano(0);

        if (!window.days().contains(local.getDayOfWeek())) {
            return new WindowDecision(false, WindowDecision.Status.WRONG_DAY,
                "Outside operating days: " + dayName + " is not one of " + describeDays());
        }
        if (minute.isBefore(window.start())) {
            return new WindowDecision(false, WindowDecision.Status.BEFORE_WINDOW,
                "Before operating window: " + minute.format(HM) + " is earlier than " + describeHours());
        }
        if (minute.isAfter(window.end())) {
            return new WindowDecision(false, WindowDecision.Status.AFTER_WINDOW,
                "After operating window: " + minute.format(HM) + " is later than " + describeHours());
        }
        return new WindowDecision(true, WindowDecision.Status.OPEN,
            "Within operating window: " + dayName + " " + minute.format(HM) + " in " + describeHours());
    }

    public ZoneId zone() {
        return zone;
    }

    private String describeHours() {
        return window.start().format(HM) + "-" + window.end().format(HM) + " " + zone.getId();
    }

    private String describeDays() {
        return window.days().stream()
            .sorted()
            .map(d -> d.getDisplayName(TextStyle.SHORT, Locale.ENGLISH))
            .collect(Collectors.joining(",", "[", "]"));
    }

    static ZoneId resolveZone(String name) {
        if (name == null || name.isBlank()) {
            logger.warn("No timezone configured; using UTC for the operating window.");
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(name);
        } catch (DateTimeException e) {
            logger.warn("Invalid timezone '{}' ({}); falling back to UTC for the operating window.", name, e.getMessage());
            return ZoneOffset.UTC;
        }
    }
}
