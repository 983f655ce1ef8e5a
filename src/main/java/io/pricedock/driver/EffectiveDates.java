package io.pricedock.driver;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the price list's effective date from its file name.
 * Accepts {@code YYYY_MM_DD}, {@code YYYY-MM-DD}, {@code YYYY.MM.DD} and {@code YYYYMMDD}.
 */
public final class EffectiveDates {
    private static final Pattern SEPARATED = Pattern.compile(
            "(?<!\\d)(20\\d{2})[._-](0[1-9]|1[0-2])[._-](0[1-9]|[12]\\d|3[01])(?!\\d)");
    private static final Pattern COMPACT = Pattern.compile(
            "(?<!\\d)(20\\d{2})(0[1-9]|1[0-2])(0[1-9]|[12]\\d|3[01])(?!\\d)");

    private EffectiveDates() {
    }

    public static Optional<LocalDate> fromFileName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        Matcher m = SEPARATED.matcher(name);
        if (m.find()) {
            return calendarDate(m);
        }
        m = COMPACT.matcher(name);
        if (m.find()) {
            return calendarDate(m);
        }
        return Optional.empty();
    }

    public static LocalDate fromFileNameOr(String name, LocalDate fallback) {
        return fromFileName(name).orElse(fallback);
    }

    private static Optional<LocalDate> calendarDate(Matcher m) {
        try {
            return Optional.of(LocalDate.of(
                    Integer.parseInt(m.group(1)),
                    Integer.parseInt(m.group(2)),
                    Integer.parseInt(m.group(3))
            ));
        } catch (DateTimeException e) {
            // 2026-02-30 and friends
            return Optional.empty();
        }
    }
}
