package com.kreasipositif.ipcacorrection.domain;

import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;

/**
 * Formatting and conversion helpers for year-month periods in UTC.
 */
public final class Periods {

    private Periods() {
    }

    public static String label(YearMonth period) {
        return "%02d/%04d".formatted(period.getMonthValue(), period.getYear());
    }

    /** Parses a "MM/YYYY" label. */
    public static YearMonth parseLabel(String label) {
        String[] parts = label.split("/");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Not a MM/YYYY period: " + label);
        }
        return YearMonth.of(Integer.parseInt(parts[1]), Integer.parseInt(parts[0]));
    }

    public static Instant startOfDay(YearMonth period, int day) {
        return period.atDay(day).atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    public static Instant endOfDay(YearMonth period, int day) {
        return period.atDay(day).atTime(23, 59, 59).toInstant(ZoneOffset.UTC);
    }

    public static YearMonth of(Instant instant) {
        return YearMonth.from(instant.atZone(ZoneOffset.UTC));
    }
}
