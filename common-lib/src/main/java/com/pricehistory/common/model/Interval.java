package com.pricehistory.common.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.pricehistory.common.exception.InvalidArgumentException;

import java.util.Locale;

/**
 * Bar width for intraday series. Ignored for every other {@link Period}.
 */
public enum Interval {
    ONE_MIN("1min", 1),
    FIVE_MIN("5min", 5),
    FIFTEEN_MIN("15min", 15),
    THIRTY_MIN("30min", 30),
    SIXTY_MIN("60min", 60);

    private final String value;
    private final int minutes;

    Interval(String value, int minutes) {
        this.value = value;
        this.minutes = minutes;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public int minutes() {
        return minutes;
    }

    /**
     * @throws InvalidArgumentException when {@code raw} is not one of 1min, 5min, 15min, 30min, 60min
     */
    public static Interval fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidArgumentException("interval must be specified");
        }
        String normalized = raw.strip().toLowerCase(Locale.ROOT);
        for (Interval i : values()) {
            if (i.value.equals(normalized)) {
                return i;
            }
        }
        throw new InvalidArgumentException(
            "Unsupported interval '" + raw + "'. Expected one of 1min, 5min, 15min, 30min, 60min");
    }
}
