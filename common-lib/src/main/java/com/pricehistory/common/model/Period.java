package com.pricehistory.common.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.pricehistory.common.exception.InvalidArgumentException;

import java.util.Locale;

/**
 * Sampling period of a price series.
 */
public enum Period {
    INTRADAY("intraday"),
    DAILY("daily"),
    WEEKLY("weekly"),
    MONTHLY("monthly");

    private final String value;

    Period(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Parses the wire value ({@code "daily"}) or the constant name ({@code "DAILY"}).
     *
     * @throws InvalidArgumentException for anything else, e.g. {@code "yearly"}
     */
    public static Period fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidArgumentException("period must be specified");
        }
        String normalized = raw.strip().toLowerCase(Locale.ROOT);
        for (Period p : values()) {
            if (p.value.equals(normalized)) {
                return p;
            }
        }
        throw new InvalidArgumentException(
            "Unsupported period '" + raw + "'. Expected one of intraday, daily, weekly, monthly");
    }
}
