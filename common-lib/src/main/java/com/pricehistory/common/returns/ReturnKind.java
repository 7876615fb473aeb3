package com.pricehistory.common.returns;

import com.fasterxml.jackson.annotation.JsonValue;
import com.pricehistory.common.exception.InvalidArgumentException;

import java.util.Locale;

public enum ReturnKind {
    LOG("log"),
    ARITHMETIC("arithmetic");

    private final String value;

    ReturnKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static ReturnKind fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return LOG;
        }
        String normalized = raw.strip().toLowerCase(Locale.ROOT);
        for (ReturnKind k : values()) {
            if (k.value.equals(normalized)) {
                return k;
            }
        }
        throw new InvalidArgumentException("Unsupported return kind '" + raw + "'. Expected log or arithmetic");
    }
}
