package com.campaignrl.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Competition {
    LOW, MODERATE, HIGH;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Competition fromValue(String raw) {
        return raw == null ? MODERATE : valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
