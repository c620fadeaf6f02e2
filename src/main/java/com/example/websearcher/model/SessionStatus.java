package com.example.websearcher.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SessionStatus {
    ACTIVE,
    PROCESSING,
    COMPLETED,
    ERROR;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR;
    }

    @JsonCreator
    public static SessionStatus fromValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
