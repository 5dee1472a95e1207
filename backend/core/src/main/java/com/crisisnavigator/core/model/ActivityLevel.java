package com.crisisnavigator.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ActivityLevel {
    SUCCESS,
    INFO,
    WARNING,
    ERROR;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
