package com.queryhub.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CountSource {
    PRIMARY,
    FALLBACK_PARTIAL,
    FALLBACK_COMPLETE;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
