package com.queryhub.domain.model;

import java.util.Locale;

public enum IntegrationMode {
    CLOUD,
    SELF_HOSTED;

    public static IntegrationMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return CLOUD;
        }
        return IntegrationMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
