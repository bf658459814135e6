package com.knowledgeinbox.store;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SourceKind {
    NOTE,
    URL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SourceKind fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("source kind must not be blank");
        }
        return SourceKind.valueOf(value.strip().toUpperCase(Locale.ROOT));
    }
}
