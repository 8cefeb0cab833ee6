package com.vidnyan.trustgate.domain.rule;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Finding severity levels.
 */
public enum Severity {
    ERROR,    // Invalidates the report
    WARNING,  // Reported, lowers confidence
    INFO,     // Informational only
    HINT;     // Editor hint, no confidence penalty

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
