package com.agentsubstrate.engine.reflection;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Parts of a reflection the caller wants; {@code all} selects every part.
 */
public enum FocusArea {
    QUALITY("quality"),
    LEARNING("learning"),
    GAPS("gaps"),
    OUTCOMES("outcomes"),
    ALL("all");

    private final String value;

    FocusArea(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
