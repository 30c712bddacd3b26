package com.bookcraft.generation.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 问题严重程度及扣分点数
 */
public enum IssueSeverity {

    CRITICAL("critical", 25),
    MAJOR("major", 15),
    MINOR("minor", 5);

    private final String code;
    private final int points;

    IssueSeverity(String code, int points) {
        this.code = code;
        this.points = points;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public int getPoints() {
        return points;
    }

    @JsonCreator
    public static IssueSeverity fromCode(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase();
        for (IssueSeverity severity : values()) {
            if (severity.code.equals(normalized)) {
                return severity;
            }
        }
        return null;
    }
}
