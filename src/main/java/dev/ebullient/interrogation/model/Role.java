package dev.ebullient.interrogation.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Role {
    INSTRUCTION("instruction"),
    USER("user"),
    CHARACTER("character");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Accepts the legacy role names written by older logs ("model", "system"). */
    @JsonCreator
    public static Role fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Missing role");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "instruction", "system" -> INSTRUCTION;
            case "user" -> USER;
            case "character", "model" -> CHARACTER;
            default -> throw new IllegalArgumentException("Unknown role: " + value);
        };
    }
}
