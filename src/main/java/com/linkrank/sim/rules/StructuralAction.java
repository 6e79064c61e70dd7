package com.linkrank.sim.rules;

import com.linkrank.sim.api.ValidationException;

import java.util.Locale;

public enum StructuralAction {
    ADD,
    REMOVE;

    /** Parses {@code add} or {@code remove}, case-insensitive. Blank means ADD. */
    public static StructuralAction fromString(String text) {
        if (text == null || text.isBlank())
            return ADD;
        switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "add":
                return ADD;
            case "remove":
                return REMOVE;
            default:
                throw new ValidationException("Unknown structural action: " + text);
        }
    }
}
