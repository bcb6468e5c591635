package com.chimera.model;

import java.util.Locale;

/**
 * Generation persona. Selects the prompt modifier, the schema, and the parameter set.
 */
public enum Mode {

    BASE("base"),
    TALK("talk"),
    EXPERT("expert"),
    CREATIVE("creative");

    private final String id;

    Mode(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /**
     * Resolve a mode id. Null, blank and unknown ids resolve to {@link #BASE}.
     */
    public static Mode resolve(String id) {
        if (id == null) {
            return BASE;
        }
        return switch (id.trim().toLowerCase(Locale.ROOT)) {
            case "talk" -> TALK;
            case "expert" -> EXPERT;
            case "creative" -> CREATIVE;
            default -> BASE;
        };
    }

    /**
     * Whether the id names a mode explicitly, as opposed to falling back to base.
     */
    public static boolean isKnown(String id) {
        if (id == null) {
            return false;
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (Mode mode : values()) {
            if (mode.id.equals(normalized)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return id;
    }
}
