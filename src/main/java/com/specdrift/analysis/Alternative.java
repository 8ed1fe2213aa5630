package com.specdrift.analysis;

import java.util.Locale;

public enum Alternative {
    TWO_SIDED("two-sided"),
    LESS("less"),
    GREATER("greater");

    private final String label;

    Alternative(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Alternative fromLabel(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (Alternative alternative : values()) {
            if (alternative.label.equals(normalized)) {
                return alternative;
            }
        }
        throw new InvalidInputException("Unknown alternative '" + value + "'; expected two-sided, less or greater");
    }
}
