package com.typstparser.ast;

/**
 * Units a numeric literal can carry.
 */
public enum Unit {
    PT("pt", "pt"),
    MM("mm", "mm"),
    CM("cm", "cm"),
    IN("in", "in"),
    RAD("rad", "rad"),
    DEG("deg", "deg"),
    EM("em", "em"),
    FR("fr", "fr"),
    PERCENT("percent", "%");

    private final String label;
    private final String suffix;

    Unit(String label, String suffix) {
        this.label = label;
        this.suffix = suffix;
    }

    /**
     * Serialized name of the unit.
     */
    public String label() {
        return label;
    }

    /**
     * The suffix written after the number in source text.
     */
    public String suffix() {
        return suffix;
    }

    public static Unit fromLabel(String label) {
        for (Unit unit : values()) {
            if (unit.label.equals(label)) {
                return unit;
            }
        }
        throw new IllegalArgumentException("Unknown unit: " + label);
    }
}
