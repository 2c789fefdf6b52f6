package com.eqtree.model;

/**
 * Fixed vocabulary of equation categories, listed in classification priority order.
 * {@link #PIECEWISE} is assigned outside the cascade.
 */
public enum EquationType {
    INEQUALITY_LINEAR("inequality_linear"),
    INEQUALITY_POLYNOMIAL("inequality_polynomial"),
    INEQUALITY("inequality"),
    CONSTANT("constant"),
    LINEAR("linear"),
    QUADRATIC("quadratic"),
    POLYNOMIAL("polynomial"),
    EXPONENTIAL("exponential"),
    LOGARITHMIC("logarithmic"),
    RADICAL("radical"),
    POWER("power"),
    RATIONAL("rational"),
    ABSOLUTE("absolute"),
    PARAMETRIC("parametric"),
    FUNCTIONAL("functional"),
    IDENTITY("identity"),
    OTHER("other"),
    PIECEWISE("piecewise");

    private final String tag;

    EquationType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static EquationType fromTag(String tag) {
        for (EquationType type : values()) {
            if (type.tag.equals(tag)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown equation type: " + tag);
    }
}
