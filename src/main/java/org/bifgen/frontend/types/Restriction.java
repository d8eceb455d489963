package org.bifgen.frontend.types;

import java.util.Objects;

/**
 * A restriction on the values a constant integer operand may take.
 * For {@link RestrictionKind#BITS} only {@code value1} (the bit width) is meaningful.
 *
 * @param kind The restriction kind.
 * @param value1 The bit width, lower bound, or first permitted value.
 * @param value2 The upper bound or second permitted value.
 */
public record Restriction(RestrictionKind kind, int value1, int value2) {

    /** The absence of a restriction. */
    public static final Restriction NONE = new Restriction(RestrictionKind.NONE, 0, 0);

    public Restriction {
        Objects.requireNonNull(kind, "kind");
    }

    public static Restriction bits(int width) {
        return new Restriction(RestrictionKind.BITS, width, 0);
    }

    public static Restriction range(int low, int high) {
        return new Restriction(RestrictionKind.RANGE, low, high);
    }

    public static Restriction varRange(int low, int high) {
        return new Restriction(RestrictionKind.VAR_RANGE, low, high);
    }

    public static Restriction values(int first, int second) {
        return new Restriction(RestrictionKind.VALUES, first, second);
    }

    public boolean isPresent() {
        return kind != RestrictionKind.NONE;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case NONE -> "none";
            case BITS -> "<" + value1 + ">";
            case RANGE -> "<" + value1 + "," + value2 + ">";
            case VAR_RANGE -> "[" + value1 + "," + value2 + "]";
            case VALUES -> "{" + value1 + "," + value2 + "}";
        };
    }
}
