package org.bifgen.frontend.types;

/**
 * Ways in which a constant integer operand can be restricted.
 */
public enum RestrictionKind {
    /** No restriction. */
    NONE,
    /** {@code <n>}: the value is unsigned and fits in n bits. */
    BITS,
    /** {@code <x,y>}: the value lies in [x,y], always checked. */
    RANGE,
    /** {@code [x,y]}: the value lies in [x,y], checked only when the argument is a constant. */
    VAR_RANGE,
    /** {@code {x,y}}: the value is exactly x or y. */
    VALUES;

    /**
     * @return The enumerator emitted for this kind in the generated declarations.
     */
    public String emittedName() {
        return "RES_" + name();
    }
}
