package org.bifgen.frontend.types;

import java.util.Arrays;
import java.util.Optional;

/**
 * The fixed-width vector shorthand tokens. Each token fully determines the
 * vector flags and element type of the descriptor it stands for.
 */
public enum VectorShorthand {
    VSC("vsc", BaseType.CHAR, Flavor.SIGNED),
    VUC("vuc", BaseType.CHAR, Flavor.UNSIGNED),
    VBC("vbc", BaseType.CHAR, Flavor.BOOL),
    VSS("vss", BaseType.SHORT, Flavor.SIGNED),
    VUS("vus", BaseType.SHORT, Flavor.UNSIGNED),
    VBS("vbs", BaseType.SHORT, Flavor.BOOL),
    VSI("vsi", BaseType.INT, Flavor.SIGNED),
    VUI("vui", BaseType.INT, Flavor.UNSIGNED),
    VBI("vbi", BaseType.INT, Flavor.BOOL),
    VSLL("vsll", BaseType.LONG_LONG, Flavor.SIGNED),
    VULL("vull", BaseType.LONG_LONG, Flavor.UNSIGNED),
    VBLL("vbll", BaseType.LONG_LONG, Flavor.BOOL),
    VSQ("vsq", BaseType.INT128, Flavor.SIGNED),
    VUQ("vuq", BaseType.INT128, Flavor.UNSIGNED),
    VBQ("vbq", BaseType.INT128, Flavor.BOOL),
    VP("vp", BaseType.SHORT, Flavor.PIXEL),
    VF("vf", BaseType.FLOAT, Flavor.PLAIN),
    VD("vd", BaseType.DOUBLE, Flavor.PLAIN),
    VOP("vop", null, Flavor.OPAQUE);

    private enum Flavor { SIGNED, UNSIGNED, BOOL, PIXEL, PLAIN, OPAQUE }

    private final String token;
    private final BaseType element;
    private final Flavor flavor;

    VectorShorthand(String token, BaseType element, Flavor flavor) {
        this.token = token;
        this.element = element;
        this.flavor = flavor;
    }

    public String token() {
        return token;
    }

    /**
     * @return The element base type, or null for the opaque vector.
     */
    public BaseType element() {
        return element;
    }

    /**
     * The opaque vector matches every vector type and cannot be pointed to.
     * @return Whether a trailing {@code *} may follow this token.
     */
    public boolean allowsPointer() {
        return flavor != Flavor.OPAQUE;
    }

    /**
     * Applies this shorthand's flags to a builder.
     * @param builder The builder of the type being recognized.
     * @return The same builder.
     */
    public TypeDescriptor.Builder applyTo(TypeDescriptor.Builder builder) {
        if (flavor == Flavor.OPAQUE) {
            return builder.isOpaque();
        }
        builder.isVector().base(element);
        return switch (flavor) {
            case SIGNED -> builder.isSigned();
            case UNSIGNED -> builder.isUnsigned();
            case BOOL -> builder.isBool();
            case PIXEL -> builder.isPixel();
            default -> builder;
        };
    }

    public static Optional<VectorShorthand> fromToken(String token) {
        return Arrays.stream(values()).filter(v -> v.token.equals(token)).findFirst();
    }
}
