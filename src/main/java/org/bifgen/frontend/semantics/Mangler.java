package org.bifgen.frontend.semantics;

import org.bifgen.api.InternalGeneratorError;
import org.bifgen.frontend.types.BaseType;
import org.bifgen.frontend.types.Prototype;
import org.bifgen.frontend.types.TypeDescriptor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Computes the canonical function type descriptor id of a prototype.
 * <p>
 * Each type becomes a machine-mode fragment: an optional {@code u} for unsigned,
 * then for vectors an optional {@code b} for bool, {@code v} and the vector mode,
 * otherwise the scalar mode. Pointers mangle to {@code pv} whatever they point to,
 * void to {@code v}, the opaque vector to {@code opaque}. Restrictions do not
 * take part.
 */
public final class Mangler {

    /** Separates the return fragment from the argument fragments. */
    public static final String FTYPE_INFIX = "_ftype";
    /** Argument fragment used when a function takes no arguments. */
    public static final String NO_ARGS = "v";
    public static final String VOID = "v";
    public static final String POINTER = "pv";
    public static final String OPAQUE = "opaque";
    public static final String PIXEL_MODE = "p8hi";

    private static final Map<BaseType, String> SCALAR_MODES = new EnumMap<>(BaseType.class);
    private static final Map<BaseType, String> VECTOR_MODES = new EnumMap<>(BaseType.class);

    static {
        SCALAR_MODES.put(BaseType.CHAR, "qi");
        SCALAR_MODES.put(BaseType.SHORT, "hi");
        SCALAR_MODES.put(BaseType.INT, "si");
        SCALAR_MODES.put(BaseType.LONG_LONG, "di");
        SCALAR_MODES.put(BaseType.FLOAT, "sf");
        SCALAR_MODES.put(BaseType.DOUBLE, "df");
        SCALAR_MODES.put(BaseType.INT128, "ti");
        SCALAR_MODES.put(BaseType.FLOAT128, "tf");
        SCALAR_MODES.put(BaseType.DECIMAL32, "sd");
        SCALAR_MODES.put(BaseType.DECIMAL64, "dd");
        SCALAR_MODES.put(BaseType.DECIMAL128, "td");
        SCALAR_MODES.put(BaseType.IBM128, "if");

        VECTOR_MODES.put(BaseType.CHAR, "16qi");
        VECTOR_MODES.put(BaseType.SHORT, "8hi");
        VECTOR_MODES.put(BaseType.INT, "4si");
        VECTOR_MODES.put(BaseType.LONG_LONG, "2di");
        VECTOR_MODES.put(BaseType.FLOAT, "4sf");
        VECTOR_MODES.put(BaseType.DOUBLE, "2df");
        VECTOR_MODES.put(BaseType.INT128, "1ti");
        VECTOR_MODES.put(BaseType.FLOAT128, "1tf");
    }

    private Mangler() {}

    /**
     * @param prototype The prototype to mangle.
     * @return Its canonical signature.
     */
    public static MangledSignature mangle(Prototype prototype) {
        return mangle(prototype.returnType(), prototype.args());
    }

    /**
     * @param returnType The return type.
     * @param args The argument types in order.
     * @return The canonical signature.
     * @throws InternalGeneratorError if a type has a base type without a mode.
     */
    public static MangledSignature mangle(TypeDescriptor returnType, List<TypeDescriptor> args) {
        List<String> argFragments = new ArrayList<>(args.size());
        for (TypeDescriptor arg : args) {
            argFragments.add(fragment(arg));
        }
        return new MangledSignature(fragment(returnType), argFragments);
    }

    /**
     * @param type A return or argument type.
     * @return Its mode fragment.
     */
    public static String fragment(TypeDescriptor type) {
        if (type.isPointer()) {
            return POINTER;
        }
        if (type.isVoid()) {
            return VOID;
        }
        if (type.isOpaque()) {
            return OPAQUE;
        }
        StringBuilder sb = new StringBuilder();
        if (type.isUnsigned()) {
            sb.append('u');
        }
        if (type.isVector()) {
            if (type.isBool()) {
                sb.append('b');
            }
            sb.append('v');
            sb.append(type.isPixel() ? PIXEL_MODE : mode(VECTOR_MODES, type));
        } else {
            sb.append(mode(SCALAR_MODES, type));
        }
        return sb.toString();
    }

    private static String mode(Map<BaseType, String> modes, TypeDescriptor type) {
        String mode = modes.get(type.base());
        if (mode == null) {
            throw new InternalGeneratorError("unhandled base type " + type.base() + " in " + type);
        }
        return mode;
    }
}
