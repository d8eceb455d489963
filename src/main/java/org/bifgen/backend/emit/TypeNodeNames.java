package org.bifgen.backend.emit;

import org.bifgen.api.InternalGeneratorError;
import org.bifgen.frontend.semantics.MangledSignature;
import org.bifgen.frontend.semantics.Mangler;

import java.util.Locale;
import java.util.Map;

/**
 * Maps mode fragments of a mangled signature to the type nodes of the host compiler.
 */
final class TypeNodeNames {

    private static final Map<String, String> SCALAR_NODES = Map.ofEntries(
            Map.entry("qi", "intQI"),
            Map.entry("hi", "intHI"),
            Map.entry("si", "intSI"),
            Map.entry("di", "intDI"),
            Map.entry("ti", "intTI"),
            Map.entry("sf", "float"),
            Map.entry("df", "double"),
            Map.entry("tf", "float128"),
            Map.entry("sd", "dfloat32"),
            Map.entry("dd", "dfloat64"),
            Map.entry("td", "dfloat128"),
            Map.entry("if", "ibm128_float"));

    private TypeNodeNames() {}

    /**
     * @param fragment A mode fragment, e.g. {@code usi}, {@code bv4si} or {@code pv}.
     * @return The name of its type node, e.g. {@code unsigned_intSI_type_node}.
     */
    static String nodeFor(String fragment) {
        return baseName(fragment) + "_type_node";
    }

    private static String baseName(String fragment) {
        switch (fragment) {
            case Mangler.VOID:
                return "void";
            case Mangler.POINTER:
                return "ptr";
            case Mangler.OPAQUE:
                return "opaque_V4SI";
            default:
                break;
        }
        boolean unsigned = fragment.startsWith("u");
        String mode = unsigned ? fragment.substring(1) : fragment;
        String prefix = unsigned ? "unsigned_" : "";
        if (mode.equals("v" + Mangler.PIXEL_MODE)) {
            return "pixel_V8HI";
        }
        if (mode.startsWith("bv")) {
            return prefix + "bool_" + mode.substring(1).toUpperCase(Locale.ROOT);
        }
        if (mode.startsWith("v")) {
            return prefix + mode.toUpperCase(Locale.ROOT);
        }
        String scalar = SCALAR_NODES.get(mode);
        if (scalar == null) {
            throw new InternalGeneratorError("type map is inconsistent for fragment '" + fragment + "'");
        }
        if (unsigned && !scalar.startsWith("int")) {
            throw new InternalGeneratorError("unsigned non-integral fragment '" + fragment + "'");
        }
        return prefix + scalar;
    }

    /**
     * Function types mentioning a type node that not every configuration creates
     * are only built when that node exists.
     *
     * @param signature The function type.
     * @return The node whose presence guards the construction, or null if none is needed.
     */
    static String guardFor(MangledSignature signature) {
        boolean dfp = false;
        if (mentions(signature, "tf")) {
            return "float128_type_node";
        }
        for (String decimal : new String[] {"sd", "dd", "td"}) {
            dfp |= mentions(signature, decimal);
        }
        return dfp ? "dfloat64_type_node" : null;
    }

    private static boolean mentions(MangledSignature signature, String fragment) {
        return signature.returnFragment().equals(fragment) || signature.argFragments().contains(fragment);
    }
}
