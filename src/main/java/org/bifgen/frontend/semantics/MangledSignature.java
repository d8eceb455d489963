package org.bifgen.frontend.semantics;

import java.util.List;

/**
 * The canonical form of a function type: a mode fragment for the return type and
 * one per argument. Two prototypes with the same shape share the same signature.
 *
 * @param returnFragment The return type fragment, e.g. {@code si} or {@code v}.
 * @param argFragments The argument fragments in order; empty for no arguments.
 */
public record MangledSignature(String returnFragment, List<String> argFragments) {

    public MangledSignature {
        argFragments = List.copyOf(argFragments);
    }

    /**
     * @return The descriptor id, e.g. {@code si_ftype_si} or {@code v_ftype_v}.
     */
    public String id() {
        StringBuilder sb = new StringBuilder(returnFragment).append(Mangler.FTYPE_INFIX);
        if (argFragments.isEmpty()) {
            sb.append('_').append(Mangler.NO_ARGS);
        }
        for (String fragment : argFragments) {
            sb.append('_').append(fragment);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return id();
    }
}
