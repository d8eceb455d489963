package org.bifgen.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The gating predicates a built-in stanza may name. Each maps to the enable tag
 * checked when the built-in is registered.
 */
public enum BuiltinStanza {
    ALWAYS("always", "ENB_ALWAYS", "1"),
    P5("power5", "ENB_P5", "TARGET_POPCNTB"),
    P6("power6", "ENB_P6", "TARGET_CMPB"),
    ALTIVEC("altivec", "ENB_ALTIVEC", "TARGET_ALTIVEC"),
    VSX("vsx", "ENB_VSX", "TARGET_VSX"),
    P7("power7", "ENB_P7", "TARGET_POPCNTD"),
    P7_64("power7-64", "ENB_P7_64", "TARGET_POPCNTD && TARGET_POWERPC64"),
    P8("power8", "ENB_P8", "TARGET_DIRECT_MOVE"),
    P8V("power8-vector", "ENB_P8V", "TARGET_P8_VECTOR"),
    P9("power9", "ENB_P9", "TARGET_MODULO"),
    P9_64("power9-64", "ENB_P9_64", "TARGET_MODULO && TARGET_POWERPC64"),
    P9V("power9-vector", "ENB_P9V", "TARGET_P9_VECTOR"),
    IEEE128_HW("ieee128-hw", "ENB_IEEE128_HW", "TARGET_FLOAT128_HW"),
    DFP("dfp", "ENB_DFP", "TARGET_DFP"),
    CRYPTO("crypto", "ENB_CRYPTO", "TARGET_CRYPTO"),
    HTM("htm", "ENB_HTM", "TARGET_HTM"),
    P10("power10", "ENB_P10", "TARGET_POWER10"),
    MMA("mma", "ENB_MMA", "TARGET_MMA");

    private final String token;
    private final String enableTag;
    private final String condition;

    BuiltinStanza(String token, String enableTag, String condition) {
        this.token = token;
        this.enableTag = enableTag;
        this.condition = condition;
    }

    /**
     * @return The gating token as written in a stanza header.
     */
    public String token() {
        return token;
    }

    /**
     * @return The enumerator of the generated {@code bif_enable} enumeration.
     */
    public String enableTag() {
        return enableTag;
    }

    /**
     * @return The C condition under which built-ins of this stanza are registered.
     */
    public String condition() {
        return condition;
    }

    public static Optional<BuiltinStanza> fromToken(String token) {
        return Arrays.stream(values()).filter(s -> s.token.equals(token)).findFirst();
    }
}
