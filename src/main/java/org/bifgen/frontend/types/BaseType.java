package org.bifgen.frontend.types;

import java.util.Arrays;
import java.util.Optional;

/**
 * The element kinds a built-in argument or return type can be built from.
 * This is the richest vocabulary; which keywords are accepted in a given run
 * is controlled by {@link org.bifgen.api.GeneratorOptions#baseTypes()}.
 */
public enum BaseType {
    CHAR("char", true),
    SHORT("short", true),
    INT("int", true),
    LONG_LONG("long long", true),
    FLOAT("float", false),
    DOUBLE("double", false),
    INT128("__int128", true),
    FLOAT128("_Float128", false),
    DECIMAL32("_Decimal32", false),
    DECIMAL64("_Decimal64", false),
    DECIMAL128("_Decimal128", false),
    IBM128("__ibm128", false);

    private final String keyword;
    private final boolean integral;

    BaseType(String keyword, boolean integral) {
        this.keyword = keyword;
        this.integral = integral;
    }

    /**
     * @return The spelling used in definition files. {@code long long} is the only two-token keyword.
     */
    public String keyword() {
        return keyword;
    }

    /**
     * @return Whether {@code signed} and {@code unsigned} may qualify this base type.
     */
    public boolean isIntegral() {
        return integral;
    }

    /**
     * Looks up a base type by its definition-file spelling.
     * @param keyword The keyword, e.g. {@code "_Decimal64"} or {@code "long long"}.
     * @return The matching base type, or empty.
     */
    public static Optional<BaseType> fromKeyword(String keyword) {
        return Arrays.stream(values()).filter(b -> b.keyword.equals(keyword)).findFirst();
    }
}
