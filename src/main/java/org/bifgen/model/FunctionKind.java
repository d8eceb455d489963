package org.bifgen.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Mutually exclusive purity modifier that may precede a built-in prototype.
 */
public enum FunctionKind {
    NONE(null),
    CONST("const"),
    PURE("pure"),
    FPMATH("fpmath");

    private final String keyword;

    FunctionKind(String keyword) {
        this.keyword = keyword;
    }

    /**
     * @return The keyword in the definition file, null for {@link #NONE}.
     */
    public String keyword() {
        return keyword;
    }

    public static Optional<FunctionKind> fromKeyword(String token) {
        return Arrays.stream(values()).filter(k -> k.keyword != null && k.keyword.equals(token)).findFirst();
    }
}
