package org.bifgen.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The closed vocabulary of attributes a built-in may carry. Each attribute owns
 * one bit of the generated attribute mask.
 */
public enum BuiltinAttribute {
    /** Process as a vec_init function. */
    INIT("init", 0x00000001),
    /** Process as a vec_set function. */
    SET("set", 0x00000002),
    /** Process as a vec_extract function. */
    EXTRACT("extract", 0x00000004),
    /** Not valid with soft-float. */
    NOSOFT("nosoft", 0x00000008),
    /** Needs special handling for vec_ld semantics. */
    LDVEC("ldvec", 0x00000010),
    /** Needs special handling for vec_st semantics. */
    STVEC("stvec", 0x00000020),
    /** Needs special handling for element reversal. */
    REVE("reve", 0x00000040),
    /** Needs special handling for comparison predicates. */
    PRED("pred", 0x00000080, "predicate"),
    /** Needs special handling for transactional memory. */
    HTM("htm", 0x00000100),
    /** Transactional memory function using an SPR. */
    HTMSPR("htmspr", 0x00000200),
    /** Transactional memory function using a CR. */
    HTMCR("htmcr", 0x00000400),
    /** Needs special handling for matrix-multiply-assist instructions. */
    MMA("mma", 0x00000800),
    /** Not valid for 32-bit targets. */
    NO32BIT("no32bit", 0x00001000),
    /** A cpu_is or cpu_supports built-in. */
    CPU("cpu", 0x00002000),
    /** Vector mask for a load or store. */
    LDSTMASK("ldstmask", 0x00004000);

    private final String keyword;
    private final int bit;
    private final String accessorSuffix;

    BuiltinAttribute(String keyword, int bit) {
        this(keyword, bit, keyword);
    }

    BuiltinAttribute(String keyword, int bit, String accessorSuffix) {
        this.keyword = keyword;
        this.bit = bit;
        this.accessorSuffix = accessorSuffix;
    }

    public String keyword() {
        return keyword;
    }

    public int bit() {
        return bit;
    }

    /**
     * @return The name of the generated bit constant, e.g. {@code bif_pred_bit}.
     */
    public String bitName() {
        return "bif_" + keyword + "_bit";
    }

    /**
     * @return The name of the generated accessor macro, e.g. {@code bif_is_predicate}.
     */
    public String accessorName() {
        return "bif_is_" + accessorSuffix;
    }

    public static Optional<BuiltinAttribute> fromKeyword(String token) {
        return Arrays.stream(values()).filter(a -> a.keyword.equals(token)).findFirst();
    }
}
