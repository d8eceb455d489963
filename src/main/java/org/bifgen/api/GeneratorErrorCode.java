package org.bifgen.api;

/**
 * Defines the outcome of a generator run, one code per failing phase.
 * The exit codes are stable so that a build step can tell the phases apart.
 */
public enum GeneratorErrorCode {
    /** Generation completed and all three artifacts were written. */
    OK(0, "success"),
    /** The generator was invoked with the wrong number of arguments. */
    BAD_ARGS(1, "bad arguments"),

    // region Input & output files
    /** The built-in definition file cannot be opened. */
    BUILTIN_INPUT_NOT_FOUND(2, "built-in input not found"),
    /** The overload definition file cannot be opened. */
    OVERLOAD_INPUT_NOT_FOUND(3, "overload input not found"),
    /** The declarations output cannot be created. */
    DECLARATIONS_NOT_CREATABLE(4, "declarations output not creatable"),
    /** The definitions output cannot be created. */
    DEFINITIONS_NOT_CREATABLE(5, "definitions output not creatable"),
    /** The macro alias output cannot be created. */
    ALIASES_NOT_CREATABLE(6, "aliases output not creatable"),
    // endregion

    // region Parsing
    /** Any grammar or integrity violation in the built-in definition file. */
    BUILTIN_PARSE_FAILURE(7, "built-in parse failure"),
    /** Any grammar or integrity violation in the overload definition file. */
    OVERLOAD_PARSE_FAILURE(8, "overload parse failure"),
    // endregion

    // region Emission
    /** Writing the declarations artifact failed. */
    DECLARATIONS_WRITE_FAILURE(9, "declarations write failure"),
    /** Writing the definitions artifact failed. */
    DEFINITIONS_WRITE_FAILURE(10, "definitions write failure"),
    /** Writing the macro alias artifact failed. */
    ALIASES_WRITE_FAILURE(11, "aliases write failure"),
    // endregion

    /** A condition that should be unreachable, e.g. a line length overrun. */
    INTERNAL_ERROR(12, "internal error");

    private final int exitCode;
    private final String description;

    GeneratorErrorCode(int exitCode, String description) {
        this.exitCode = exitCode;
        this.description = description;
    }

    /**
     * @return The process exit status reported for this outcome.
     */
    public int exitCode() {
        return exitCode;
    }

    /**
     * @return A short human-readable description.
     */
    public String description() {
        return description;
    }
}
