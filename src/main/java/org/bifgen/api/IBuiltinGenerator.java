package org.bifgen.api;

/**
 * Defines the public interface of the built-in table generator.
 */
public interface IBuiltinGenerator {

    /**
     * Parses both definition files and writes the three generated artifacts.
     * On failure no artifact is left behind.
     *
     * @param paths The input and output files of this run.
     * @return Counts describing the generated tables.
     * @throws GenerationException if any phase fails; the exception carries the phase's error code.
     */
    GenerationSummary generate(GeneratorPaths paths) throws GenerationException;
}
