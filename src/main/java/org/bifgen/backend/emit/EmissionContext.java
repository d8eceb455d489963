package org.bifgen.backend.emit;

import org.bifgen.api.GeneratorOptions;

/**
 * What emitters need to know about the run besides the model.
 *
 * @param options The policy settings of the run.
 * @param programName The generator name written into every banner.
 * @param builtinFile The built-in input as given on the command line.
 * @param overloadFile The overload input as given on the command line.
 * @param declarationsInclude The name under which the definitions include the declarations.
 */
public record EmissionContext(GeneratorOptions options,
                              String programName,
                              String builtinFile,
                              String overloadFile,
                              String declarationsInclude) {}
