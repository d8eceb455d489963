package org.bifgen.api;

import java.nio.file.Path;
import java.util.Objects;

/**
 * The two inputs and three outputs of one generator run.
 *
 * @param builtinFile The built-in definition file.
 * @param overloadFile The overload definition file.
 * @param declarationsFile The generated declarations (header) file.
 * @param definitionsFile The generated definitions (initialization) file.
 * @param aliasesFile The generated macro alias file.
 */
public record GeneratorPaths(Path builtinFile,
                             Path overloadFile,
                             Path declarationsFile,
                             Path definitionsFile,
                             Path aliasesFile) {

    public GeneratorPaths {
        Objects.requireNonNull(builtinFile, "builtinFile");
        Objects.requireNonNull(overloadFile, "overloadFile");
        Objects.requireNonNull(declarationsFile, "declarationsFile");
        Objects.requireNonNull(definitionsFile, "definitionsFile");
        Objects.requireNonNull(aliasesFile, "aliasesFile");
    }
}
