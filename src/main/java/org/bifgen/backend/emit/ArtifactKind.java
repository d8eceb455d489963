package org.bifgen.backend.emit;

import org.bifgen.api.GeneratorErrorCode;
import org.bifgen.api.GeneratorPaths;

import java.nio.file.Path;

/**
 * The three generated artifacts, in the order they are created and written.
 */
public enum ArtifactKind {
    DECLARATIONS("declarations", GeneratorErrorCode.DECLARATIONS_NOT_CREATABLE, GeneratorErrorCode.DECLARATIONS_WRITE_FAILURE),
    DEFINITIONS("definitions", GeneratorErrorCode.DEFINITIONS_NOT_CREATABLE, GeneratorErrorCode.DEFINITIONS_WRITE_FAILURE),
    ALIASES("aliases", GeneratorErrorCode.ALIASES_NOT_CREATABLE, GeneratorErrorCode.ALIASES_WRITE_FAILURE);

    private final String label;
    private final GeneratorErrorCode notCreatable;
    private final GeneratorErrorCode writeFailure;

    ArtifactKind(String label, GeneratorErrorCode notCreatable, GeneratorErrorCode writeFailure) {
        this.label = label;
        this.notCreatable = notCreatable;
        this.writeFailure = writeFailure;
    }

    public String label() {
        return label;
    }

    /**
     * @return The code reported when the artifact's file cannot be created.
     */
    public GeneratorErrorCode notCreatableCode() {
        return notCreatable;
    }

    /**
     * @return The code reported when writing the artifact fails.
     */
    public GeneratorErrorCode writeFailureCode() {
        return writeFailure;
    }

    /**
     * @param paths The paths of a run.
     * @return The output path of this artifact.
     */
    public Path pathIn(GeneratorPaths paths) {
        return switch (this) {
            case DECLARATIONS -> paths.declarationsFile();
            case DEFINITIONS -> paths.definitionsFile();
            case ALIASES -> paths.aliasesFile();
        };
    }
}
