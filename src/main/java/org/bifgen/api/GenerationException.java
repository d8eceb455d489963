package org.bifgen.api;

import java.util.Optional;

/**
 * Thrown when a generator run fails. Carries the {@link GeneratorErrorCode} of the
 * failing phase and, for parse failures, the position of the offending input.
 * <p>
 * It is part of the public API and hides the internal exception types of the generator.
 */
public class GenerationException extends Exception {

    private final GeneratorErrorCode errorCode;
    private final SourceInfo sourceInfo;

    /**
     * Constructs a new generation exception.
     * @param errorCode The code of the failing phase.
     * @param message The detail message.
     */
    public GenerationException(GeneratorErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    /**
     * Constructs a new generation exception with a cause.
     * @param errorCode The code of the failing phase.
     * @param message The detail message.
     * @param cause The cause.
     */
    public GenerationException(GeneratorErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, null, cause);
    }

    /**
     * Constructs a new generation exception pointing at a source position.
     * @param errorCode The code of the failing phase.
     * @param message The detail message.
     * @param sourceInfo The offending position, may be null.
     * @param cause The cause, may be null.
     */
    public GenerationException(GeneratorErrorCode errorCode, String message, SourceInfo sourceInfo, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.sourceInfo = sourceInfo;
    }

    public GeneratorErrorCode getErrorCode() {
        return errorCode;
    }

    public Optional<SourceInfo> getSourceInfo() {
        return Optional.ofNullable(sourceInfo);
    }
}
