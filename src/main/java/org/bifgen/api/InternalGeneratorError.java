package org.bifgen.api;

/**
 * Signals a programming error inside the generator, such as a line that overruns
 * the scanner buffer or a base type the mangler has no mode for. Never caused by
 * an ordinary grammar violation.
 */
public class InternalGeneratorError extends RuntimeException {

    /**
     * @param message The detail message.
     */
    public InternalGeneratorError(String message) {
        super(message);
    }
}
