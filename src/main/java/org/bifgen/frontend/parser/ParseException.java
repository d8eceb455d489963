package org.bifgen.frontend.parser;

import org.bifgen.api.SourceInfo;

/**
 * Thrown on the first grammar or integrity violation in a definition file.
 * Parsing never resumes after it.
 */
public class ParseException extends Exception {

    private final SourceInfo sourceInfo;

    /**
     * Constructs a new parse exception.
     * @param message The rendered diagnostic, including the position.
     * @param sourceInfo The offending position.
     */
    public ParseException(String message, SourceInfo sourceInfo) {
        super(message);
        this.sourceInfo = sourceInfo;
    }

    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }
}
