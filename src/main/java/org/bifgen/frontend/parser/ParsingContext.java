package org.bifgen.frontend.parser;

import org.bifgen.api.GeneratorOptions;
import org.bifgen.api.SourceInfo;
import org.bifgen.diagnostics.DiagnosticsEngine;
import org.bifgen.frontend.lexer.LineScanner;

/**
 * The state shared by the parsers of one definition file. It gives the type and
 * prototype parsers access to the scanner and the diagnostic sink without coupling
 * them to a particular file parser.
 */
public interface ParsingContext {

    /**
     * @return The scanner positioned on the line being parsed.
     */
    LineScanner scanner();

    /**
     * @return The policy settings of the run.
     */
    GeneratorOptions options();

    /**
     * @return The diagnostic sink bound to the file being parsed.
     */
    DiagnosticsEngine.FileScope diagnostics();

    /**
     * Reports an error and creates the exception that aborts parsing.
     * @param message The error message.
     * @param position The offending position.
     * @return The exception to throw.
     */
    ParseException fail(String message, SourceInfo position);

    /**
     * Reports an error at the scanner's cursor.
     * @param message The error message.
     * @return The exception to throw.
     */
    default ParseException fail(String message) {
        return fail(message, scanner().sourceInfo());
    }
}
