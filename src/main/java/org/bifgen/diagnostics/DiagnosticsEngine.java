package org.bifgen.diagnostics;

import org.bifgen.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Collects the diagnostic messages of a generator run.
 * <p>
 * Each file-processing phase binds a {@link FileScope} to the file it reads, so
 * parsers report positions without knowing which file they are working on.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message      The error message.
     * @param fileName     The file in which the error occurred.
     * @param lineNumber   The 1-based line number of the error.
     * @param columnNumber The 1-based column of the error.
     * @return The recorded diagnostic.
     */
    public Diagnostic reportError(String message, String fileName, int lineNumber, int columnNumber) {
        Diagnostic diagnostic = new Diagnostic(Diagnostic.Type.ERROR, message, fileName, lineNumber, columnNumber);
        diagnostics.add(diagnostic);
        return diagnostic;
    }

    /**
     * Reports a warning.
     *
     * @param message    The warning message.
     * @param fileName   The file in which the warning occurred.
     * @param lineNumber The 1-based line number of the warning.
     */
    public void reportWarning(String message, String fileName, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, fileName, lineNumber, 0));
    }

    /**
     * Binds a scope to the given file for the duration of one phase.
     * @param fileName The file path as reported in diagnostics.
     * @return A scope reporting into this engine.
     */
    public FileScope forFile(String fileName) {
        return new FileScope(fileName);
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * @return The first error reported, if any.
     */
    public Optional<Diagnostic> firstError() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).findFirst();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }

    /**
     * A diagnostic sink bound to one input file.
     */
    public final class FileScope {

        private final String fileName;

        private FileScope(String fileName) {
            this.fileName = fileName;
        }

        public String fileName() {
            return fileName;
        }

        /**
         * Reports an error at a position of the bound file.
         * @param message The error message.
         * @param position The offending position.
         * @return The recorded diagnostic.
         */
        public Diagnostic error(String message, SourceInfo position) {
            return reportError(message, fileName, position.lineNumber(), position.columnNumber());
        }

        public void warning(String message, int lineNumber) {
            reportWarning(message, fileName, lineNumber);
        }
    }
}
