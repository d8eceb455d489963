package org.bifgen.diagnostics;

/**
 * Represents a single diagnostic message produced while reading a definition file.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param fileName The name of the file where the issue occurred.
 * @param lineNumber The 1-based line number of the issue, 0 if not tied to a line.
 * @param columnNumber The 1-based column of the issue, 0 if not tied to a column.
 */
public record Diagnostic(
        Type type,
        String message,
        String fileName,
        int lineNumber,
        int columnNumber
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that aborts generation. */
        ERROR,
        /** A warning that does not prevent generation. */
        WARNING
    }

    @Override
    public String toString() {
        if (lineNumber <= 0) {
            return String.format("%s: %s", fileName, message);
        }
        if (columnNumber <= 0) {
            return String.format("%s:%d: %s", fileName, lineNumber, message);
        }
        return String.format("%s:%d:%d: %s", fileName, lineNumber, columnNumber, message);
    }
}
