package org.bifgen.frontend.lexer;

import org.bifgen.api.InternalGeneratorError;
import org.bifgen.api.SourceInfo;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.StringReader;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * A line-oriented cursor over a definition file.
 * <p>
 * The scanner owns the current line and a zero-based cursor into it. Diagnostics
 * report 1-based columns ({@code cursor + 1}). The end of the current line reads as
 * {@link #END_OF_LINE}, so callers can test for it like any other character.
 */
public class LineScanner implements Closeable {

    /** Longest line the scanner accepts, terminator included. */
    public static final int MAX_LINE_LENGTH = 1024;

    /** Character returned by {@link #peek()} once the cursor has passed the last character. */
    public static final char END_OF_LINE = '\n';

    /** Lines whose first non-blank character is this marker are comments. */
    public static final char COMMENT_MARKER = ';';

    private final BufferedReader reader;
    private final String fileName;
    private String line = "";
    private int pos = 0;
    private int lineNumber = 0;

    /**
     * Creates a new scanner.
     * @param reader The source of the definition file. Closed by {@link #close()}.
     * @param fileName The file name, for diagnostics.
     */
    public LineScanner(BufferedReader reader, String fileName) {
        this.reader = reader;
        this.fileName = fileName;
    }

    /**
     * Creates a scanner over in-memory text.
     * @param fileName The logical file name.
     * @param content The file content.
     * @return A new scanner positioned before the first line.
     */
    public static LineScanner of(String fileName, String content) {
        return new LineScanner(new BufferedReader(new StringReader(content)), fileName);
    }

    /**
     * Reads the next line that is neither blank nor a comment and places the cursor
     * on its first non-blank character.
     *
     * @return {@code false} at end of file.
     * @throws IOException if reading fails.
     * @throws InternalGeneratorError if a line overruns {@link #MAX_LINE_LENGTH}.
     */
    public boolean advanceLine() throws IOException {
        while (true) {
            String next = reader.readLine();
            if (next == null) {
                line = "";
                pos = 0;
                return false;
            }
            lineNumber++;
            if (next.length() >= MAX_LINE_LENGTH) {
                throw new InternalGeneratorError(String.format("%s:%d: line length overrun (%d characters, limit %d)",
                        fileName, lineNumber, next.length(), MAX_LINE_LENGTH - 1));
            }
            line = next;
            pos = 0;
            consumeWhitespace();
            if (!atEndOfLine() && peek() != COMMENT_MARKER) {
                return true;
            }
        }
    }

    /**
     * Moves the cursor back to the start of the current line and past its leading blanks.
     */
    public void rewindLine() {
        pos = 0;
        consumeWhitespace();
    }

    /**
     * Advances over spaces, tabs and other blanks, never past the end of the line.
     */
    public void consumeWhitespace() {
        while (pos < line.length() && Character.isWhitespace(line.charAt(pos))) {
            pos++;
        }
    }

    /**
     * Consumes a maximal run of letters, digits and underscores.
     * @return The identifier, or empty if the cursor is not on one. The cursor does not move on failure.
     */
    public Optional<String> matchIdentifier() {
        int end = pos;
        while (end < line.length() && isIdentifierChar(line.charAt(end))) {
            end++;
        }
        if (end == pos) {
            return Optional.empty();
        }
        String identifier = line.substring(pos, end);
        pos = end;
        return Optional.of(identifier);
    }

    /**
     * Consumes an optional {@code -} followed by decimal digits.
     * @return The value, or empty if no digits follow or the value does not fit in an int.
     *         The cursor does not move on failure.
     */
    public OptionalInt matchInteger() {
        int start = pos;
        int end = pos;
        if (end < line.length() && line.charAt(end) == '-') {
            end++;
        }
        int digitsStart = end;
        while (end < line.length() && Character.isDigit(line.charAt(end))) {
            end++;
        }
        if (end == digitsStart) {
            return OptionalInt.empty();
        }
        long value;
        try {
            value = Long.parseLong(line.substring(start, end));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            return OptionalInt.empty();
        }
        pos = end;
        return OptionalInt.of((int) value);
    }

    /**
     * Consumes everything up to, but not including, the given terminator.
     * @param terminator The character that ends the text.
     * @return The text, or empty if the terminator does not occur on the rest of the line.
     */
    public Optional<String> matchUntil(char terminator) {
        int end = line.indexOf(terminator, pos);
        if (end < 0) {
            return Optional.empty();
        }
        String text = line.substring(pos, end);
        pos = end;
        return Optional.of(text);
    }

    /**
     * @return The character under the cursor, or {@link #END_OF_LINE}.
     */
    public char peek() {
        return pos < line.length() ? line.charAt(pos) : END_OF_LINE;
    }

    /**
     * Consumes the character under the cursor if it equals {@code expected}.
     * @param expected The expected character.
     * @return Whether it was consumed.
     */
    public boolean match(char expected) {
        if (peek() == expected && !atEndOfLine()) {
            pos++;
            return true;
        }
        return false;
    }

    public boolean atEndOfLine() {
        return pos >= line.length();
    }

    /**
     * @return The zero-based cursor position.
     */
    public int position() {
        return pos;
    }

    /**
     * Moves the cursor back to a position previously returned by {@link #position()}.
     * @param position The position to restore.
     */
    public void reset(int position) {
        if (position < 0 || position > line.length()) {
            throw new IllegalArgumentException("Position " + position + " outside current line");
        }
        this.pos = position;
    }

    /**
     * @return The 1-based column of the cursor.
     */
    public int column() {
        return pos + 1;
    }

    public int lineNumber() {
        return lineNumber;
    }

    public String currentLine() {
        return line;
    }

    public String fileName() {
        return fileName;
    }

    /**
     * @param position A zero-based position on the current line.
     * @return The source position with a 1-based column.
     */
    public SourceInfo sourceInfo(int position) {
        return new SourceInfo(fileName, lineNumber, position + 1, line);
    }

    /**
     * @return The source position of the cursor.
     */
    public SourceInfo sourceInfo() {
        return sourceInfo(pos);
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }

    private static boolean isIdentifierChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
    }
}
