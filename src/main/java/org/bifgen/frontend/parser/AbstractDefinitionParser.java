package org.bifgen.frontend.parser;

import org.bifgen.api.GeneratorOptions;
import org.bifgen.api.SourceInfo;
import org.bifgen.diagnostics.Diagnostic;
import org.bifgen.diagnostics.DiagnosticsEngine;
import org.bifgen.frontend.lexer.LineScanner;

import java.io.IOException;

/**
 * Drives the stanza loop shared by both definition files:
 * <pre>
 * file   := stanza*
 * stanza := '[' header ']' entry*
 * </pre>
 * An entry runs until the next line that starts with {@code [} or the end of
 * the file. The first violation throws and nothing is recovered.
 */
public abstract class AbstractDefinitionParser implements ParsingContext {

    /**
     * What ended the entries of a stanza.
     */
    private enum StanzaStatus {
        NEXT_STANZA,
        END_OF_FILE
    }

    protected static final char STANZA_OPEN = '[';
    protected static final char STANZA_CLOSE = ']';

    private final LineScanner scanner;
    private final GeneratorOptions options;
    private final DiagnosticsEngine.FileScope diagnostics;
    protected final TypeParser typeParser;
    protected final PrototypeParser prototypeParser;

    /**
     * @param scanner The scanner over the file, positioned before its first line.
     * @param options The policy settings of the run.
     * @param diagnostics The diagnostic sink bound to the file.
     */
    protected AbstractDefinitionParser(LineScanner scanner, GeneratorOptions options, DiagnosticsEngine.FileScope diagnostics) {
        this.scanner = scanner;
        this.options = options;
        this.diagnostics = diagnostics;
        this.typeParser = new TypeParser(this);
        this.prototypeParser = new PrototypeParser(this, typeParser);
    }

    /**
     * Parses the whole file. An empty file is valid.
     * @throws ParseException on the first grammar or integrity violation.
     * @throws IOException if reading fails.
     */
    public final void parse() throws ParseException, IOException {
        if (!scanner.advanceLine()) {
            return;
        }
        StanzaStatus status;
        do {
            status = parseStanza();
        } while (status == StanzaStatus.NEXT_STANZA);
    }

    private StanzaStatus parseStanza() throws ParseException, IOException {
        scanner.rewindLine();
        if (!scanner.match(STANZA_OPEN)) {
            throw fail("ill-formed stanza header, expected '" + STANZA_OPEN + "'");
        }
        parseStanzaHeader();
        expectEndOfLine("garbage after stanza header");
        while (true) {
            if (!scanner.advanceLine()) {
                return StanzaStatus.END_OF_FILE;
            }
            if (scanner.peek() == STANZA_OPEN) {
                return StanzaStatus.NEXT_STANZA;
            }
            parseEntry();
        }
    }

    /**
     * Parses the content of a stanza header. The cursor is just after the opening
     * bracket and must be left just after the closing one.
     * @throws ParseException if the header is malformed.
     */
    protected abstract void parseStanzaHeader() throws ParseException;

    /**
     * Parses one entry. The cursor is on the first non-blank character of its first line.
     * @throws ParseException if the entry is malformed.
     * @throws IOException if reading a continuation line fails.
     */
    protected abstract void parseEntry() throws ParseException, IOException;

    /**
     * Reads the next required line of a multi-line entry.
     * @param expected What the line should contain, for the diagnostic.
     * @throws ParseException at end of file.
     * @throws IOException if reading fails.
     */
    protected void readContinuationLine(String expected) throws ParseException, IOException {
        int lastLine = scanner.lineNumber();
        String lastText = scanner.currentLine();
        if (!scanner.advanceLine()) {
            // reported just past the end of the last line read
            throw fail("unexpected end of file, expected " + expected,
                    new SourceInfo(scanner.fileName(), lastLine, lastText.length() + 1, lastText));
        }
    }

    /**
     * Requires that only blanks remain on the current line.
     * @param message The diagnostic if anything else follows.
     * @throws ParseException if the line has trailing content.
     */
    protected void expectEndOfLine(String message) throws ParseException {
        scanner.consumeWhitespace();
        if (!scanner.atEndOfLine()) {
            throw fail(message);
        }
    }

    @Override
    public LineScanner scanner() {
        return scanner;
    }

    @Override
    public GeneratorOptions options() {
        return options;
    }

    @Override
    public DiagnosticsEngine.FileScope diagnostics() {
        return diagnostics;
    }

    @Override
    public ParseException fail(String message, SourceInfo position) {
        Diagnostic diagnostic = diagnostics.error(message, position);
        return new ParseException(diagnostic.toString(), position);
    }
}
