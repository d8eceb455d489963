package org.bifgen.frontend.parser;

import org.bifgen.api.GeneratorOptions;
import org.bifgen.api.SourceInfo;
import org.bifgen.diagnostics.DiagnosticsEngine;
import org.bifgen.frontend.lexer.LineScanner;
import org.bifgen.frontend.semantics.Mangler;
import org.bifgen.frontend.semantics.SymbolRegistry;
import org.bifgen.frontend.semantics.SymbolTables;
import org.bifgen.frontend.types.Prototype;
import org.bifgen.model.OverloadEntry;
import org.bifgen.model.OverloadStanza;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parses the overload definition file.
 * <pre>
 * [ VEC_ABS, vec_abs, __builtin_vec_abs ]
 *   vsll __builtin_vec_abs (vsll);
 *     ABS_V2DI
 * </pre>
 * Line 1 of an entry is a prototype, line 2 the id of the built-in the instance
 * resolves to, optionally followed by an instance id. Must run after the built-in
 * file has been parsed completely, since every built-in id is looked up in
 * {@link SymbolTables#builtinIds()}.
 */
public class OverloadFileParser extends AbstractDefinitionParser {

    private static final Logger LOG = LoggerFactory.getLogger(OverloadFileParser.class);

    private final SymbolTables tables;
    private final SymbolRegistry<OverloadStanza> groupIds;
    private final List<OverloadStanza> stanzas = new ArrayList<>();
    private final List<OverloadEntry> entries = new ArrayList<>();
    private OverloadStanza currentStanza;

    /**
     * @param scanner The scanner over the overload file.
     * @param options The policy settings of the run.
     * @param diagnostics The diagnostic sink bound to the overload file.
     * @param tables The registries of the run, with all built-in ids recorded.
     */
    public OverloadFileParser(LineScanner scanner, GeneratorOptions options, DiagnosticsEngine.FileScope diagnostics,
                              SymbolTables tables) {
        super(scanner, options, diagnostics);
        this.tables = tables;
        this.groupIds = new SymbolRegistry<>("overload groups", options.maxOverloadStanzas());
    }

    @Override
    protected void parseStanzaHeader() throws ParseException {
        LineScanner scanner = scanner();
        scanner.consumeWhitespace();
        SourceInfo groupPosition = scanner.sourceInfo();
        String groupId = scanner.matchIdentifier().orElseThrow(() -> fail("no identifier found in stanza header"));
        expectComma();
        String externName = scanner.matchIdentifier().orElseThrow(() -> fail("missing external name"));
        expectComma();
        String internName = scanner.matchIdentifier().orElseThrow(() -> fail("missing internal name"));
        scanner.consumeWhitespace();
        if (!scanner.match(STANZA_CLOSE)) {
            throw fail("ill-formed stanza header, expected '" + STANZA_CLOSE + "'");
        }

        OverloadStanza stanza = new OverloadStanza(groupId, externName, internName);
        switch (groupIds.insert(groupId, stanza)) {
            case DUPLICATE -> throw fail("duplicate overload group id '" + groupId + "'", groupPosition);
            case CAPACITY_EXCEEDED -> throw fail("too many overload stanzas, the limit is " + groupIds.capacity(), groupPosition);
            default -> {
                stanzas.add(stanza);
                currentStanza = stanza;
            }
        }
        LOG.debug("{}:{}: overload stanza [{}]", scanner.fileName(), scanner.lineNumber(), groupId);
    }

    private void expectComma() throws ParseException {
        LineScanner scanner = scanner();
        scanner.consumeWhitespace();
        if (!scanner.match(',')) {
            throw fail("missing comma");
        }
        scanner.consumeWhitespace();
    }

    @Override
    protected void parseEntry() throws ParseException, IOException {
        LineScanner scanner = scanner();
        SourceInfo entryPosition = scanner.sourceInfo();

        Prototype prototype = prototypeParser.parsePrototype();
        String typeDescId = tables.recordFunctionType(Mangler.mangle(prototype));
        if (!prototype.name().equals(currentStanza.internName())) {
            diagnostics().warning("overload '" + prototype.name() + "' does not match the internal name '"
                    + currentStanza.internName() + "' of stanza " + currentStanza.groupId(), entryPosition.lineNumber());
        }

        readContinuationLine("built-in id");
        SourceInfo builtinIdPosition = scanner.sourceInfo();
        String builtinId = scanner.matchIdentifier().orElseThrow(() -> fail("missing built-in id"));
        SourceInfo overloadIdPosition = builtinIdPosition;
        String overloadId = builtinId;
        scanner.consumeWhitespace();
        if (!scanner.atEndOfLine()) {
            overloadIdPosition = scanner.sourceInfo();
            overloadId = scanner.matchIdentifier().orElseThrow(() -> fail("missing overload id"));
        }
        expectEndOfLine("garbage at end of line");

        if (!tables.builtinIds().contains(builtinId)) {
            throw fail("built-in id '" + builtinId + "' not found in built-in file", builtinIdPosition);
        }
        OverloadEntry entry = new OverloadEntry(currentStanza, prototype, builtinId, overloadId, typeDescId, entryPosition);
        switch (tables.overloadIds().insert(overloadId, entry)) {
            case DUPLICATE -> throw fail("duplicate overload id '" + overloadId + "'", overloadIdPosition);
            case CAPACITY_EXCEEDED -> throw fail("too many overloads, the limit is " + tables.overloadIds().capacity(), overloadIdPosition);
            default -> entries.add(entry);
        }
    }

    /**
     * @return The overload stanzas in file order.
     */
    public List<OverloadStanza> stanzas() {
        return Collections.unmodifiableList(stanzas);
    }

    /**
     * @return The overload entries in file order.
     */
    public List<OverloadEntry> entries() {
        return Collections.unmodifiableList(entries);
    }
}
