package org.bifgen.frontend.parser;

import org.bifgen.api.GeneratorOptions;
import org.bifgen.api.SourceInfo;
import org.bifgen.diagnostics.DiagnosticsEngine;
import org.bifgen.frontend.lexer.LineScanner;
import org.bifgen.frontend.semantics.Mangler;
import org.bifgen.frontend.semantics.SymbolTables;
import org.bifgen.frontend.types.Prototype;
import org.bifgen.model.AttributeSet;
import org.bifgen.model.BuiltinAttribute;
import org.bifgen.model.BuiltinEntry;
import org.bifgen.model.BuiltinStanza;
import org.bifgen.model.FunctionKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Parses the built-in definition file.
 * <pre>
 * [ power8-vector ]
 *   const vsll __builtin_altivec_abs_v2di (vsll);
 *     ABS_V2DI absv2di2 {}
 * </pre>
 * Line 1 of an entry is an optional purity keyword and a prototype, line 2 the
 * built-in id, the expansion pattern and the attribute set. Every id is recorded
 * in {@link SymbolTables#builtinIds()} and every prototype's mangled signature in
 * {@link SymbolTables#typeDescIds()}.
 */
public class BuiltinFileParser extends AbstractDefinitionParser {

    private static final Logger LOG = LoggerFactory.getLogger(BuiltinFileParser.class);

    private final SymbolTables tables;
    private final List<BuiltinEntry> entries = new ArrayList<>();
    private BuiltinStanza currentStanza;
    private int stanzaCount = 0;

    /**
     * @param scanner The scanner over the built-in file.
     * @param options The policy settings of the run.
     * @param diagnostics The diagnostic sink bound to the built-in file.
     * @param tables The registries of the run.
     */
    public BuiltinFileParser(LineScanner scanner, GeneratorOptions options, DiagnosticsEngine.FileScope diagnostics,
                             SymbolTables tables) {
        super(scanner, options, diagnostics);
        this.tables = tables;
    }

    @Override
    protected void parseStanzaHeader() throws ParseException {
        LineScanner scanner = scanner();
        SourceInfo tokenPosition = scanner.sourceInfo();
        String token = scanner.matchUntil(STANZA_CLOSE)
                .orElseThrow(() -> fail("ill-formed stanza header, missing '" + STANZA_CLOSE + "'"))
                .trim();
        scanner.match(STANZA_CLOSE);
        currentStanza = BuiltinStanza.fromToken(token)
                .orElseThrow(() -> fail("unrecognized stanza '" + token + "'", tokenPosition));
        stanzaCount++;
        LOG.debug("{}:{}: stanza [{}]", scanner.fileName(), scanner.lineNumber(), token);
    }

    @Override
    protected void parseEntry() throws ParseException, IOException {
        LineScanner scanner = scanner();
        SourceInfo entryPosition = scanner.sourceInfo();

        FunctionKind kind = parseKind();
        Prototype prototype = prototypeParser.parsePrototype();
        String typeDescId = tables.recordFunctionType(Mangler.mangle(prototype));

        readContinuationLine("built-in id");
        SourceInfo idPosition = scanner.sourceInfo();
        String id = scanner.matchIdentifier().orElseThrow(() -> fail("missing built-in id"));
        scanner.consumeWhitespace();
        String patternName = scanner.matchIdentifier().orElseThrow(() -> fail("missing pattern name"));
        AttributeSet attributes = parseAttributes();
        expectEndOfLine("garbage after attribute set");

        BuiltinEntry entry = new BuiltinEntry(currentStanza, kind, prototype, id, patternName, attributes,
                typeDescId, entryPosition);
        switch (tables.builtinIds().insert(id, entry)) {
            case DUPLICATE -> throw fail("duplicate built-in id '" + id + "'", idPosition);
            case CAPACITY_EXCEEDED -> throw fail("too many built-ins, the limit is " + tables.builtinIds().capacity(), idPosition);
            default -> entries.add(entry);
        }
    }

    private FunctionKind parseKind() {
        LineScanner scanner = scanner();
        int start = scanner.position();
        Optional<FunctionKind> kind = scanner.matchIdentifier().flatMap(FunctionKind::fromKeyword);
        if (kind.isPresent()) {
            return kind.get();
        }
        scanner.reset(start);
        return FunctionKind.NONE;
    }

    private AttributeSet parseAttributes() throws ParseException {
        LineScanner scanner = scanner();
        scanner.consumeWhitespace();
        if (!scanner.match('{')) {
            throw fail("missing attribute set");
        }
        scanner.consumeWhitespace();
        if (scanner.match('}')) {
            return AttributeSet.empty();
        }
        Set<BuiltinAttribute> attributes = EnumSet.noneOf(BuiltinAttribute.class);
        while (true) {
            scanner.consumeWhitespace();
            SourceInfo position = scanner.sourceInfo();
            String name = scanner.matchIdentifier().orElseThrow(() -> fail("badly terminated attribute set"));
            attributes.add(BuiltinAttribute.fromKeyword(name)
                    .orElseThrow(() -> fail("unknown attribute '" + name + "'", position)));
            scanner.consumeWhitespace();
            if (scanner.match('}')) {
                return AttributeSet.of(attributes);
            }
            if (!scanner.match(',')) {
                throw fail("attribute not followed by ',' or '}'");
            }
        }
    }

    /**
     * @return The entries in file order.
     */
    public List<BuiltinEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public int stanzaCount() {
        return stanzaCount;
    }
}
