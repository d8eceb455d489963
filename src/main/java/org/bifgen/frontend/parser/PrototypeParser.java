package org.bifgen.frontend.parser;

import org.bifgen.frontend.lexer.LineScanner;
import org.bifgen.frontend.types.Prototype;
import org.bifgen.frontend.types.RestrictedOperand;
import org.bifgen.frontend.types.TypeDescriptor;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses a function prototype that fills the rest of the current line:
 * return type, name, parenthesized argument types, {@code ;}.
 */
public class PrototypeParser {

    private final ParsingContext context;
    private final TypeParser typeParser;

    public PrototypeParser(ParsingContext context, TypeParser typeParser) {
        this.context = context;
        this.typeParser = typeParser;
    }

    /**
     * Parses a prototype starting at the cursor. The cursor must be followed by the
     * prototype and nothing else on the line.
     *
     * @return The prototype.
     * @throws ParseException on the first malformed part, or if more arguments carry a
     *                        restriction than the configured limit permits.
     */
    public Prototype parsePrototype() throws ParseException {
        LineScanner scanner = context.scanner();

        scanner.consumeWhitespace();
        final int returnStart = scanner.position();
        TypeDescriptor returnType = typeParser.parseType(TypeParser.VoidPolicy.VOID_ALLOWED);
        if (returnType.restriction().isPresent()) {
            throw context.fail("a return type cannot be restricted", scanner.sourceInfo(returnStart));
        }

        scanner.consumeWhitespace();
        String name = scanner.matchIdentifier().orElseThrow(() -> context.fail("missing function name"));

        scanner.consumeWhitespace();
        if (!scanner.match('(')) {
            throw context.fail("missing '('");
        }

        List<TypeDescriptor> args = new ArrayList<>();
        List<RestrictedOperand> restricted = new ArrayList<>();
        scanner.consumeWhitespace();
        if (!scanner.match(')')) {
            while (true) {
                scanner.consumeWhitespace();
                int argStart = scanner.position();
                if (scanner.peek() == ')') {
                    throw context.fail("missing argument type after ','");
                }
                TypeDescriptor arg = typeParser.parseType(TypeParser.VoidPolicy.VOID_NOT_ALLOWED);
                args.add(arg);
                if (arg.restriction().isPresent()) {
                    int limit = context.options().maxRestrictedOperands();
                    if (restricted.size() >= limit) {
                        throw context.fail("more than " + limit + " restricted operand(s)", scanner.sourceInfo(argStart));
                    }
                    restricted.add(new RestrictedOperand(args.size(), arg.restriction()));
                }
                scanner.consumeWhitespace();
                if (scanner.match(')')) {
                    break;
                }
                if (!scanner.match(',')) {
                    throw context.fail("argument not followed by ',' or ')'");
                }
            }
        }

        scanner.consumeWhitespace();
        if (!scanner.match(';')) {
            throw context.fail("missing semicolon");
        }
        scanner.consumeWhitespace();
        if (!scanner.atEndOfLine()) {
            throw context.fail("garbage at end of line");
        }
        return new Prototype(returnType, name, args, restricted);
    }
}
