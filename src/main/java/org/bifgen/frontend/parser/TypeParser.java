package org.bifgen.frontend.parser;

import org.bifgen.frontend.lexer.LineScanner;
import org.bifgen.frontend.types.BaseType;
import org.bifgen.frontend.types.Restriction;
import org.bifgen.frontend.types.TypeDescriptor;
import org.bifgen.frontend.types.VectorShorthand;

import java.util.Optional;

/**
 * Recognizes one return or argument type:
 * <pre>
 * type := ['const'] ( 'void' | vector-shorthand | ['signed' | 'unsigned'] basetype ) ['*'] [restriction]
 * restriction := '&lt;' N '&gt;' | '&lt;' X ',' Y '&gt;' | '[' X ',' Y ']' | '{' X ',' Y '}'
 * </pre>
 * {@code const} may only precede a vector shorthand, {@code char *}, or a non-pointer
 * {@code int}, {@code signed int} or {@code unsigned int}. A restriction may only follow
 * such a {@code const int}.
 */
public class TypeParser {

    /**
     * Whether a bare {@code void} is acceptable at the position being parsed.
     * {@code void *} is always acceptable.
     */
    public enum VoidPolicy {
        VOID_ALLOWED,
        VOID_NOT_ALLOWED
    }

    private final ParsingContext context;

    public TypeParser(ParsingContext context) {
        this.context = context;
    }

    /**
     * Parses a type starting at the cursor.
     * @param voidPolicy Whether a bare {@code void} is acceptable.
     * @return The recognized type; the cursor is left just after it.
     * @throws ParseException if no well-formed type starts at the cursor.
     */
    public TypeDescriptor parseType(VoidPolicy voidPolicy) throws ParseException {
        LineScanner scanner = context.scanner();
        scanner.consumeWhitespace();
        final int typeStart = scanner.position();
        TypeDescriptor.Builder builder = TypeDescriptor.builder();

        String token = scanner.matchIdentifier()
                .orElseThrow(() -> context.fail("missing or badly formed type", scanner.sourceInfo(typeStart)));
        int tokenStart = typeStart;
        if (token.equals("const")) {
            builder.isConst();
            scanner.consumeWhitespace();
            final int afterConst = scanner.position();
            token = scanner.matchIdentifier()
                    .orElseThrow(() -> context.fail("missing type after 'const'", scanner.sourceInfo(afterConst)));
            tokenStart = afterConst;
        }

        if (token.equals("void")) {
            if (builder.hasConst()) {
                throw constMisuse(tokenStart);
            }
            return parseVoid(builder, voidPolicy, tokenStart);
        }

        Optional<VectorShorthand> shorthand = VectorShorthand.fromToken(token);
        if (shorthand.isPresent()) {
            return parseVector(builder, shorthand.get(), tokenStart);
        }

        final int constTargetStart = tokenStart;
        String signedness = null;
        if (token.equals("signed") || token.equals("unsigned")) {
            signedness = token;
            if (token.equals("signed")) {
                builder.isSigned();
            } else {
                builder.isUnsigned();
            }
            scanner.consumeWhitespace();
            final int afterSign = scanner.position();
            final String qualifier = signedness;
            token = scanner.matchIdentifier().orElseThrow(() ->
                    context.fail("missing base type after '" + qualifier + "'", scanner.sourceInfo(afterSign)));
            tokenStart = afterSign;
        }

        BaseType base = parseBaseType(token, tokenStart);
        if (signedness != null && !base.isIntegral()) {
            throw context.fail("'" + signedness + "' requires an integral base type", scanner.sourceInfo(tokenStart));
        }
        builder.base(base);

        boolean pointer = parsePointer(builder);
        if (builder.hasConst()) {
            boolean constCharPointer = base == BaseType.CHAR && pointer && signedness == null;
            if (constCharPointer) {
                return builder.build();
            }
            if (base != BaseType.INT || pointer) {
                throw constMisuse(constTargetStart);
            }
            scanner.consumeWhitespace();
            char next = scanner.peek();
            if (next == '<' || next == '[' || next == '{') {
                builder.restriction(parseRestriction());
            }
        }
        return builder.build();
    }

    private ParseException constMisuse(int position) {
        return context.fail("'const' not followed by 'int', a 'char' pointer or a vector type",
                context.scanner().sourceInfo(position));
    }

    private TypeDescriptor parseVoid(TypeDescriptor.Builder builder, VoidPolicy voidPolicy, int tokenStart) throws ParseException {
        builder.isVoid();
        if (!parsePointer(builder) && voidPolicy == VoidPolicy.VOID_NOT_ALLOWED) {
            throw context.fail("'void' is not allowed here", context.scanner().sourceInfo(tokenStart));
        }
        return builder.build();
    }

    private TypeDescriptor parseVector(TypeDescriptor.Builder builder, VectorShorthand shorthand, int tokenStart) throws ParseException {
        LineScanner scanner = context.scanner();
        BaseType element = shorthand.element();
        if (element != null && !context.options().isBaseTypeEnabled(element)) {
            throw context.fail("vector type '" + shorthand.token() + "' needs disabled base type '" + element.keyword() + "'",
                    scanner.sourceInfo(tokenStart));
        }
        shorthand.applyTo(builder);
        if (shorthand.allowsPointer()) {
            parsePointer(builder);
        } else {
            scanner.consumeWhitespace();
            if (scanner.peek() == '*') {
                throw context.fail("'" + shorthand.token() + "' cannot be a pointer");
            }
        }
        return builder.build();
    }

    private BaseType parseBaseType(String token, int tokenStart) throws ParseException {
        LineScanner scanner = context.scanner();
        String keyword = token;
        if (token.equals("long")) {
            scanner.consumeWhitespace();
            final int secondStart = scanner.position();
            Optional<String> second = scanner.matchIdentifier();
            if (second.isEmpty() || !second.get().equals("long")) {
                throw context.fail("incomplete 'long long'", scanner.sourceInfo(secondStart));
            }
            keyword = "long long";
        }
        final String baseKeyword = keyword;
        return BaseType.fromKeyword(baseKeyword)
                .filter(context.options()::isBaseTypeEnabled)
                .orElseThrow(() -> context.fail("unknown base type '" + baseKeyword + "'", scanner.sourceInfo(tokenStart)));
    }

    private boolean parsePointer(TypeDescriptor.Builder builder) {
        LineScanner scanner = context.scanner();
        scanner.consumeWhitespace();
        if (scanner.match('*')) {
            builder.isPointer();
            return true;
        }
        return false;
    }

    private Restriction parseRestriction() throws ParseException {
        LineScanner scanner = context.scanner();
        char open = scanner.peek();
        char close = switch (open) {
            case '<' -> '>';
            case '[' -> ']';
            default -> '}';
        };
        scanner.match(open);

        int first = expectInteger();
        scanner.consumeWhitespace();
        if (open == '<' && scanner.match('>')) {
            return Restriction.bits(first);
        }
        if (!scanner.match(',')) {
            throw context.fail("malformed restriction, expected ','");
        }
        int second = expectInteger();
        scanner.consumeWhitespace();
        if (!scanner.match(close)) {
            throw context.fail("malformed restriction, expected '" + close + "'");
        }
        return switch (open) {
            case '<' -> Restriction.range(first, second);
            case '[' -> Restriction.varRange(first, second);
            default -> Restriction.values(first, second);
        };
    }

    private int expectInteger() throws ParseException {
        LineScanner scanner = context.scanner();
        scanner.consumeWhitespace();
        return scanner.matchInteger().orElseThrow(() -> context.fail("malformed integer"));
    }
}
