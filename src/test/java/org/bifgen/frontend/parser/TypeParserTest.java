package org.bifgen.frontend.parser;

import org.bifgen.api.GeneratorOptions;
import org.bifgen.frontend.types.BaseType;
import org.bifgen.frontend.types.Restriction;
import org.bifgen.frontend.types.RestrictionKind;
import org.bifgen.frontend.types.TypeDescriptor;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link TypeParser}.
 * These tests verify the recognized flags of each type form and the diagnostics for malformed types.
 */
@Tag("unit")
public class TypeParserTest {

    private static TypeDescriptor parse(String text) throws ParseException {
        TestParsingContext context = new TestParsingContext(text);
        return new TypeParser(context).parseType(TypeParser.VoidPolicy.VOID_NOT_ALLOWED);
    }

    private static TypeDescriptor parseReturn(String text) throws ParseException {
        TestParsingContext context = new TestParsingContext(text);
        return new TypeParser(context).parseType(TypeParser.VoidPolicy.VOID_ALLOWED);
    }

    @Test
    void parsesPlainScalar() throws ParseException {
        TypeDescriptor type = parse("int");

        assertThat(type.base()).isEqualTo(BaseType.INT);
        assertThat(type.isVector()).isFalse();
        assertThat(type.isPointer()).isFalse();
        assertThat(type.restriction().isPresent()).isFalse();
    }

    /**
     * Verifies that "long long" is recognized as a single two-token base type
     * and that signedness applies to it.
     */
    @Test
    void parsesUnsignedLongLong() throws ParseException {
        TypeDescriptor type = parse("unsigned long long");

        assertThat(type.base()).isEqualTo(BaseType.LONG_LONG);
        assertThat(type.isUnsigned()).isTrue();
    }

    @Test
    void parsesConstCharPointer() throws ParseException {
        TypeDescriptor type = parse("const char *");

        assertThat(type.isConst()).isTrue();
        assertThat(type.isPointer()).isTrue();
        assertThat(type.base()).isEqualTo(BaseType.CHAR);
    }

    /**
     * Verifies that vector shorthands set the vector flags and element type.
     */
    @ParameterizedTest
    @CsvSource({
            "vsc, CHAR, false, false, false",
            "vuc, CHAR, true, false, false",
            "vbi, INT, false, true, false",
            "vull, LONG_LONG, true, false, false",
            "vp, SHORT, false, false, true",
            "vd, DOUBLE, false, false, false"
    })
    void parsesVectorShorthand(String token, BaseType element, boolean unsigned, boolean bool, boolean pixel)
            throws ParseException {
        TypeDescriptor type = parse(token);

        assertThat(type.isVector()).isTrue();
        assertThat(type.base()).isEqualTo(element);
        assertThat(type.isUnsigned()).isEqualTo(unsigned);
        assertThat(type.isBool()).isEqualTo(bool);
        assertThat(type.isPixel()).isEqualTo(pixel);
    }

    @Test
    void parsesOpaqueVector() throws ParseException {
        TypeDescriptor type = parse("vop");

        assertThat(type.isOpaque()).isTrue();
        assertThat(type.base()).isNull();
    }

    @Test
    void rejectsOpaqueVectorPointer() {
        assertThatThrownBy(() -> parse("vop *"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("'vop' cannot be a pointer");
    }

    /**
     * Verifies each restriction form on a const int operand.
     */
    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "const int<5>      | BITS      | 5  | 0",
            "const int<-16,15> | RANGE     | -16 | 15",
            "const int[0,3]    | VAR_RANGE | 0  | 3",
            "const int{2,4}    | VALUES    | 2  | 4",
            "const int {4, 2}  | VALUES    | 4  | 2",
            "const int<40>     | BITS      | 40 | 0",
            "const int[5,2]    | VAR_RANGE | 5  | 2",
            "const unsigned int<3> | BITS  | 3  | 0"
    })
    void parsesRestriction(String text, RestrictionKind kind, int value1, int value2) throws ParseException {
        TypeDescriptor type = parse(text);

        assertThat(type.restriction()).isEqualTo(new Restriction(kind, value1, value2));
        assertThat(type.isConst()).isTrue();
    }

    @Test
    void constVectorIsAccepted() throws ParseException {
        TypeDescriptor type = parse("const vsi *");

        assertThat(type.isConst()).isTrue();
        assertThat(type.isVector()).isTrue();
        assertThat(type.isPointer()).isTrue();
    }

    @Test
    void constIntWithoutRestrictionIsAccepted() throws ParseException {
        TypeDescriptor type = parse("const int");

        assertThat(type.isConst()).isTrue();
        assertThat(type.restriction()).isEqualTo(Restriction.NONE);
    }

    @Test
    void voidIsAcceptedOnlyWhereAllowed() throws ParseException {
        assertThat(parseReturn("void").isVoid()).isTrue();
        assertThat(parse("void *").isPointer()).isTrue();
        assertThatThrownBy(() -> parse("void"))
                .isInstanceOf(ParseException.class)
                .hasMessage("test.def:1:1: 'void' is not allowed here");
    }

    /**
     * Verifies the diagnostics for malformed types, including their columns.
     */
    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "const double         | test.def:1:7: 'const' not followed by 'int', a 'char' pointer or a vector type",
            "const double *       | test.def:1:7: 'const' not followed by 'int', a 'char' pointer or a vector type",
            "const unsigned short * | test.def:1:7: 'const' not followed by 'int', a 'char' pointer or a vector type",
            "const signed char *  | test.def:1:7: 'const' not followed by 'int', a 'char' pointer or a vector type",
            "const int *          | test.def:1:7: 'const' not followed by 'int', a 'char' pointer or a vector type",
            "const void *         | test.def:1:7: 'const' not followed by 'int', a 'char' pointer or a vector type",
            "unsigned float       | test.def:1:10: 'unsigned' requires an integral base type",
            "long int             | test.def:1:6: incomplete 'long long'",
            "bogus                | test.def:1:1: unknown base type 'bogus'",
            "const int<a>         | test.def:1:11: malformed integer",
            "const int[1;2]       | test.def:1:12: malformed restriction, expected ','",
            "const int[1,2>       | test.def:1:14: malformed restriction, expected ']'",
            "(                    | test.def:1:1: missing or badly formed type"
    })
    void reportsMalformedTypes(String text, String diagnostic) {
        assertThatThrownBy(() -> parse(text))
                .isInstanceOf(ParseException.class)
                .hasMessage(diagnostic);
    }

    /**
     * Verifies that a base type left out of the configured vocabulary is unknown,
     * and that vector shorthands over it are rejected too.
     */
    @Test
    void disabledBaseTypeIsUnknown() {
        GeneratorOptions options = GeneratorOptions.defaults()
                .withBaseTypes(EnumSet.complementOf(EnumSet.of(BaseType.INT128)));

        TestParsingContext scalar = new TestParsingContext("__int128", options);
        assertThatThrownBy(() -> new TypeParser(scalar).parseType(TypeParser.VoidPolicy.VOID_NOT_ALLOWED))
                .hasMessageContaining("unknown base type '__int128'");

        TestParsingContext vector = new TestParsingContext("vuq", options);
        assertThatThrownBy(() -> new TypeParser(vector).parseType(TypeParser.VoidPolicy.VOID_NOT_ALLOWED))
                .hasMessageContaining("needs disabled base type '__int128'");
    }

    /**
     * Verifies that a failure is recorded in the diagnostics engine as well as thrown.
     */
    @Test
    void failureIsReportedToDiagnostics() {
        TestParsingContext context = new TestParsingContext("bogus");

        assertThatThrownBy(() -> new TypeParser(context).parseType(TypeParser.VoidPolicy.VOID_NOT_ALLOWED))
                .isInstanceOf(ParseException.class);
        assertThat(context.engine().hasErrors()).isTrue();
        assertThat(context.engine().firstError()).hasValueSatisfying(d -> assertThat(d.columnNumber()).isEqualTo(1));
    }
}
