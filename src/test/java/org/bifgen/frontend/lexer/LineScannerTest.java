package org.bifgen.frontend.lexer;

import org.bifgen.api.InternalGeneratorError;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link LineScanner}.
 */
@Tag("unit")
public class LineScannerTest {

    /**
     * Verifies that blank lines and comment lines are skipped and that line numbers
     * still count them.
     */
    @Test
    void advanceLine_skipsBlankAndCommentLines() throws IOException {
        // Arrange
        LineScanner scanner = LineScanner.of("test.def", "\n; a comment\n   \n  [always]\n");

        // Act
        boolean found = scanner.advanceLine();

        // Assert
        assertThat(found).isTrue();
        assertThat(scanner.lineNumber()).isEqualTo(4);
        assertThat(scanner.peek()).isEqualTo('[');
        assertThat(scanner.column()).isEqualTo(3);
        assertThat(scanner.advanceLine()).isFalse();
    }

    /**
     * Verifies identifier matching stops at the first non-identifier character and
     * leaves the cursor untouched when nothing matches.
     */
    @Test
    void matchIdentifier_consumesMaximalRun() throws IOException {
        // Arrange
        LineScanner scanner = LineScanner.of("test.def", "__builtin_foo2(int)");
        scanner.advanceLine();

        // Act & Assert
        assertThat(scanner.matchIdentifier()).contains("__builtin_foo2");
        assertThat(scanner.peek()).isEqualTo('(');
        assertThat(scanner.matchIdentifier()).isEmpty();
        assertThat(scanner.position()).isEqualTo(14);
    }

    /**
     * Verifies negative integers and rejection of values that do not fit in an int.
     */
    @Test
    void matchInteger_handlesSignAndOverflow() throws IOException {
        // Arrange
        LineScanner scanner = LineScanner.of("test.def", "-16 99999999999 x");
        scanner.advanceLine();

        // Act & Assert
        assertThat(scanner.matchInteger()).hasValue(-16);
        scanner.consumeWhitespace();
        int before = scanner.position();
        assertThat(scanner.matchInteger()).isEmpty();
        assertThat(scanner.position()).isEqualTo(before);
    }

    /**
     * Verifies that a line at the length limit is reported as an internal error with its position.
     */
    @Test
    void advanceLine_rejectsOverlongLine() {
        // Arrange
        LineScanner scanner = LineScanner.of("long.def", "x".repeat(LineScanner.MAX_LINE_LENGTH));

        // Act & Assert
        assertThatThrownBy(scanner::advanceLine)
                .isInstanceOf(InternalGeneratorError.class)
                .hasMessageContaining("long.def:1")
                .hasMessageContaining("line length overrun");
    }

    /**
     * Verifies that source positions use 1-based columns and carry the line text.
     */
    @Test
    void sourceInfo_reportsOneBasedColumn() throws IOException {
        // Arrange
        LineScanner scanner = LineScanner.of("test.def", "abc def");
        scanner.advanceLine();
        scanner.matchIdentifier();
        scanner.consumeWhitespace();

        // Act & Assert
        assertThat(scanner.sourceInfo().columnNumber()).isEqualTo(5);
        assertThat(scanner.sourceInfo().lineContent()).isEqualTo("abc def");
        assertThat(scanner.sourceInfo().toString()).isEqualTo("test.def:1:5");
    }
}
