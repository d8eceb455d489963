package org.bifgen.frontend.semantics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link SymbolRegistry}.
 */
@Tag("unit")
public class SymbolRegistryTest {

    /**
     * Verifies that a duplicate id is reported and the first value is kept.
     */
    @Test
    void duplicateKeepsFirstValue() {
        SymbolRegistry<Integer> registry = new SymbolRegistry<>("test");

        assertThat(registry.insert("A", 1)).isEqualTo(SymbolRegistry.InsertOutcome.INSERTED);
        assertThat(registry.insert("A", 2)).isEqualTo(SymbolRegistry.InsertOutcome.DUPLICATE);
        assertThat(registry.get("A")).contains(1);
        assertThat(registry.size()).isEqualTo(1);
    }

    /**
     * Verifies that iteration order is ascending by id, independent of insertion order.
     */
    @Test
    void iteratesInIdOrder() {
        SymbolRegistry<String> registry = new SymbolRegistry<>("test");
        registry.insert("VADD", "c");
        registry.insert("ABS", "a");
        registry.insert("MUL", "b");

        assertThat(registry.ids()).containsExactly("ABS", "MUL", "VADD");
        assertThat(registry.values()).containsExactly("a", "b", "c");
    }

    @Test
    void capacityIsEnforcedButDuplicatesWin() {
        SymbolRegistry<Integer> registry = new SymbolRegistry<>("test", 1);
        registry.insert("A", 1);

        assertThat(registry.insert("A", 1)).isEqualTo(SymbolRegistry.InsertOutcome.DUPLICATE);
        assertThat(registry.insert("B", 2)).isEqualTo(SymbolRegistry.InsertOutcome.CAPACITY_EXCEEDED);
        assertThat(registry.contains("B")).isFalse();
    }

    @Test
    void frozenRegistryRejectsInsertions() {
        SymbolRegistry<Integer> registry = new SymbolRegistry<>("built-in ids");
        registry.insert("A", 1);
        registry.freeze();

        assertThat(registry.isFrozen()).isTrue();
        assertThat(registry.contains("A")).isTrue();
        assertThatThrownBy(() -> registry.insert("B", 2))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("built-in ids");
    }

    @Test
    void negativeCapacityIsRejected() {
        assertThatThrownBy(() -> new SymbolRegistry<>("test", -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
