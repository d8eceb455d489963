package org.bifgen.backend.emit;

import org.bifgen.model.GeneratorModel;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link AliasesEmitter}.
 */
@Tag("unit")
public class AliasesEmitterTest {

    /**
     * Verifies the banner and one alias line per stanza, in stanza order.
     */
    @Test
    void writesOneAliasPerStanzaInOrder() throws Exception {
        // Arrange
        GeneratorModel model = TestModels.model(
                "[always]\n  int __builtin_a (int);\n    A a {}\n",
                String.join("\n",
                        "[VEC_Z, vec_z, __builtin_vec_z]",
                        "  int __builtin_vec_z (int);",
                        "    A",
                        "[VEC_B, vec_b, __builtin_vec_b]"));

        // Act
        String text = TestModels.render(new AliasesEmitter(), model);

        // Assert
        assertThat(text).isEqualTo(String.join("\n",
                "/* Automatically generated by the program 'bifgen'",
                "   from the files 'bif.def' and 'ovld.def'.  */",
                "",
                "#define vec_z __builtin_vec_z",
                "#define vec_b __builtin_vec_b",
                ""));
    }

    @Test
    void emptyModelWritesOnlyTheBanner() throws Exception {
        String text = TestModels.render(new AliasesEmitter(), TestModels.model("", ""));

        assertThat(text.lines()).hasSize(3);
        assertThat(text).doesNotContain("#define");
    }
}
