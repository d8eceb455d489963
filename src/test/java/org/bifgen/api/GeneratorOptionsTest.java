package org.bifgen.api;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.bifgen.frontend.types.BaseType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for {@link GeneratorOptions}.
 */
@Tag("unit")
public class GeneratorOptionsTest {

    @Test
    void defaultsComeFromReferenceConf() {
        GeneratorOptions options = GeneratorOptions.defaults();

        assertThat(options.targetPrefix()).isEqualTo("rs6000");
        assertThat(options.enumPrefix()).isEqualTo("RS6000");
        assertThat(options.maxRestrictedOperands()).isEqualTo(2);
        assertThat(options.baseTypes()).containsExactlyInAnyOrder(BaseType.values());
        assertThat(options.maxBuiltins()).isZero();
    }

    /**
     * Verifies that a partial configuration falls back to the defaults for every other key.
     */
    @Test
    void partialConfigFallsBackToDefaults() {
        GeneratorOptions options = GeneratorOptions.fromConfig(ConfigFactory.parseString(
                "bifgen { max-restricted-operands = 1, base-types = [ int, \"long long\" ] }"));

        assertThat(options.maxRestrictedOperands()).isEqualTo(1);
        assertThat(options.baseTypes()).containsExactlyInAnyOrder(BaseType.INT, BaseType.LONG_LONG);
        assertThat(options.isBaseTypeEnabled(BaseType.FLOAT)).isFalse();
        assertThat(options.targetPrefix()).isEqualTo("rs6000");
    }

    @Test
    void rejectsUnknownBaseType() {
        assertThatThrownBy(() -> GeneratorOptions.fromConfig(ConfigFactory.parseString("bifgen.base-types = [ quad ]")))
                .isInstanceOf(ConfigException.BadValue.class)
                .hasMessageContaining("unknown base type 'quad'");
    }

    @Test
    void rejectsNegativeLimit() {
        assertThatThrownBy(() -> GeneratorOptions.fromConfig(ConfigFactory.parseString("bifgen.limits.max-overloads = -3")))
                .isInstanceOf(ConfigException.BadValue.class)
                .hasMessageContaining("max-overloads");
    }

    @Test
    void rejectsPrefixThatIsNotAnIdentifier() {
        assertThatThrownBy(() -> GeneratorOptions.fromConfig(ConfigFactory.parseString("bifgen.target-prefix = \"rs-6000\"")))
                .isInstanceOf(ConfigException.BadValue.class);
    }
}
