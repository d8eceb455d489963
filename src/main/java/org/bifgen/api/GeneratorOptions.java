package org.bifgen.api;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.bifgen.frontend.types.BaseType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Policy settings of a generator run, read from the {@code bifgen} section of the
 * HOCON configuration.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * bifgen {
 *   target-prefix = "rs6000"
 *   max-restricted-operands = 2
 *   base-types = [ char, short, int, "long long", ... ]
 *   limits {
 *     max-builtins = 0          # 0 means unbounded
 *     max-overloads = 0
 *     max-overload-stanzas = 0
 *   }
 * }
 * </pre>
 */
public final class GeneratorOptions {

    private static final String ROOT_PATH = "bifgen";

    private final String targetPrefix;
    private final int maxRestrictedOperands;
    private final Set<BaseType> baseTypes;
    private final int maxBuiltins;
    private final int maxOverloads;
    private final int maxOverloadStanzas;

    private GeneratorOptions(String targetPrefix, int maxRestrictedOperands, Set<BaseType> baseTypes,
                             int maxBuiltins, int maxOverloads, int maxOverloadStanzas) {
        this.targetPrefix = targetPrefix;
        this.maxRestrictedOperands = maxRestrictedOperands;
        this.baseTypes = Collections.unmodifiableSet(EnumSet.copyOf(baseTypes));
        this.maxBuiltins = maxBuiltins;
        this.maxOverloads = maxOverloads;
        this.maxOverloadStanzas = maxOverloadStanzas;
    }

    /**
     * @return The options defined by the {@code reference.conf} on the classpath.
     */
    public static GeneratorOptions defaults() {
        return fromConfig(ConfigFactory.defaultReference());
    }

    /**
     * Reads the options from a configuration. Missing keys fall back to the classpath defaults.
     *
     * @param config The application configuration.
     * @return The options.
     * @throws ConfigException.BadValue if a value is out of range or names an unknown base type.
     */
    public static GeneratorOptions fromConfig(Config config) {
        Config section = config.withFallback(ConfigFactory.defaultReference()).getConfig(ROOT_PATH);

        String prefix = section.getString("target-prefix");
        if (!prefix.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            throw new ConfigException.BadValue(ROOT_PATH + ".target-prefix", "must be a C identifier, got '" + prefix + "'");
        }

        int maxRestricted = nonNegative(section, "max-restricted-operands");

        List<String> keywords = section.getStringList("base-types");
        Set<BaseType> baseTypes = EnumSet.noneOf(BaseType.class);
        for (String keyword : keywords) {
            BaseType baseType = BaseType.fromKeyword(keyword.trim())
                    .orElseThrow(() -> new ConfigException.BadValue(ROOT_PATH + ".base-types", "unknown base type '" + keyword + "'"));
            baseTypes.add(baseType);
        }
        if (baseTypes.isEmpty()) {
            throw new ConfigException.BadValue(ROOT_PATH + ".base-types", "at least one base type is required");
        }

        return new GeneratorOptions(prefix, maxRestricted, baseTypes,
                nonNegative(section, "limits.max-builtins"),
                nonNegative(section, "limits.max-overloads"),
                nonNegative(section, "limits.max-overload-stanzas"));
    }

    private static int nonNegative(Config section, String path) {
        int value = section.getInt(path);
        if (value < 0) {
            throw new ConfigException.BadValue(ROOT_PATH + "." + path, "must not be negative, got " + value);
        }
        return value;
    }

    /**
     * @return A copy of these options with a different restricted-operand limit.
     */
    public GeneratorOptions withMaxRestrictedOperands(int limit) {
        return new GeneratorOptions(targetPrefix, limit, baseTypes, maxBuiltins, maxOverloads, maxOverloadStanzas);
    }

    /**
     * @return A copy of these options accepting only the given base types.
     */
    public GeneratorOptions withBaseTypes(Set<BaseType> types) {
        return new GeneratorOptions(targetPrefix, maxRestrictedOperands, types, maxBuiltins, maxOverloads, maxOverloadStanzas);
    }

    /**
     * @return The lower-case prefix used for generated type, table and function names.
     */
    public String targetPrefix() {
        return targetPrefix;
    }

    /**
     * @return The prefix used for generated enumerators.
     */
    public String enumPrefix() {
        return targetPrefix.toUpperCase(Locale.ROOT);
    }

    public int maxRestrictedOperands() {
        return maxRestrictedOperands;
    }

    public Set<BaseType> baseTypes() {
        return baseTypes;
    }

    public boolean isBaseTypeEnabled(BaseType baseType) {
        return baseTypes.contains(baseType);
    }

    /** @return The maximum number of built-ins, 0 if unbounded. */
    public int maxBuiltins() {
        return maxBuiltins;
    }

    /** @return The maximum number of overload instances, 0 if unbounded. */
    public int maxOverloads() {
        return maxOverloads;
    }

    /** @return The maximum number of overload stanzas, 0 if unbounded. */
    public int maxOverloadStanzas() {
        return maxOverloadStanzas;
    }
}
