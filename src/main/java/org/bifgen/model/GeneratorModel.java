package org.bifgen.model;

import org.bifgen.frontend.semantics.MangledSignature;
import org.bifgen.frontend.semantics.SymbolTables;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The complete, validated result of parsing both definition files. Emitters only
 * read it; nothing is added once it has been built.
 */
public final class GeneratorModel {

    private final List<BuiltinEntry> builtins;
    private final int builtinStanzaCount;
    private final List<OverloadStanza> overloadStanzas;
    private final List<OverloadEntry> overloads;
    private final SymbolTables tables;
    private final Map<String, List<OverloadEntry>> overloadChains;

    /**
     * @param builtins The built-ins in file order.
     * @param builtinStanzaCount The number of stanzas in the built-in file.
     * @param overloadStanzas The overload stanzas in file order.
     * @param overloads The overload instances in file order.
     * @param tables The registries of the run; frozen by this constructor.
     */
    public GeneratorModel(List<BuiltinEntry> builtins,
                          int builtinStanzaCount,
                          List<OverloadStanza> overloadStanzas,
                          List<OverloadEntry> overloads,
                          SymbolTables tables) {
        this.builtins = List.copyOf(builtins);
        this.builtinStanzaCount = builtinStanzaCount;
        this.overloadStanzas = List.copyOf(overloadStanzas);
        this.overloads = List.copyOf(overloads);
        this.tables = Objects.requireNonNull(tables, "tables");
        tables.freezeAll();

        Map<String, List<OverloadEntry>> chains = new LinkedHashMap<>();
        for (OverloadEntry overload : this.overloads) {
            chains.computeIfAbsent(overload.stanza().externName(), name -> new ArrayList<>()).add(overload);
        }
        chains.replaceAll((name, chain) -> Collections.unmodifiableList(chain));
        this.overloadChains = Collections.unmodifiableMap(chains);
    }

    /**
     * @return The built-ins in file order.
     */
    public List<BuiltinEntry> builtins() {
        return builtins;
    }

    /**
     * @return The built-ins in ascending id order, the order of the built-in enumeration.
     */
    public List<BuiltinEntry> builtinsById() {
        return List.copyOf(tables.builtinIds().values());
    }

    public int builtinStanzaCount() {
        return builtinStanzaCount;
    }

    /**
     * @return The overload stanzas in file order.
     */
    public List<OverloadStanza> overloadStanzas() {
        return overloadStanzas;
    }

    /**
     * @return The overload instances in file order.
     */
    public List<OverloadEntry> overloads() {
        return overloads;
    }

    /**
     * @return The overload instances in ascending instance id order.
     */
    public List<OverloadEntry> overloadsById() {
        return List.copyOf(tables.overloadIds().values());
    }

    /**
     * @return The distinct function types in ascending id order.
     */
    public List<MangledSignature> functionTypes() {
        return List.copyOf(tables.typeDescIds().values());
    }

    /**
     * Groups the overload instances by the external name of their stanza. Chains appear
     * in the order their first instance was defined; each chain keeps file order.
     * Stanzas sharing an external name contribute to the same chain.
     *
     * @return The chains keyed by external name.
     */
    public Map<String, List<OverloadEntry>> overloadChains() {
        return overloadChains;
    }
}
