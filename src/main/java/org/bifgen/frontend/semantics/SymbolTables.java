package org.bifgen.frontend.semantics;

import org.bifgen.api.GeneratorOptions;
import org.bifgen.model.BuiltinEntry;
import org.bifgen.model.OverloadEntry;

/**
 * The three registries of a generator run: built-in ids, overload instance ids and
 * mangled function type descriptor ids. Owned by one run and never shared.
 */
public final class SymbolTables {

    private final SymbolRegistry<BuiltinEntry> builtinIds;
    private final SymbolRegistry<OverloadEntry> overloadIds;
    private final SymbolRegistry<MangledSignature> typeDescIds = new SymbolRegistry<>("function types");

    /**
     * @param options Supplies the soft capacity limits.
     */
    public SymbolTables(GeneratorOptions options) {
        this.builtinIds = new SymbolRegistry<>("built-in ids", options.maxBuiltins());
        this.overloadIds = new SymbolRegistry<>("overload ids", options.maxOverloads());
    }

    public SymbolRegistry<BuiltinEntry> builtinIds() {
        return builtinIds;
    }

    public SymbolRegistry<OverloadEntry> overloadIds() {
        return overloadIds;
    }

    public SymbolRegistry<MangledSignature> typeDescIds() {
        return typeDescIds;
    }

    /**
     * Records a function type descriptor. Duplicates are expected across unrelated functions.
     * @param signature The mangled signature.
     * @return The descriptor id.
     */
    public String recordFunctionType(MangledSignature signature) {
        typeDescIds.insert(signature.id(), signature);
        return signature.id();
    }

    /**
     * Closes all registries before generation starts.
     */
    public void freezeAll() {
        builtinIds.freeze();
        overloadIds.freeze();
        typeDescIds.freeze();
    }
}
