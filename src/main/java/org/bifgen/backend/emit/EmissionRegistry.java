package org.bifgen.backend.emit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Registry for artifact emitters applied in order.
 */
public final class EmissionRegistry {

    private final List<IArtifactEmitter> emitters = new ArrayList<>();

    /**
     * Registers a new emitter.
     * @param emitter The emitter to register.
     */
    public void register(IArtifactEmitter emitter) { emitters.add(emitter); }

    /**
     * @return The registered emitters in registration order.
     */
    public List<IArtifactEmitter> emitters() { return Collections.unmodifiableList(emitters); }

    /**
     * Initializes a new registry with the emitters of the three artifacts.
     * @return A new registry with default emitters.
     */
    public static EmissionRegistry initializeWithDefaults() {
        EmissionRegistry reg = new EmissionRegistry();
        reg.register(new DeclarationsEmitter());
        reg.register(new DefinitionsEmitter());
        reg.register(new AliasesEmitter());
        return reg;
    }
}
