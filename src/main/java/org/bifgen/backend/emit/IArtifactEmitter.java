package org.bifgen.backend.emit;

import org.bifgen.model.GeneratorModel;

import java.io.IOException;

/**
 * Writes one generated artifact from the validated model.
 */
public interface IArtifactEmitter {

    /**
     * @return The artifact this emitter writes.
     */
    ArtifactKind kind();

    /**
     * Writes the artifact.
     *
     * @param model   The validated model; never modified.
     * @param context The emission context.
     * @param out     The destination.
     * @throws IOException if writing fails.
     */
    void emit(GeneratorModel model, EmissionContext context, SourceWriter out) throws IOException;
}
