package org.bifgen.backend.emit;

import org.bifgen.model.GeneratorModel;
import org.bifgen.model.OverloadStanza;

import java.io.IOException;

/**
 * Writes one macro per overload stanza, mapping the external name to the internal one.
 */
public class AliasesEmitter implements IArtifactEmitter {

    @Override
    public ArtifactKind kind() {
        return ArtifactKind.ALIASES;
    }

    @Override
    public void emit(GeneratorModel model, EmissionContext context, SourceWriter out) throws IOException {
        out.banner(context);
        for (OverloadStanza stanza : model.overloadStanzas()) {
            out.format("#define %s %s", stanza.externName(), stanza.internName());
        }
    }
}
