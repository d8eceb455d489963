package org.bifgen.model;

import org.bifgen.api.SourceInfo;
import org.bifgen.frontend.types.Prototype;

/**
 * One instance of an overloaded function.
 *
 * @param stanza The overload stanza the instance belongs to.
 * @param prototype The instance signature.
 * @param builtinId The built-in id the instance resolves to; always registered in the built-in file.
 * @param overloadId The unique instance id. Equals {@code builtinId} unless given explicitly.
 * @param typeDescId The mangled function type descriptor id.
 * @param source Where the prototype line was read.
 */
public record OverloadEntry(OverloadStanza stanza,
                            Prototype prototype,
                            String builtinId,
                            String overloadId,
                            String typeDescId,
                            SourceInfo source) {}
