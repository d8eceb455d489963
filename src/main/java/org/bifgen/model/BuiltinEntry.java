package org.bifgen.model;

import org.bifgen.api.SourceInfo;
import org.bifgen.frontend.types.Prototype;

/**
 * One built-in function read from the built-in definition file.
 *
 * @param stanza The gating stanza the entry belongs to.
 * @param kind The purity modifier.
 * @param prototype The parsed signature.
 * @param id The globally unique built-in id.
 * @param patternName The expansion pattern invoked for the built-in.
 * @param attributes The attribute set.
 * @param typeDescId The mangled function type descriptor id.
 * @param source Where the prototype line was read.
 */
public record BuiltinEntry(BuiltinStanza stanza,
                           FunctionKind kind,
                           Prototype prototype,
                           String id,
                           String patternName,
                           AttributeSet attributes,
                           String typeDescId,
                           SourceInfo source) {}
