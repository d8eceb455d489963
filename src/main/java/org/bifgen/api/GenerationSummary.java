package org.bifgen.api;

/**
 * Counts describing a completed generator run.
 *
 * @param builtins The number of built-in functions.
 * @param builtinStanzas The number of built-in stanzas read.
 * @param overloads The number of overload instances.
 * @param overloadStanzas The number of overload stanzas.
 * @param functionTypes The number of distinct function type descriptors.
 */
public record GenerationSummary(int builtins, int builtinStanzas, int overloads, int overloadStanzas, int functionTypes) {}
