package org.bifgen.model;

/**
 * The header of one overload stanza: all instances of one overloaded name.
 *
 * @param groupId The unique overload group id, enumerated in the declarations.
 * @param externName The ABI-visible name, aliased by the macro file.
 * @param internName The back-end name the external name expands to.
 */
public record OverloadStanza(String groupId, String externName, String internName) {}
