package org.bifgen.frontend.types;

/**
 * A restricted constant operand of a prototype.
 *
 * @param operand The 1-based position of the argument in the argument list.
 * @param restriction The restriction attached to it.
 */
public record RestrictedOperand(int operand, Restriction restriction) {}
