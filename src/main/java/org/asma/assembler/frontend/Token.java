package org.asma.assembler.frontend;

/**
 * Represents a single token of an operand.
 *
 * @param type   The type of the token.
 * @param text   The exact text of the token; for attributes, the symbol name.
 * @param value  The processed value of the token (number value, attribute), or {@code null}.
 * @param column The 0-based column within the operand.
 */
public record Token(TokenType type, String text, Object value, int column) {
}
