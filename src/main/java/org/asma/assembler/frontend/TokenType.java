package org.asma.assembler.frontend;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize in an operand.
 */
public enum TokenType {
    // Single-character tokens.
    LEFT_PAREN,
    RIGHT_PAREN,
    COMMA,
    PLUS,
    MINUS,
    /** Multiplication, or the location counter in operand position. */
    STAR,
    SLASH,

    // Terms.
    /** A symbol name. */
    IDENTIFIER,
    /** A decimal self-defining term. */
    NUMBER,
    /** A quoted self-defining term such as X'FF', C'A' or B'101'; the value is its integer value. */
    SELF_DEFINING,
    /** A symbol attribute reference such as L'NAME; the value is the attribute. */
    ATTRIBUTE,

    /** End of the operand. */
    END
}
