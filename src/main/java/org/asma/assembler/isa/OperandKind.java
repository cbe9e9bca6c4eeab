package org.asma.assembler.isa;

/**
 * The syntactic and encoding class of an instruction operand.
 */
public enum OperandKind {
    /** A general register or a mask, 4 bits. */
    REGISTER,
    /** An immediate value whose width depends on the format. */
    IMMEDIATE,
    /** D(B) or an implied address, 12-bit displacement. */
    STORAGE,
    /** D(X,B) or an implied address with optional index, 12-bit displacement. */
    INDEXED_STORAGE,
    /** D(X,B) with a 20-bit displacement. */
    LONG_INDEXED_STORAGE,
    /** A branch target encoded as a signed halfword offset from the instruction. */
    RELATIVE
}
