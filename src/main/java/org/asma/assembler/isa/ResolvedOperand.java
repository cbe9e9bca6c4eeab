package org.asma.assembler.isa;

/**
 * An instruction operand reduced to the numbers that go into its fields.
 */
public sealed interface ResolvedOperand
        permits ResolvedOperand.RegisterField, ResolvedOperand.ImmediateField, ResolvedOperand.StorageField {

    /** A register number or mask. */
    record RegisterField(long register) implements ResolvedOperand {}

    /** An immediate value, or a relative offset already expressed in halfwords. */
    record ImmediateField(long value) implements ResolvedOperand {}

    /** Index, base and displacement of a storage operand. Index is 0 when absent. */
    record StorageField(long index, long base, long displacement) implements ResolvedOperand {}
}
