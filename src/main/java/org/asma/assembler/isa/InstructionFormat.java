package org.asma.assembler.isa;

import java.util.List;

import static org.asma.assembler.isa.OperandKind.IMMEDIATE;
import static org.asma.assembler.isa.OperandKind.INDEXED_STORAGE;
import static org.asma.assembler.isa.OperandKind.LONG_INDEXED_STORAGE;
import static org.asma.assembler.isa.OperandKind.REGISTER;
import static org.asma.assembler.isa.OperandKind.RELATIVE;
import static org.asma.assembler.isa.OperandKind.STORAGE;

/**
 * Machine instruction formats with their length and operand list.
 */
public enum InstructionFormat {
    RR(2, 0, REGISTER, REGISTER),
    RRE(4, 0, REGISTER, REGISTER),
    I(2, 8, IMMEDIATE),
    RX(4, 0, REGISTER, INDEXED_STORAGE),
    RS(4, 0, REGISTER, REGISTER, STORAGE),
    RS_SHIFT(4, 0, REGISTER, STORAGE),
    SI(4, 8, STORAGE, IMMEDIATE),
    SI_STORAGE(4, 0, STORAGE),
    S(4, 0, STORAGE),
    RI(4, 16, REGISTER, IMMEDIATE),
    RI_RELATIVE(4, 16, REGISTER, RELATIVE),
    RXY(6, 0, REGISTER, LONG_INDEXED_STORAGE);

    private final int length;
    private final int immediateBits;
    private final List<OperandKind> operands;

    InstructionFormat(int length, int immediateBits, OperandKind... operands) {
        this.length = length;
        this.immediateBits = immediateBits;
        this.operands = List.of(operands);
    }

    /**
     * @return The instruction length in bytes.
     */
    public int length() {
        return length;
    }

    /**
     * @return The width of the immediate or relative field, 0 if the format has none.
     */
    public int immediateBits() {
        return immediateBits;
    }

    public List<OperandKind> operands() {
        return operands;
    }

    /**
     * @return The width of the displacement field of storage operands.
     */
    public int displacementBits() {
        return this == RXY ? 20 : 12;
    }

    /**
     * @return The displacement width usable for implied addresses. The long displacement
     *         is signed, so only its non-negative half reaches forward from a base.
     */
    public int baseResolutionBits() {
        return this == RXY ? 19 : 12;
    }
}
