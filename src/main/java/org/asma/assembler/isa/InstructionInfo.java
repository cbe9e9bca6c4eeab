package org.asma.assembler.isa;

import java.util.List;

/**
 * Metadata of one machine instruction.
 *
 * @param mnemonic    The operation mnemonic.
 * @param opcode      The operation code as written in the table, e.g. {@code 0x58} or {@code 0xE304}.
 * @param opcodeDigits Number of hexadecimal digits of the opcode (2, 3 or 4).
 * @param format      The instruction format.
 * @param since       The first architecture providing the instruction.
 */
public record InstructionInfo(String mnemonic, int opcode, int opcodeDigits, InstructionFormat format, Architecture since) {

    public int length() {
        return format.length();
    }

    public List<OperandKind> operandKinds() {
        return format.operands();
    }
}
