package org.asma.assembler.isa;

import org.asma.assembler.api.AssemblerErrorCode;
import org.asma.assembler.diagnostics.StatementException;

import java.util.List;

/**
 * Packs resolved operands into the big-endian byte layout of an instruction format.
 */
public final class InstructionEncoder {

    private InstructionEncoder() {}

    /**
     * Encodes one instruction.
     *
     * @param info     The instruction.
     * @param operands The operands in source order, matching {@link InstructionInfo#operandKinds()}.
     * @return The instruction bytes.
     * @throws StatementException if a field value does not fit.
     */
    public static byte[] encode(InstructionInfo info, List<ResolvedOperand> operands) throws StatementException {
        InstructionFormat format = info.format();
        if (operands.size() != format.operands().size()) {
            throw new StatementException(AssemblerErrorCode.INVALID_OPERAND_COUNT,
                    info.mnemonic() + " expects " + format.operands().size() + " operands, got " + operands.size());
        }
        byte[] out = new byte[format.length()];
        int opcode = info.opcode();
        switch (format) {
            case RR:
                put(out, 0, 8, opcode);
                put(out, 8, 4, register(operands.get(0)));
                put(out, 12, 4, register(operands.get(1)));
                break;
            case RRE:
                put(out, 0, 16, opcode);
                put(out, 24, 4, register(operands.get(0)));
                put(out, 28, 4, register(operands.get(1)));
                break;
            case I:
                put(out, 0, 8, opcode);
                put(out, 8, 8, unsignedImmediate(operands.get(0), 8));
                break;
            case RX:
                put(out, 0, 8, opcode);
                put(out, 8, 4, register(operands.get(0)));
                putStorage(out, 12, storage(operands.get(1)), true);
                break;
            case RS:
                put(out, 0, 8, opcode);
                put(out, 8, 4, register(operands.get(0)));
                put(out, 12, 4, register(operands.get(1)));
                putStorage(out, 16, storage(operands.get(2)), false);
                break;
            case RS_SHIFT:
                put(out, 0, 8, opcode);
                put(out, 8, 4, register(operands.get(0)));
                putStorage(out, 16, storage(operands.get(1)), false);
                break;
            case SI:
                put(out, 0, 8, opcode);
                put(out, 8, 8, unsignedImmediate(operands.get(1), 8));
                putStorage(out, 16, storage(operands.get(0)), false);
                break;
            case SI_STORAGE:
                put(out, 0, 8, opcode);
                putStorage(out, 16, storage(operands.get(0)), false);
                break;
            case S:
                put(out, 0, 16, opcode);
                putStorage(out, 16, storage(operands.get(0)), false);
                break;
            case RI:
            case RI_RELATIVE:
                put(out, 0, 8, opcode >> 4);
                put(out, 8, 4, register(operands.get(0)));
                put(out, 12, 4, opcode & 0xF);
                put(out, 16, 16, signedImmediate(operands.get(1), 16, format == InstructionFormat.RI));
                break;
            case RXY:
                put(out, 0, 8, opcode >> 8);
                put(out, 8, 4, register(operands.get(0)));
                putLongStorage(out, storage(operands.get(1)));
                put(out, 40, 8, opcode & 0xFF);
                break;
            default:
                throw new IllegalStateException("Unsupported format " + format);
        }
        return out;
    }

    private static long register(ResolvedOperand operand) throws StatementException {
        if (!(operand instanceof ResolvedOperand.RegisterField field)) {
            throw new IllegalArgumentException("register operand expected, got " + operand);
        }
        return checkRange(field.register(), 0, 15, "register");
    }

    private static ResolvedOperand.StorageField storage(ResolvedOperand operand) {
        if (!(operand instanceof ResolvedOperand.StorageField field)) {
            throw new IllegalArgumentException("storage operand expected, got " + operand);
        }
        return field;
    }

    private static long unsignedImmediate(ResolvedOperand operand, int bits) throws StatementException {
        long value = immediate(operand);
        long max = (1L << bits) - 1;
        // negative values are accepted as their two's complement
        checkRange(value, -(1L << (bits - 1)), max, "immediate value");
        return value & max;
    }

    private static long signedImmediate(ResolvedOperand operand, int bits, boolean allowUnsigned) throws StatementException {
        long value = immediate(operand);
        long min = -(1L << (bits - 1));
        long max = allowUnsigned ? (1L << bits) - 1 : (1L << (bits - 1)) - 1;
        checkRange(value, min, max, allowUnsigned ? "immediate value" : "relative offset");
        return value & ((1L << bits) - 1);
    }

    private static long immediate(ResolvedOperand operand) {
        if (!(operand instanceof ResolvedOperand.ImmediateField field)) {
            throw new IllegalArgumentException("immediate operand expected, got " + operand);
        }
        return field.value();
    }

    private static void putStorage(byte[] out, int bitOffset, ResolvedOperand.StorageField field, boolean indexed)
            throws StatementException {
        if (indexed) {
            put(out, bitOffset, 4, checkRange(field.index(), 0, 15, "index register"));
            bitOffset += 4;
        } else if (field.index() != 0) {
            throw new StatementException(AssemblerErrorCode.SYNTAX_ERROR, "operand does not take an index register");
        }
        put(out, bitOffset, 4, checkRange(field.base(), 0, 15, "base register"));
        put(out, bitOffset + 4, 12, checkRange(field.displacement(), 0, 4095, "displacement"));
    }

    private static void putLongStorage(byte[] out, ResolvedOperand.StorageField field) throws StatementException {
        put(out, 12, 4, checkRange(field.index(), 0, 15, "index register"));
        put(out, 16, 4, checkRange(field.base(), 0, 15, "base register"));
        long displacement = checkRange(field.displacement(), -(1L << 19), (1L << 19) - 1, "long displacement");
        put(out, 20, 12, displacement & 0xFFF);
        put(out, 32, 8, (displacement >> 12) & 0xFF);
    }

    private static long checkRange(long value, long min, long max, String what) throws StatementException {
        if (value < min || value > max) {
            throw new StatementException(AssemblerErrorCode.VALUE_OUT_OF_RANGE,
                    String.format("%s %d out of range %d..%d", what, value, min, max));
        }
        return value;
    }

    /**
     * Writes the low {@code width} bits of a value big-endian at a bit offset.
     */
    private static void put(byte[] out, int bitOffset, int width, long value) {
        for (int i = 0; i < width; i++) {
            long bit = (value >> (width - 1 - i)) & 1;
            if (bit != 0) {
                int position = bitOffset + i;
                out[position / 8] |= (byte) (0x80 >>> (position % 8));
            }
        }
    }
}
