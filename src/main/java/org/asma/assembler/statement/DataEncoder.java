package org.asma.assembler.statement;

import org.asma.assembler.api.AssemblerErrorCode;
import org.asma.assembler.diagnostics.StatementException;
import org.asma.assembler.frontend.Lexer;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

/**
 * Computes lengths of DC/DS operands and the bytes of DC constants.
 * <p>
 * Character constants are padded on the right with EBCDIC blanks, hexadecimal and
 * binary constants on the left with zeros. Values longer than the length are
 * truncated on the same side as the padding.
 */
public final class DataEncoder {

    private static final byte EBCDIC_BLANK = 0x40;

    /** The longest operand the image can hold. */
    public static final long MAX_OPERAND_LENGTH = Integer.MAX_VALUE - 8;

    private DataEncoder() {}

    /**
     * Computes the length of one value of an operand.
     *
     * @param operand        The operand.
     * @param explicitLength The resolved length modifier, or a negative number if none was written.
     * @return The length in bytes.
     */
    public static long elementLength(DataOperand operand, long explicitLength) {
        if (explicitLength >= 0) {
            return explicitLength;
        }
        DataType type = operand.type();
        if (type.defaultLength() > 0) {
            return type.defaultLength();
        }
        if (operand.values().isEmpty()) {
            return 1;
        }
        long longest = 0;
        for (String value : operand.values()) {
            long length;
            switch (type.nominal()) {
                case STRING:
                    length = value.getBytes(Lexer.EBCDIC).length;
                    break;
                case HEX:
                    length = (value.length() + 1) / 2;
                    break;
                case BINARY:
                    length = (value.length() + 7) / 8;
                    break;
                default:
                    length = type.defaultLength();
                    break;
            }
            longest = Math.max(longest, length);
        }
        return Math.max(1, longest);
    }

    /**
     * Computes the total length of an operand.
     *
     * @param operand       The operand.
     * @param duplication   The resolved duplication factor.
     * @param elementLength The length of one value.
     * @return The length in bytes.
     * @throws StatementException if the length exceeds {@link #MAX_OPERAND_LENGTH}.
     */
    public static long totalLength(DataOperand operand, long duplication, long elementLength) throws StatementException {
        long total;
        try {
            total = Math.multiplyExact(Math.multiplyExact(duplication, elementLength), (long) operand.valueCount());
        } catch (ArithmeticException e) {
            throw new StatementException(AssemblerErrorCode.VALUE_OUT_OF_RANGE,
                    "operand length " + duplication + " x " + elementLength + " overflows", e);
        }
        if (total > MAX_OPERAND_LENGTH) {
            throw new StatementException(AssemblerErrorCode.VALUE_OUT_OF_RANGE,
                    "operand length " + total + " exceeds the maximum of " + MAX_OPERAND_LENGTH);
        }
        return total;
    }

    /**
     * Encodes a DC operand.
     *
     * @param operand       The operand.
     * @param duplication   The resolved duplication factor.
     * @param elementLength The length of one value.
     * @param addressValues The resolved nominal expressions of address constants, in order.
     * @return The bytes, {@link #totalLength} long.
     * @throws StatementException if a value does not fit its length.
     */
    public static byte[] encode(DataOperand operand, long duplication, long elementLength, List<Long> addressValues)
            throws StatementException {
        int total = (int) totalLength(operand, duplication, elementLength);
        int length = (int) elementLength;
        byte[] one = new byte[length * operand.valueCount()];
        int offset = 0;
        DataType type = operand.type();
        if (type.nominal() == DataType.Nominal.EXPRESSION) {
            for (long value : addressValues) {
                putInteger(one, offset, length, BigInteger.valueOf(value), type);
                offset += length;
            }
        } else {
            for (String value : operand.values()) {
                putValue(one, offset, length, value, type);
                offset += length;
            }
        }
        byte[] out = new byte[total];
        for (int i = 0; i < duplication; i++) {
            System.arraycopy(one, 0, out, i * one.length, one.length);
        }
        return out;
    }

    private static void putValue(byte[] out, int offset, int length, String value, DataType type) throws StatementException {
        switch (type.nominal()) {
            case STRING: {
                byte[] chars = value.getBytes(Lexer.EBCDIC);
                Arrays.fill(out, offset, offset + length, EBCDIC_BLANK);
                System.arraycopy(chars, 0, out, offset, Math.min(length, chars.length));
                break;
            }
            case HEX:
                putRightAligned(out, offset, length, new BigInteger(value, 16));
                break;
            case BINARY:
                putRightAligned(out, offset, length, new BigInteger(value, 2));
                break;
            case NUMBER:
                putInteger(out, offset, length, new BigInteger(value), type);
                break;
            default:
                throw new IllegalStateException("Unexpected nominal " + type.nominal());
        }
    }

    /**
     * Writes the low-order bytes of an unsigned value, truncating on the left.
     */
    private static void putRightAligned(byte[] out, int offset, int length, BigInteger value) {
        for (int i = 0; i < length; i++) {
            out[offset + length - 1 - i] = value.shiftRight(8 * i).byteValue();
        }
    }

    /**
     * Writes a two's complement integer and checks that it fits.
     */
    private static void putInteger(byte[] out, int offset, int length, BigInteger value, DataType type)
            throws StatementException {
        BigInteger limit = BigInteger.ONE.shiftLeft(8 * length);
        BigInteger min = limit.shiftRight(1).negate();
        if (value.compareTo(min) < 0 || value.compareTo(limit) >= 0) {
            throw new StatementException(AssemblerErrorCode.VALUE_OUT_OF_RANGE,
                    "value " + value + " does not fit a " + length + "-byte " + type + " constant");
        }
        putRightAligned(out, offset, length, value);
    }
}
