package org.asma.assembler.statement;

import org.asma.assembler.api.AssemblerErrorCode;
import org.asma.assembler.diagnostics.StatementException;

/**
 * Encodes channel command words and program status words.
 * <p>
 * Bits the architecture reserves are forced to zero, as is the extended control mode
 * bit 12 set where the format requires it.
 */
public final class ControlWordEncoder {

    private static final long ADDRESS_24 = 0xFFFFFFL;
    private static final long ADDRESS_31 = 0x7FFFFFFFL;

    private ControlWordEncoder() {}

    /**
     * Encodes a format 0 or format 1 CCW.
     *
     * @param format  0 or 1.
     * @param command The command code.
     * @param address The data address.
     * @param flags   The flag byte; its low-order bit is always cleared.
     * @param count   The byte count.
     * @return Eight bytes.
     * @throws StatementException if a field does not fit.
     */
    public static byte[] ccw(int format, long command, long address, long flags, long count) throws StatementException {
        check("CCW command code", command, 0xFF);
        check("CCW flags", flags, 0xFF);
        check("CCW count", count, 0xFFFF);
        byte[] out = new byte[StatementKind.Ccw.LENGTH];
        out[0] = (byte) command;
        if (format == 0) {
            check("CCW0 address", address, ADDRESS_24);
            put(out, 1, 3, address);
            out[4] = (byte) (flags & 0xFE);
            put(out, 6, 2, count);
        } else {
            check("CCW1 address", address, ADDRESS_31);
            out[1] = (byte) (flags & 0xFE);
            put(out, 2, 2, count);
            put(out, 4, 4, address);
        }
        return out;
    }

    /**
     * Encodes a PSW.
     *
     * @param format  The layout.
     * @param sys     The system mask byte.
     * @param key     The storage protection key.
     * @param mwp     The machine check, wait and problem state bits (AMWP for the System/360).
     * @param prog    The program mask byte.
     * @param address The instruction address.
     * @param amode   The addressing mode: 24, 31, 64 or their codes 0, 1 and 3.
     * @return {@link PswFormat#length()} bytes.
     * @throws StatementException if a field does not fit or the address exceeds the addressing mode.
     */
    public static byte[] psw(PswFormat format, long sys, long key, long mwp, long prog, long address, long amode)
            throws StatementException {
        check("PSW system mask", sys, 0xFF);
        check("PSW key", key, 0xF);
        check("PSW program mask", prog, 0xFF);
        byte[] out = new byte[format.length()];
        switch (format) {
            case PSWS:
                check("PSWS address", address, 0xFFFF);
                out[0] = (byte) (((prog & 0x3) << 4) | ((mwp & 0x1) << 1) | (sys & 0x1));
                put(out, 2, 2, address);
                break;
            case PSW360:
            case PSWBC:
                check(format + " AMWP bits", mwp, 0xF);
                check(format + " program mask", prog, 0x3F);
                check(format + " address", address, ADDRESS_24);
                out[0] = (byte) sys;
                out[1] = (byte) ((key << 4) | mwp);
                out[4] = (byte) prog;
                put(out, 5, 3, address);
                break;
            case PSWEC:
                check("PSWEC MWP bits", mwp, 0x7);
                check("PSWEC address", address, ADDRESS_24);
                out[0] = (byte) (sys & 0x47);
                out[1] = (byte) ((key << 4) | 0x08 | mwp);
                out[2] = (byte) (prog & 0xBF);
                put(out, 5, 3, address);
                break;
            case PSWZ: {
                check("PSWZ MWP bits", mwp, 0x7);
                int mode = trimodal(amode);
                checkMode(format, address, mode == 0 ? ADDRESS_24 : mode == 1 ? ADDRESS_31 : -1L);
                out[0] = (byte) sys;
                out[1] = (byte) ((key << 4) | mwp);
                out[2] = (byte) prog;
                out[3] = (byte) (mode >> 1);
                out[4] = (byte) ((mode & 0x1) << 7);
                put(out, 8, 8, address);
                break;
            }
            default: {
                check(format + " MWP bits", mwp, 0x7);
                int mode = bimodal(amode);
                checkMode(format, address, mode == 0 ? ADDRESS_24 : ADDRESS_31);
                int progMask = format == PswFormat.PSW380 || format == PswFormat.PSWXA ? 0xBF : 0xFF;
                out[0] = (byte) (sys & 0x47);
                out[1] = (byte) ((key << 4) | 0x08 | mwp);
                out[2] = (byte) (prog & progMask);
                put(out, 4, 4, address);
                out[4] |= (byte) (mode << 7);
                break;
            }
        }
        return out;
    }

    private static int bimodal(long amode) throws StatementException {
        if (amode == 0 || amode == 24) {
            return 0;
        }
        if (amode == 1 || amode == 31) {
            return 1;
        }
        throw new StatementException(AssemblerErrorCode.VALUE_OUT_OF_RANGE, "invalid addressing mode " + amode);
    }

    private static int trimodal(long amode) throws StatementException {
        if (amode == 3 || amode == 64) {
            return 3;
        }
        return bimodal(amode);
    }

    private static void checkMode(PswFormat format, long address, long limit) throws StatementException {
        if (address < 0 || (limit >= 0 && address > limit)) {
            throw new StatementException(AssemblerErrorCode.VALUE_OUT_OF_RANGE,
                    String.format("%s address %X exceeds the addressing mode", format, address));
        }
    }

    private static void check(String what, long value, long max) throws StatementException {
        if (value < 0 || value > max) {
            throw new StatementException(AssemblerErrorCode.VALUE_OUT_OF_RANGE,
                    String.format("%s %X out of range 0..%X", what, value, max));
        }
    }

    private static void put(byte[] out, int offset, int length, long value) {
        for (int i = 0; i < length; i++) {
            out[offset + length - 1 - i] = (byte) (value >>> (8 * i));
        }
    }
}
