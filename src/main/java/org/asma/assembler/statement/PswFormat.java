package org.asma.assembler.statement;

import org.asma.assembler.isa.Architecture;

import java.util.Optional;

/**
 * Program status word layouts, one per directive.
 */
public enum PswFormat {
    /** System/360 Model 20, 32 bits. */
    PSWS(4, 1),
    /** System/360. */
    PSW360(8, 8),
    /** System/370 basic control mode, laid out like the System/360 PSW. */
    PSWBC(8, 8),
    /** System/370 extended control mode. */
    PSWEC(8, 8),
    /** Hercules S/380. */
    PSW380(8, 8),
    /** System/370 extended architecture. */
    PSWXA(8, 8),
    /** ESA/370. */
    PSWE370(8, 8),
    /** ESA/390. */
    PSWE390(8, 8),
    /** z/Architecture, 128 bits. */
    PSWZ(16, 8);

    private final int length;
    private final int alignment;

    PswFormat(int length, int alignment) {
        this.length = length;
        this.alignment = alignment;
    }

    public int length() {
        return length;
    }

    public int alignment() {
        return alignment;
    }

    /**
     * @return {@code true} for the formats carrying a 31-bit address and an addressing mode bit.
     */
    public boolean isBimodal() {
        return this == PSW380 || this == PSWXA || this == PSWE370 || this == PSWE390;
    }

    /**
     * @param operation The operation, upper case.
     * @return The format named by the operation.
     */
    public static Optional<PswFormat> fromOperation(String operation) {
        for (PswFormat format : values()) {
            if (format.name().equals(operation)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    /**
     * Selects the layout of the generic {@code PSW} directive.
     * @param architecture The target architecture.
     * @return The format the architecture's CPUs load.
     */
    public static PswFormat forArchitecture(Architecture architecture) {
        switch (architecture) {
            case S360_20:
                return PSWS;
            case S360:
                return PSW360;
            case S370:
                return PSWEC;
            case ESA390:
                return PSWE390;
            default:
                return PSWZ;
        }
    }
}
