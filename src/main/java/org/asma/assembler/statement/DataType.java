package org.asma.assembler.statement;

import java.util.Optional;

/**
 * Constant types accepted by DC and DS.
 */
public enum DataType {
    /** Character, EBCDIC. */
    C(0, 1, Nominal.STRING),
    /** Hexadecimal. */
    X(0, 1, Nominal.HEX),
    /** Binary digits. */
    B(0, 1, Nominal.BINARY),
    /** Fullword integer. */
    F(4, 4, Nominal.NUMBER),
    /** Halfword integer. */
    H(2, 2, Nominal.NUMBER),
    /** Doubleword integer. */
    FD(8, 8, Nominal.NUMBER),
    /** Fullword address. */
    A(4, 4, Nominal.EXPRESSION),
    /** Doubleword address. */
    AD(8, 8, Nominal.EXPRESSION),
    /** Halfword address. */
    Y(2, 2, Nominal.EXPRESSION),
    /** Base register and displacement halfword. */
    S(2, 2, Nominal.EXPRESSION);

    /** How the nominal value is written. */
    public enum Nominal { STRING, HEX, BINARY, NUMBER, EXPRESSION }

    private final int defaultLength;
    private final int alignment;
    private final Nominal nominal;

    DataType(int defaultLength, int alignment, Nominal nominal) {
        this.defaultLength = defaultLength;
        this.alignment = alignment;
        this.nominal = nominal;
    }

    /**
     * @return The implied length of one value, 0 if it follows from the nominal value.
     */
    public int defaultLength() {
        return defaultLength;
    }

    public int alignment() {
        return alignment;
    }

    public Nominal nominal() {
        return nominal;
    }

    /**
     * Parses a type code such as {@code F}, {@code FD} or {@code AD}.
     * @param code The code, upper case.
     * @return The type.
     */
    public static Optional<DataType> fromCode(String code) {
        for (DataType type : values()) {
            if (type.name().equals(code)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
