package org.asma.assembler.isa;

import org.asma.assembler.base.DirectMode;

/**
 * Target architectures in order of capability. An instruction available on one
 * architecture is available on every later one, except that the Model 20 subset
 * comes first.
 */
public enum Architecture {
    S360_20(16, DirectMode.EXTENDED),
    S360(24, DirectMode.STANDARD),
    S370(24, DirectMode.STANDARD),
    ESA390(31, DirectMode.STANDARD),
    ZARCH(64, DirectMode.STANDARD);

    private final int addressBits;
    private final DirectMode directMode;

    Architecture(int addressBits, DirectMode directMode) {
        this.addressBits = addressBits;
        this.directMode = directMode;
    }

    /**
     * @return The width of the largest address the architecture can reach.
     */
    public int addressBits() {
        return addressBits;
    }

    public DirectMode directMode() {
        return directMode;
    }

    public boolean includes(Architecture other) {
        return other.ordinal() <= ordinal();
    }
}
