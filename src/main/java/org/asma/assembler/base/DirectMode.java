package org.asma.assembler.base;

import org.asma.assembler.address.Address;

import java.util.Map;
import java.util.TreeMap;

/**
 * The registers that act as bases without a USING.
 * <p>
 * Register 0 always addresses the low 4K of storage. The Model 20 additionally lets
 * registers 1 through 7 address the following 4K blocks.
 */
public enum DirectMode {
    /** Register 0 addresses 0x0000-0x0FFF. */
    STANDARD(1),
    /** Registers 0 to 7 address 0x0000-0x7FFF in 4K steps. */
    EXTENDED(8);

    private final int registers;

    DirectMode(int registers) {
        this.registers = registers;
    }

    /**
     * @return The direct register assignments keyed by register number.
     */
    public Map<Integer, BaseAssignment> assignments() {
        Map<Integer, BaseAssignment> result = new TreeMap<>();
        for (int register = 0; register < registers; register++) {
            result.put(register, new BaseAssignment(register, Address.absolute(register * 0x1000L), true));
        }
        return result;
    }
}
