package org.asma.assembler.base;

import org.asma.assembler.address.Address;

/**
 * An active base register: the register is assumed to contain the anchor address.
 *
 * @param register The register number, 0-15.
 * @param anchor   The address the register holds, absolute or relative to a DSECT.
 * @param direct   {@code true} for an implicit direct-mode assignment.
 */
public record BaseAssignment(int register, Address anchor, boolean direct) {

    @Override
    public String toString() {
        return String.format("R%d=%s%s", register, anchor, direct ? " (direct)" : "");
    }
}
