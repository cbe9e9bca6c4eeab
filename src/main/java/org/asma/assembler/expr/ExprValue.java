package org.asma.assembler.expr;

import org.asma.assembler.address.Address;

/**
 * The value of an evaluated expression: an absolute integer or an address.
 */
public sealed interface ExprValue permits ExprValue.IntValue, ExprValue.AddrValue {

    static IntValue of(long value) {
        return new IntValue(value);
    }

    static AddrValue of(Address address) {
        return new AddrValue(address);
    }

    /**
     * An absolute integer.
     */
    record IntValue(long value) implements ExprValue {
        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    /**
     * A location, relative or absolute.
     */
    record AddrValue(Address address) implements ExprValue {
        @Override
        public String toString() {
            return address.toString();
        }
    }
}
