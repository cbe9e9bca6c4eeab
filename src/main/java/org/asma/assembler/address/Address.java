package org.asma.assembler.address;

import org.asma.assembler.diagnostics.InternalInvariantError;

/**
 * A location in the image, either relative to a section or absolute.
 * <p>
 * Relative addresses become absolute exactly once, when their section's region is
 * bound. There is no way back from {@link Absolute} to {@link Relative}.
 * Every address carries an implied length used for the {@code L'} attribute.
 */
public sealed interface Address permits Address.Relative, Address.Absolute {

    /**
     * @return The implied length in bytes.
     */
    int length();

    /**
     * @return The offset within the section for relative addresses, the value for absolute ones.
     */
    long position();

    /**
     * Returns a copy of this address with another implied length.
     * @param length The new length.
     * @return The new address.
     */
    Address withLength(int length);

    /**
     * Adds an integer to this address.
     * @param amount The amount, may be negative.
     * @return The displaced address.
     * @throws AddressException if the result would be negative.
     */
    Address plus(long amount);

    /**
     * @return {@code true} for an address relative to a DSECT.
     */
    default boolean isDummy() {
        return false;
    }

    /**
     * @return {@code true} once the address has been bound.
     */
    default boolean isAbsolute() {
        return this instanceof Absolute;
    }

    default Address minus(long amount) {
        return plus(-amount);
    }

    /**
     * Adds another address. Only defined when one of the operands is a DSECT
     * displacement, which then acts as a plain integer.
     *
     * @param other The other address.
     * @return The sum.
     */
    default Address plus(Address other) {
        if (other.isDummy()) {
            return plus(other.position());
        }
        if (isDummy()) {
            return other.plus(position());
        }
        throw new AddressException("cannot add addresses " + this + " and " + other);
    }

    /**
     * Computes the distance between two addresses of the same domain.
     *
     * @param other The address to subtract.
     * @return {@code this - other} in bytes.
     * @throws AddressException if the addresses are in different domains.
     */
    default long distance(Address other) {
        if (this instanceof Absolute a && other instanceof Absolute b) {
            return a.value() - b.value();
        }
        if (this instanceof Relative a && other instanceof Relative b && a.section().equals(b.section())) {
            return a.offset() - b.offset();
        }
        throw new AddressException("cannot subtract " + other + " from " + this + ": different address domains");
    }

    /**
     * Checks whether both addresses belong to the same domain, so that they can be compared.
     * @param other The other address.
     * @return {@code true} if {@link #distance(Address)} is defined.
     */
    default boolean sameDomain(Address other) {
        if (this instanceof Absolute && other instanceof Absolute) {
            return true;
        }
        return this instanceof Relative a && other instanceof Relative b && a.section().equals(b.section());
    }

    static Absolute absolute(long value) {
        return new Absolute(value, 1);
    }

    static Relative relative(SectionHandle section, long offset) {
        return new Relative(section, offset, 1);
    }

    /**
     * An address relative to the start of a section.
     */
    record Relative(SectionHandle section, long offset, int length) implements Address {

        public Relative {
            if (offset < 0) {
                throw new AddressException("negative offset " + offset + " in section " + section.displayName());
            }
        }

        @Override
        public long position() {
            return offset;
        }

        @Override
        public Relative withLength(int newLength) {
            return new Relative(section, offset, newLength);
        }

        @Override
        public Relative plus(long amount) {
            long result = offset + amount;
            if (result < 0) {
                throw new AddressException("address arithmetic yields negative offset in section " + section.displayName());
            }
            return new Relative(section, result, length);
        }

        @Override
        public boolean isDummy() {
            return section.dummy();
        }

        /**
         * Converts this address into an absolute one.
         *
         * @param sectionStart The absolute start address of the section.
         * @return The absolute address.
         */
        public Absolute toAbsolute(long sectionStart) {
            if (section.dummy()) {
                throw new InternalInvariantError("DSECT address " + this + " cannot be made absolute");
            }
            return new Absolute(sectionStart + offset, length);
        }

        @Override
        public String toString() {
            return String.format("%s+%X", section.displayName(), offset);
        }
    }

    /**
     * A bound address in the target's storage.
     */
    record Absolute(long value, int length) implements Address {

        public Absolute {
            if (value < 0) {
                throw new AddressException("negative address " + value);
            }
        }

        @Override
        public long position() {
            return value;
        }

        @Override
        public Absolute withLength(int newLength) {
            return new Absolute(value, newLength);
        }

        @Override
        public Absolute plus(long amount) {
            long result = value + amount;
            if (result < 0) {
                throw new AddressException("address arithmetic yields negative address");
            }
            return new Absolute(result, length);
        }

        @Override
        public String toString() {
            return String.format("%06X", value);
        }
    }
}
