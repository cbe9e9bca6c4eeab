package org.asma.assembler.address;

import java.util.Optional;

/**
 * The assembler's location counter, the value of {@code *} in expressions.
 * <p>
 * It is established from the start of each statement's content and advanced past it
 * once the statement has been processed.
 */
public final class LocationCounter {

    private Address location;
    private long displacement;

    /**
     * Overwrites the counter with a new starting point.
     * @param address The new location.
     */
    public void establish(Address address) {
        this.location = address;
        this.displacement = 0;
    }

    /**
     * Advances the counter past emitted content.
     * @param length The number of bytes.
     */
    public void increment(long length) {
        if (length < 0) {
            throw new IllegalArgumentException("negative increment " + length);
        }
        this.displacement += length;
    }

    /**
     * @return The current location, or empty before the first {@link #establish(Address)}.
     */
    public Optional<Address> current() {
        if (location == null) {
            return Optional.empty();
        }
        return Optional.of(location.plus(displacement));
    }

    public void clear() {
        this.location = null;
        this.displacement = 0;
    }
}
