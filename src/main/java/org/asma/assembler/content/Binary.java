package org.asma.assembler.content;

import org.asma.assembler.address.Address;
import org.asma.assembler.diagnostics.InternalInvariantError;

import java.util.Arrays;
import java.util.Optional;

/**
 * The smallest unit of image content: a run of bytes with an alignment and a length.
 * <p>
 * A Binary is positioned by its owning container during allocation, receives an
 * absolute address when its region is bound, and is filled with bytes during object
 * generation. Binaries that are never built (storage reservations, errored statements)
 * contribute zero bytes to the image.
 */
public class Binary {

    /** Marker for a length that is not known yet. */
    public static final long UNKNOWN_LENGTH = -1;

    private final int alignment;
    private long length;
    private byte[] bytes;
    private Address location;
    private Content<?> container;
    private long imageOffset = -1;

    /**
     * @param alignment The required alignment in bytes (1 for none).
     * @param length    The length in bytes, or {@link #UNKNOWN_LENGTH}.
     */
    public Binary(int alignment, long length) {
        if (alignment < 1 || Integer.bitCount(alignment) != 1) {
            throw new IllegalArgumentException("alignment must be a power of two: " + alignment);
        }
        this.alignment = alignment;
        this.length = length;
    }

    public int alignment() {
        return alignment;
    }

    public long length() {
        return length;
    }

    public boolean hasKnownLength() {
        return length() != UNKNOWN_LENGTH;
    }

    /**
     * Sets the length of a Binary whose length depended on a deferred expression.
     * @param newLength The length in bytes.
     */
    public void setLength(long newLength) {
        if (location != null) {
            throw new InternalInvariantError("cannot change the length of a positioned Binary");
        }
        if (newLength < 0) {
            throw new IllegalArgumentException("negative length " + newLength);
        }
        this.length = newLength;
    }

    /**
     * @return The assigned location, or {@code null} before allocation.
     */
    public Address location() {
        return location;
    }

    public boolean isAssigned() {
        return location != null;
    }

    void assign(Address address) {
        if (location != null) {
            throw new InternalInvariantError("Binary already positioned at " + location);
        }
        this.location = address;
    }

    /**
     * Converts the relative location into an absolute one.
     * @param sectionStart The absolute start address of the owning section.
     */
    void bind(long sectionStart) {
        if (!(location instanceof Address.Relative relative)) {
            throw new InternalInvariantError("Binary at " + location + " cannot be bound");
        }
        this.location = relative.toAbsolute(sectionStart);
    }

    /**
     * Fills the Binary with its final bytes.
     *
     * @param data The bytes; the array length must equal {@link #length()}.
     */
    public void build(byte[] data) {
        if (location == null) {
            throw new InternalInvariantError("Binary built before its address was assigned");
        }
        if (data.length != length()) {
            throw new InternalInvariantError("Binary of length " + length() + " built with " + data.length + " bytes");
        }
        this.bytes = data;
    }

    public boolean isBuilt() {
        return bytes != null;
    }

    /**
     * @return A copy of the built bytes, or empty if the Binary was never built.
     */
    public Optional<byte[]> bytes() {
        return bytes == null ? Optional.empty() : Optional.of(Arrays.copyOf(bytes, bytes.length));
    }

    byte[] rawBytes() {
        return bytes;
    }

    void setRawBytes(byte[] data) {
        this.bytes = data;
    }

    /**
     * @return The displacement of this Binary from the start of the image.
     */
    public long imageOffset() {
        if (imageOffset < 0) {
            throw new InternalInvariantError("image displacement read before the image was located");
        }
        return imageOffset;
    }

    public boolean isLocated() {
        return imageOffset >= 0;
    }

    void locate(long offset) {
        this.imageOffset = offset;
    }

    public Content<?> container() {
        return container;
    }

    void attach(Content<?> owner) {
        if (container != null) {
            throw new InternalInvariantError("Binary is already owned by another container");
        }
        this.container = owner;
    }
}
