package org.asma.assembler.content;

import org.asma.assembler.address.Address;
import org.asma.assembler.address.SectionHandle;
import org.asma.assembler.diagnostics.InternalInvariantError;

/**
 * A control section (CSECT) or dummy section (DSECT).
 * <p>
 * Content is positioned relative to the section start. A CSECT is later placed in its
 * region and bound to absolute addresses; a DSECT stays relative for its whole life and
 * only serves as a storage map for base/displacement resolution.
 */
public final class Section extends Content<Binary> {

    /** Sections are placed on doubleword boundaries within their region. */
    public static final int SECTION_ALIGNMENT = 8;

    private final SectionHandle handle;
    private final Region region;
    private String failure;

    Section(SectionHandle handle, Region region) {
        super(SECTION_ALIGNMENT, 0);
        this.handle = handle;
        this.region = region;
    }

    public SectionHandle handle() {
        return handle;
    }

    public String name() {
        return handle.name();
    }

    public boolean isDummy() {
        return handle.dummy();
    }

    /**
     * @return The region holding this CSECT, or {@code null} for a DSECT.
     */
    public Region region() {
        return region;
    }

    @Override
    public Address currentAddress() {
        return Address.relative(handle, cursor());
    }

    /**
     * Positions the next Binary of this section.
     *
     * @param binary A Binary previously appended to this section.
     * @throws ContainerAllocationException if the section already failed, the Binary's length is unknown
     *                                      or the section would grow beyond {@link #MAX_LENGTH}.
     */
    public void allocate(Binary binary) throws ContainerAllocationException {
        if (failure != null) {
            throw new ContainerAllocationException("section " + handle.displayName() + " is unusable: " + failure);
        }
        if (!binary.hasKnownLength()) {
            throw new ContainerAllocationException("length of content in section " + handle.displayName() + " is not known");
        }
        if (lengthWith(binary) > MAX_LENGTH) {
            throw new ContainerAllocationException("section " + handle.displayName() + " would exceed "
                    + MAX_LENGTH + " bytes");
        }
        assign(binary);
    }

    /**
     * Resets the location counter of this section (ORG).
     *
     * @param target The new location, an address relative to this section.
     * @throws ContainerAllocationException if the target lies in another section or is absolute.
     */
    public void org(Address target) throws ContainerAllocationException {
        if (!(target instanceof Address.Relative relative) || !relative.section().equals(handle)) {
            throw new ContainerAllocationException("ORG target " + target + " is not within section " + handle.displayName());
        }
        if (relative.offset() > MAX_LENGTH) {
            throw new ContainerAllocationException("ORG target " + target + " is outside the range of section "
                    + handle.displayName());
        }
        moveCursor(relative.offset());
    }

    /**
     * Marks the section as unusable. Its content is excluded from the image.
     * @param reason The reason.
     */
    public void fail(String reason) {
        if (failure == null) {
            failure = reason;
        }
    }

    public boolean isFailed() {
        return failure != null;
    }

    public String failure() {
        return failure;
    }

    /**
     * Converts the location of every Binary into an absolute address.
     */
    void bindAll() {
        if (!(location() instanceof Address.Absolute start)) {
            throw new InternalInvariantError("section " + handle.displayName() + " bound before it was placed");
        }
        for (Binary child : children()) {
            if (child.isAssigned()) {
                child.bind(start.value());
            }
        }
    }

    void locateAll() {
        long sectionStart = location().position();
        for (Binary child : children()) {
            if (child.isAssigned()) {
                child.locate(imageOffset() + child.location().position() - sectionStart);
            }
        }
    }

    @Override
    protected boolean contributes(Binary child) {
        return child.isAssigned();
    }

    @Override
    public String toString() {
        return (isDummy() ? "DSECT " : "CSECT ") + handle.displayName();
    }
}
