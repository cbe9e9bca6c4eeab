package org.asma.assembler.content;

import org.asma.assembler.address.Address;

/**
 * A contiguous range of absolute storage holding one or more CSECTs.
 * <p>
 * Sections are laid out in declaration order from the region's start address, each on
 * a doubleword boundary.
 */
public final class Region extends Content<Section> {

    /** Regions hold sections aligned to doublewords. */
    public static final int REGION_ALIGNMENT = 8;

    private final String name;
    private final long start;
    private boolean bound;

    Region(String name, long start) {
        super(REGION_ALIGNMENT, start);
        this.name = name;
        this.start = start;
        assign(Address.absolute(start));
    }

    public String name() {
        return name;
    }

    public String displayName() {
        return name.isEmpty() ? "(unnamed)" : name;
    }

    public long start() {
        return start;
    }

    /**
     * @return The first address after the region's content.
     */
    public long end() {
        return start + length();
    }

    @Override
    public Address currentAddress() {
        return Address.absolute(cursor());
    }

    /**
     * Places every section and converts all section content to absolute addresses.
     * Called once per region.
     */
    public void bindAll() {
        if (bound) {
            return;
        }
        assignAll();
        for (Section section : children()) {
            section.bindAll();
        }
        bound = true;
        freeze();
    }

    public boolean isBound() {
        return bound;
    }

    void locateAll() {
        for (Section section : children()) {
            section.locate(imageOffset() + section.location().position() - start);
            section.locateAll();
        }
    }

    @Override
    protected boolean contributes(Section section) {
        return !section.isFailed();
    }

    @Override
    public String toString() {
        return String.format("REGION %s at %X", displayName(), start);
    }
}
