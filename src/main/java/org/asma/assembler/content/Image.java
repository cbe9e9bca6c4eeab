package org.asma.assembler.content;

import org.asma.assembler.address.Address;

/**
 * The final load image: the regions concatenated in declaration order.
 */
public final class Image extends Content<Region> {

    private final String name;

    Image(String name) {
        super(1, 0);
        this.name = name;
    }

    public String name() {
        return name;
    }

    @Override
    public Address currentAddress() {
        return Address.absolute(cursor());
    }

    /**
     * Computes the image displacement of every region, section and Binary.
     * Regions follow each other without gaps regardless of their storage addresses.
     */
    public void locateAll() {
        locate(0);
        long offset = 0;
        for (Region region : children()) {
            region.locate(offset);
            region.locateAll();
            offset += region.length();
        }
        moveCursor(offset);
    }
}
