package org.asma.assembler.api;

import java.util.List;

/**
 * Placement of a region in storage and in the image.
 *
 * @param name        The region name, empty for the unnamed region.
 * @param address     The absolute start address.
 * @param length      The length in bytes.
 * @param imageOffset The displacement of the region's bytes in the image.
 * @param sections    The names of the CSECTs in the region, in order.
 */
public record RegionLayout(String name, long address, long length, long imageOffset, List<String> sections) {

    public String displayName() {
        return name.isEmpty() ? "REGION" : name;
    }
}
