package org.asma.assembler.api;

/**
 * Placement of a control section.
 *
 * @param name        The section name, empty for the unnamed section.
 * @param region      The name of the region holding the section.
 * @param address     The absolute start address.
 * @param length      The length in bytes.
 * @param imageOffset The displacement of the section in the image.
 * @param failed      {@code true} if the section could not be laid out and was left out of the image.
 */
public record SectionLayout(String name, String region, long address, long length, long imageOffset, boolean failed) {
}
