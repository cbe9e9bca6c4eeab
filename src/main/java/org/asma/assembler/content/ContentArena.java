package org.asma.assembler.content;

import org.asma.assembler.address.SectionHandle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Owns every region and section of one assembly run.
 * <p>
 * Sections are addressed by the index in their {@link SectionHandle}; symbol entries and
 * addresses only hold handles.
 */
public final class ContentArena {

    private final Image image;
    private final List<Section> sections = new ArrayList<>();

    public ContentArena(String imageName) {
        this.image = new Image(imageName);
    }

    public Image image() {
        return image;
    }

    /**
     * Creates a region and appends it to the image.
     *
     * @param name  The region name, empty for the unnamed region.
     * @param start The absolute start address.
     * @return The region.
     */
    public Region newRegion(String name, long start) {
        Region region = new Region(name, start);
        image.append(region);
        return region;
    }

    /**
     * Creates a CSECT at the end of a region.
     *
     * @param name   The section name, empty for the unnamed section.
     * @param region The region.
     * @return The section.
     */
    public Section newControlSection(String name, Region region) {
        Section section = new Section(new SectionHandle(sections.size(), name, false), region);
        sections.add(section);
        region.append(section);
        return section;
    }

    /**
     * Creates a DSECT. Dummy sections belong to no region.
     *
     * @param name The section name.
     * @return The section.
     */
    public Section newDummySection(String name) {
        Section section = new Section(new SectionHandle(sections.size(), name, true), null);
        sections.add(section);
        return section;
    }

    public Section section(SectionHandle handle) {
        return sections.get(handle.id());
    }

    public List<Section> sections() {
        return Collections.unmodifiableList(sections);
    }

    public List<Region> regions() {
        return image.children();
    }
}
