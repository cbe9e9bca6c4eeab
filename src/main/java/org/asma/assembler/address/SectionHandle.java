package org.asma.assembler.address;

/**
 * Lightweight reference to a section owned by the content arena.
 * <p>
 * Addresses and symbol entries refer to sections through this handle so that no
 * object graph cycle exists between symbols and containers.
 *
 * @param id    Index of the section in the arena.
 * @param name  The section name, empty for the unnamed section.
 * @param dummy {@code true} for a DSECT.
 */
public record SectionHandle(int id, String name, boolean dummy) {

    public String displayName() {
        return name.isEmpty() ? "(unnamed)" : name;
    }
}
