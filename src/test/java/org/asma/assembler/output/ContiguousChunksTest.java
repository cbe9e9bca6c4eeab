package org.asma.assembler.output;

import org.asma.assembler.api.LoadedBytes;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class ContiguousChunksTest {

    @Test
    void mergesOnlyAdjacentPieces() {
        List<LoadedBytes> areas = ContiguousChunks.merge(List.of(
                new LoadedBytes(0x100, new byte[]{1, 2}),
                new LoadedBytes(0x102, new byte[]{3}),
                new LoadedBytes(0x104, new byte[]{4})));

        assertThat(areas).hasSize(2);
        assertThat(areas.get(0).address()).isEqualTo(0x100);
        assertThat(areas.get(0).data()).containsExactly(1, 2, 3);
        assertThat(areas.get(1).address()).isEqualTo(0x104);
        assertThat(areas.get(1).data()).containsExactly(4);
    }

    @Test
    void splitsAreasIntoBoundedChunks() {
        byte[] data = new byte[5];
        List<LoadedBytes> chunks = ContiguousChunks.split(List.of(new LoadedBytes(0x10, data)), 2);

        assertThat(chunks).extracting(LoadedBytes::address).containsExactly(0x10L, 0x12L, 0x14L);
        assertThat(chunks.get(2).data()).hasSize(1);
    }

    @Test
    void skipsEmptyPieces() {
        List<LoadedBytes> areas = ContiguousChunks.merge(List.of(
                new LoadedBytes(0x100, new byte[0]),
                new LoadedBytes(0x200, new byte[]{7})));

        assertThat(areas).singleElement().extracting(LoadedBytes::address).isEqualTo(0x200L);
    }

    @Test
    void rejectsNonPositiveChunkSize() {
        assertThatThrownBy(() -> ContiguousChunks.split(List.of(), 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void formatsUppercaseHex() {
        assertThat(ContiguousChunks.hex(new byte[]{0x0A, (byte) 0xFF, 0})).isEqualTo("0AFF00");
    }
}
