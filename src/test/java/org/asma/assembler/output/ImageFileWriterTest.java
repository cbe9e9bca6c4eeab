package org.asma.assembler.output;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class ImageFileWriterTest {

    @Test
    void writesWholeImage() {
        assertThat(new ImageFileWriter().write(TestResults.twoRegions())).singleElement().satisfies(file -> {
            assertThat(file.name()).isEqualTo("BOOT.bin");
            assertThat(file.content()).hasSize(22).endsWith((byte) 0xAB, (byte) 0xCD);
        });
    }
}
