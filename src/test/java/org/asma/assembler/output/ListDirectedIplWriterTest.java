package org.asma.assembler.output;

import org.asma.assembler.api.OutputFile;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class ListDirectedIplWriterTest {

    @Test
    void writesOneFilePerRegionAndControlFile() {
        // Arrange
        ListDirectedIplWriter writer = new ListDirectedIplWriter("ipl");

        // Act
        List<OutputFile> files = writer.write(TestResults.twoRegions());

        // Assert
        assertThat(files).extracting(OutputFile::name).containsExactly("ipl/LOW.bin", "ipl/HIGH.bin", "ipl/IMAGE.ipl");
        assertThat(files.get(0).content()).hasSize(20);
        assertThat(files.get(1).content()).containsExactly(0xAB, 0xCD);
        assertThat(new String(files.get(2).content(), StandardCharsets.US_ASCII))
                .isEqualTo("LOW.bin 0x1000\nHIGH.bin 0x8000\n");
    }

    @Test
    void writesWithoutDirectoryByDefault() {
        List<OutputFile> files = new ListDirectedIplWriter().write(TestResults.twoRegions());

        assertThat(files).extracting(OutputFile::name).contains(ListDirectedIplWriter.CONTROL_FILE);
    }
}
