package org.asma.assembler.output;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.asma.assembler.api.OutputFile;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class JsonSummaryWriterTest {

    @Test
    void describesLayoutWithHexAddresses() {
        // Act
        List<OutputFile> files = new JsonSummaryWriter().write(TestResults.twoRegions());

        // Assert
        assertThat(files).singleElement().extracting(OutputFile::name).isEqualTo("BOOT.json");
        JsonObject json = JsonParser.parseString(new String(files.get(0).content(), StandardCharsets.UTF_8)).getAsJsonObject();
        assertThat(json.get("image").getAsString()).isEqualTo("BOOT");
        assertThat(json.get("loadAddress").getAsString()).isEqualTo("0x1000");
        assertThat(json.get("entryAddress").getAsString()).isEqualTo("0x1004");
        assertThat(json.get("length").getAsInt()).isEqualTo(22);
        JsonObject high = json.getAsJsonArray("regions").get(1).getAsJsonObject();
        assertThat(high.get("name").getAsString()).isEqualTo("HIGH");
        assertThat(high.get("address").getAsString()).isEqualTo("0x8000");
        assertThat(high.get("imageOffset").getAsLong()).isEqualTo(20);
        assertThat(json.getAsJsonArray("sections")).hasSize(3);
        assertThat(json.getAsJsonArray("diagnostics").get(0).getAsString()).contains("UNDEFINED_SYMBOL");
    }
}
