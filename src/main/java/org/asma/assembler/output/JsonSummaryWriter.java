package org.asma.assembler.output;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.asma.assembler.api.AssemblyResult;
import org.asma.assembler.api.OutputFile;
import org.asma.assembler.api.RegionLayout;
import org.asma.assembler.api.SectionLayout;
import org.asma.assembler.diagnostics.Diagnostic;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes a JSON description of the image layout to {@code <image>.json}.
 * Addresses are written as hexadecimal strings.
 */
public class JsonSummaryWriter implements IOutputWriter {

    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    @Override
    public List<OutputFile> write(AssemblyResult result) {
        String json = gson.toJson(summarize(result));
        return List.of(new OutputFile(result.imageName() + ".json", json.getBytes(StandardCharsets.UTF_8)));
    }

    ImageSummary summarize(AssemblyResult result) {
        List<RegionSummary> regions = new ArrayList<>();
        for (RegionLayout region : result.regions()) {
            regions.add(new RegionSummary(region.displayName(), hex(region.address()), region.length(),
                    region.imageOffset(), region.sections()));
        }
        List<SectionSummary> sections = new ArrayList<>();
        for (SectionLayout section : result.sections()) {
            sections.add(new SectionSummary(section.name(), section.region(), hex(section.address()),
                    section.length(), section.imageOffset(), section.failed()));
        }
        List<String> diagnostics = new ArrayList<>();
        for (Diagnostic diagnostic : result.diagnostics()) {
            diagnostics.add(diagnostic.toString());
        }
        return new ImageSummary(result.imageName(), hex(result.loadAddress()), hex(result.entryAddress()),
                result.addressingMode(), result.image().length, regions, sections, diagnostics);
    }

    private static String hex(long value) {
        return String.format("0x%X", value);
    }

    record ImageSummary(String image, String loadAddress, String entryAddress, int addressingMode, int length,
                        List<RegionSummary> regions, List<SectionSummary> sections, List<String> diagnostics) {}

    record RegionSummary(String name, String address, long length, long imageOffset, List<String> sections) {}

    record SectionSummary(String name, String region, String address, long length, long imageOffset, boolean failed) {}
}
