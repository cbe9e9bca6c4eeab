package org.asma.assembler.api;

import org.asma.assembler.diagnostics.Diagnostic;

import java.util.Arrays;
import java.util.List;

/**
 * The product of an assembly run: the load image, its layout, and everything needed
 * to write listings and loader files.
 *
 * @param imageName      The image name.
 * @param image          The image bytes, regions concatenated in declaration order.
 * @param loadAddress    The address the image is loaded at.
 * @param entryAddress   The entry point.
 * @param addressingMode The addressing mode, 24, 31 or 64.
 * @param regions        The region layout.
 * @param sections       The control section layout.
 * @param symbols        The symbol cross reference, sorted by name.
 * @param listing        One line per statement.
 * @param content        The built content of every control section, in source order.
 * @param diagnostics    The collected diagnostics.
 * @param outputs        The files produced by the registered output writers.
 */
public record AssemblyResult(
        String imageName,
        byte[] image,
        long loadAddress,
        long entryAddress,
        int addressingMode,
        List<RegionLayout> regions,
        List<SectionLayout> sections,
        List<SymbolSummary> symbols,
        List<ListingLine> listing,
        List<LoadedBytes> content,
        List<Diagnostic> diagnostics,
        List<OutputFile> outputs
) {
    /**
     * @return {@code true} if any error was reported.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * @param region A region of this result.
     * @return The region's bytes.
     */
    public byte[] regionBytes(RegionLayout region) {
        int from = Math.toIntExact(region.imageOffset());
        return Arrays.copyOfRange(image, from, from + Math.toIntExact(region.length()));
    }

    /**
     * @param section A section of this result.
     * @return The section's bytes.
     */
    public byte[] sectionBytes(SectionLayout section) {
        int from = Math.toIntExact(section.imageOffset());
        return Arrays.copyOfRange(image, from, from + Math.toIntExact(section.length()));
    }

    public AssemblyResult withOutputs(List<OutputFile> files) {
        return new AssemblyResult(imageName, image, loadAddress, entryAddress, addressingMode,
                regions, sections, symbols, listing, content, diagnostics, List.copyOf(files));
    }
}
