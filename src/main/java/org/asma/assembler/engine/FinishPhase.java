package org.asma.assembler.engine;

import org.asma.assembler.address.Address;
import org.asma.assembler.api.AssemblyResult;
import org.asma.assembler.api.ListingLine;
import org.asma.assembler.api.LoadedBytes;
import org.asma.assembler.api.OutputFile;
import org.asma.assembler.api.RegionLayout;
import org.asma.assembler.api.SectionLayout;
import org.asma.assembler.api.SymbolSummary;
import org.asma.assembler.content.Binary;
import org.asma.assembler.content.Region;
import org.asma.assembler.content.Section;
import org.asma.assembler.output.IOutputWriter;
import org.asma.assembler.statement.Statement;
import org.asma.assembler.symbols.SymbolAttribute;
import org.asma.assembler.symbols.SymbolEntry;
import org.asma.assembler.symbols.SymbolValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Selects the load and entry addresses, builds the {@link AssemblyResult} and hands it
 * to the registered output writers.
 * <p>
 * The load address is the start of the region opened by the first START, or of the
 * first region. The entry point is the last ENTRY or END operand, or else the start of
 * the first START section, or else the load address.
 */
final class FinishPhase implements IAssemblyPhase {

    private static final Logger LOG = LoggerFactory.getLogger(FinishPhase.class);

    private final AssemblyContext context;
    private final List<IOutputWriter> writers;
    private AssemblyResult result;

    FinishPhase(AssemblyContext context, List<IOutputWriter> writers) {
        this.context = context;
        this.writers = writers;
    }

    @Override
    public AssemblyPhase phase() {
        return AssemblyPhase.FINISH;
    }

    @Override
    public void run() {
        List<Region> regions = context.arena().regions();
        long load = context.loadAddress().orElse(regions.isEmpty() ? 0L : regions.get(0).start());
        long entry = context.entryAddress().orElseGet(() -> startSectionAddress().orElse(load));
        byte[] image = context.imageBytes() == null ? new byte[0] : context.imageBytes();

        AssemblyResult assembled = new AssemblyResult(
                context.config().imageName(),
                image,
                load,
                entry,
                context.config().addressingMode(),
                regionLayouts(),
                sectionLayouts(),
                symbolSummaries(),
                listing(),
                loadedBytes(),
                List.copyOf(context.diagnostics().getDiagnostics()),
                List.of());

        List<OutputFile> outputs = new ArrayList<>();
        for (IOutputWriter writer : writers) {
            List<OutputFile> files = writer.write(assembled);
            LOG.debug("{} produced {} file(s)", writer.getClass().getSimpleName(), files.size());
            outputs.addAll(files);
        }
        result = assembled.withOutputs(outputs);
    }

    /**
     * @return The result, available once the phase has run.
     */
    AssemblyResult result() {
        if (result == null) {
            throw new IllegalStateException("finish phase has not run");
        }
        return result;
    }

    private Optional<Long> startSectionAddress() {
        return context.startSection()
                .map(handle -> context.arena().section(handle).location())
                .filter(Address::isAbsolute)
                .map(Address::position);
    }

    private List<RegionLayout> regionLayouts() {
        List<RegionLayout> layouts = new ArrayList<>();
        for (Region region : context.arena().regions()) {
            List<String> sections = new ArrayList<>();
            for (Section section : region.children()) {
                sections.add(section.name());
            }
            layouts.add(new RegionLayout(region.name(), region.start(), region.length(),
                    region.isLocated() ? region.imageOffset() : 0, List.copyOf(sections)));
        }
        return List.copyOf(layouts);
    }

    private List<SectionLayout> sectionLayouts() {
        List<SectionLayout> layouts = new ArrayList<>();
        for (Section section : context.arena().sections()) {
            if (section.isDummy() || !section.isLocated()) {
                continue;
            }
            layouts.add(new SectionLayout(section.name(), section.region().name(), section.location().position(),
                    section.length(), section.imageOffset(), section.isFailed()));
        }
        return List.copyOf(layouts);
    }

    private List<SymbolSummary> symbolSummaries() {
        List<SymbolSummary> summaries = new ArrayList<>();
        for (SymbolEntry entry : context.symbols().sortedEntries()) {
            long length = entry.hasAttribute(SymbolAttribute.LENGTH) ? entry.attribute(SymbolAttribute.LENGTH) : 0;
            summaries.add(new SymbolSummary(entry.name(), entry.kind().name(), format(entry.value()), length,
                    entry.typeCode(), entry.definedAt(), List.copyOf(entry.references())));
        }
        return List.copyOf(summaries);
    }

    private String format(SymbolValue value) {
        if (value instanceof SymbolValue.SectionRef ref) {
            Address location = context.arena().section(ref.section()).location();
            return location == null ? "0" : String.format("%08X", location.position());
        }
        if (value instanceof SymbolValue.RegionRef ref) {
            return String.format("%08X", context.arena().regions().get(ref.index()).start());
        }
        if (value instanceof SymbolValue.ImageRef) {
            List<Region> regions = context.arena().regions();
            return String.format("%08X", regions.isEmpty() ? 0 : regions.get(0).start());
        }
        if (value instanceof SymbolValue.AddressValue address) {
            Address a = address.address();
            return a.isAbsolute() ? String.format("%08X", a.position()) : a.toString();
        }
        if (value instanceof SymbolValue.IntegerValue integer) {
            return Long.toString(integer.value());
        }
        return "*UNRESOLVED*";
    }

    private List<LoadedBytes> loadedBytes() {
        List<LoadedBytes> loaded = new ArrayList<>();
        for (Statement statement : context.statements()) {
            Section section = statement.section();
            if (statement.isIgnored() || section == null || section.isDummy() || section.isFailed()) {
                continue;
            }
            for (Binary binary : statement.content()) {
                if (binary.length() > 0 && binary.isAssigned() && binary.location().isAbsolute()) {
                    binary.bytes().ifPresent(bytes -> loaded.add(new LoadedBytes(binary.location().position(), bytes)));
                }
            }
        }
        return List.copyOf(loaded);
    }

    private List<ListingLine> listing() {
        List<ListingLine> lines = new ArrayList<>();
        for (Statement statement : context.statements()) {
            Long location = statement.location().map(Address::position).orElse(null);
            lines.add(new ListingLine(statement.number(), statement.source(), location,
                    statement.objectCode(), statement.error().orElse(null)));
        }
        return List.copyOf(lines);
    }
}
