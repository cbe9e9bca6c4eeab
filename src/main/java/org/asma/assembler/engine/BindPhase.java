package org.asma.assembler.engine;

import org.asma.assembler.address.Address;
import org.asma.assembler.api.AssemblerErrorCode;
import org.asma.assembler.api.AssemblyException;
import org.asma.assembler.content.Content;
import org.asma.assembler.content.Image;
import org.asma.assembler.content.Region;
import org.asma.assembler.content.Section;
import org.asma.assembler.diagnostics.AssemblerLogger;
import org.asma.assembler.diagnostics.StatementException;
import org.asma.assembler.statement.Statement;
import org.asma.assembler.statement.StatementState;
import org.asma.assembler.symbols.SymbolEntry;
import org.asma.assembler.symbols.SymbolKind;
import org.asma.assembler.symbols.SymbolValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Places the sections of every region at absolute addresses.
 * <p>
 * After this phase every CSECT-relative address, in content and in the symbol table,
 * is absolute, and every region, section and Binary knows its displacement in the image.
 * DSECT addresses stay relative.
 */
final class BindPhase implements IAssemblyPhase {

    private static final Logger LOG = LoggerFactory.getLogger(BindPhase.class);

    private final AssemblyContext context;

    BindPhase(AssemblyContext context) {
        this.context = context;
    }

    @Override
    public AssemblyPhase phase() {
        return AssemblyPhase.BIND;
    }

    @Override
    public void run() throws AssemblyException {
        Image image = context.arena().image();
        int bits = context.config().effectiveAddressBits();
        long imageLength = 0;
        for (Region region : context.arena().regions()) {
            region.bindAll();
            boolean fitted = imageLength <= Content.MAX_LENGTH;
            imageLength += region.length();
            if (fitted && imageLength > Content.MAX_LENGTH) {
                context.failRun(AssemblerErrorCode.CONTAINER_ALLOCATION, String.format(
                        "image exceeds %d bytes at region %s", Content.MAX_LENGTH, region.displayName()));
            }
            if (bits < 64 && region.end() > (1L << bits)) {
                context.failRun(AssemblerErrorCode.ADDRESS_WIDTH_EXCEEDED, String.format(
                        "region %s ends at %X, beyond the %d-bit address space", region.displayName(), region.end(), bits));
            }
            AssemblerLogger.debug(String.format("bound region %s %X-%X", region.displayName(), region.start(), region.end()));
        }
        bindSymbols();
        image.locateAll();
        updateAttributes();
        defineImageSymbol(image);
        for (Statement statement : context.statements()) {
            if (!statement.isIgnored() && !statement.isErrored()) {
                statement.advance(StatementState.BOUND);
            }
        }
    }

    private void bindSymbols() {
        for (SymbolEntry entry : context.symbols().entries()) {
            if (entry.value() instanceof SymbolValue.AddressValue value
                    && value.address() instanceof Address.Relative relative
                    && !relative.isDummy()) {
                Section section = context.arena().section(relative.section());
                entry.setValue(new SymbolValue.AddressValue(relative.toAbsolute(section.location().position())));
            }
        }
    }

    private void updateAttributes() {
        List<Region> regions = context.arena().regions();
        for (SymbolEntry entry : context.symbols().entries()) {
            SymbolValue value = entry.value();
            if (value instanceof SymbolValue.SectionRef ref) {
                Section section = context.arena().section(ref.section());
                if (!section.isDummy()) {
                    entry.setLength(section.length());
                    entry.setImageDisplacement(section.imageOffset());
                }
            } else if (value instanceof SymbolValue.RegionRef ref) {
                Region region = regions.get(ref.index());
                entry.setLength(region.length());
                entry.setImageDisplacement(region.imageOffset());
            } else if (value instanceof SymbolValue.AddressValue address && address.address() instanceof Address.Absolute absolute) {
                regionOf(absolute.value()).ifPresent(region ->
                        entry.setImageDisplacement(region.imageOffset() + absolute.value() - region.start()));
            }
        }
    }

    private Optional<Region> regionOf(long address) {
        for (Region region : context.arena().regions()) {
            if (address >= region.start() && address <= region.end()) {
                return Optional.of(region);
            }
        }
        return Optional.empty();
    }

    private void defineImageSymbol(Image image) {
        String name = context.config().imageName();
        Optional<SymbolEntry> existing = context.symbols().find(name);
        if (existing.isPresent() && !existing.get().isRedefinable()) {
            LOG.warn("Image name '{}' is already used by a symbol defined at statement {}; no image symbol defined",
                    name, existing.get().definedAt());
            return;
        }
        try {
            SymbolEntry entry = context.symbols().define(name, SymbolKind.IMAGE, new SymbolValue.ImageRef(), 0, true);
            entry.setLength(image.length());
            entry.setImageDisplacement(0);
        } catch (StatementException e) {
            throw new IllegalStateException("image symbol could not be defined", e);
        }
    }
}
