package org.asma.assembler.engine;

import org.asma.assembler.address.Address;
import org.asma.assembler.address.LocationCounter;
import org.asma.assembler.address.SectionHandle;
import org.asma.assembler.api.AssemblerErrorCode;
import org.asma.assembler.api.AssemblyException;
import org.asma.assembler.base.BaseManager;
import org.asma.assembler.config.AssemblerConfig;
import org.asma.assembler.content.Binary;
import org.asma.assembler.content.ContentArena;
import org.asma.assembler.content.Region;
import org.asma.assembler.content.Section;
import org.asma.assembler.diagnostics.AssemblerLogger;
import org.asma.assembler.diagnostics.DiagnosticsEngine;
import org.asma.assembler.diagnostics.StatementException;
import org.asma.assembler.expr.Evaluation;
import org.asma.assembler.expr.EvaluationContext;
import org.asma.assembler.expr.ExprValue;
import org.asma.assembler.expr.LiteralReference;
import org.asma.assembler.isa.IInstructionSet;
import org.asma.assembler.statement.Statement;
import org.asma.assembler.symbols.SymbolAttribute;
import org.asma.assembler.symbols.SymbolEntry;
import org.asma.assembler.symbols.SymbolTable;
import org.asma.assembler.symbols.SymbolValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The mutable state of one assembly run, shared by all phases.
 * <p>
 * Besides the symbol table, the containers and the base registers it tracks the
 * active region and section and the statement being processed, which is recorded as
 * the referencing statement whenever an expression reads a symbol.
 */
public final class AssemblyContext implements EvaluationContext {

    private final AssemblerConfig config;
    private final IInstructionSet instructionSet;
    private final String sourceName;
    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private final SymbolTable symbols;
    private final ContentArena arena;
    private final BaseManager bases;
    private final LocationCounter locationCounter = new LocationCounter();
    private final LiteralPool literals = new LiteralPool();
    private final List<Statement> statements = new ArrayList<>();

    private AssemblyPhase phase = AssemblyPhase.PARSE;
    private Statement current;
    private Region currentRegion;
    private Section currentSection;
    private Region unnamedRegion;
    private Section unnamedSection;
    private Long loadAddress;
    private SectionHandle startSection;
    private Long entryAddress;
    private byte[] imageBytes;

    public AssemblyContext(AssemblerConfig config, IInstructionSet instructionSet, String sourceName) {
        this.config = config;
        this.instructionSet = instructionSet;
        this.sourceName = sourceName;
        this.symbols = new SymbolTable(config.caseSensitive());
        this.arena = new ContentArena(config.imageName());
        this.bases = new BaseManager(instructionSet.architecture().directMode());
    }

    public AssemblerConfig config() { return config; }

    public IInstructionSet instructionSet() { return instructionSet; }

    public String sourceName() { return sourceName; }

    public DiagnosticsEngine diagnostics() { return diagnostics; }

    public SymbolTable symbols() { return symbols; }

    public ContentArena arena() { return arena; }

    public BaseManager bases() { return bases; }

    public LocationCounter locationCounter() { return locationCounter; }

    LiteralPool literals() { return literals; }

    public List<Statement> statements() {
        return Collections.unmodifiableList(statements);
    }

    void addStatement(Statement statement) {
        statements.add(statement);
    }

    public AssemblyPhase phase() { return phase; }

    void setPhase(AssemblyPhase phase) {
        this.phase = phase;
    }

    void setCurrent(Statement statement) {
        this.current = statement;
    }

    // region Active containers

    public Region currentRegion() { return currentRegion; }

    public Section currentSection() { return currentSection; }

    public Region unnamedRegion() { return unnamedRegion; }

    public Section unnamedSection() { return unnamedSection; }

    void setUnnamedRegion(Region region) {
        this.unnamedRegion = region;
    }

    void setUnnamedSection(Section section) {
        this.unnamedSection = section;
    }

    void activateRegion(Region region) {
        this.currentRegion = region;
        List<Section> sections = region.children();
        this.currentSection = sections.isEmpty() ? null : sections.get(sections.size() - 1);
    }

    void activateSection(Section section) {
        this.currentSection = section;
        if (section.region() != null) {
            this.currentRegion = section.region();
        }
    }

    /**
     * Returns the active region, creating the unnamed region at address 0 if no region exists yet.
     * @return The active region.
     */
    Region ensureRegion() {
        if (currentRegion == null) {
            unnamedRegion = arena.newRegion("", 0);
            currentRegion = unnamedRegion;
            AssemblerLogger.debug("created unnamed region");
        }
        return currentRegion;
    }

    /**
     * Returns the active section, creating the unnamed control section if no section has been started.
     *
     * @return The active section.
     * @throws StatementException if the unnamed section exists already but is not active.
     */
    Section ensureSection() throws StatementException {
        if (currentSection != null) {
            return currentSection;
        }
        if (unnamedSection != null) {
            throw new StatementException(AssemblerErrorCode.INVALID_CONTAINER_STATE,
                    "no active control section in region " + currentRegion.displayName());
        }
        Region region = ensureRegion();
        unnamedSection = arena.newControlSection("", region);
        currentSection = unnamedSection;
        AssemblerLogger.debug("created unnamed control section");
        return currentSection;
    }

    // endregion

    // region Entry and load

    public Optional<Long> loadAddress() {
        return Optional.ofNullable(loadAddress);
    }

    void setLoadAddress(long address) {
        this.loadAddress = address;
    }

    public Optional<SectionHandle> startSection() {
        return Optional.ofNullable(startSection);
    }

    void setStartSection(SectionHandle handle) {
        this.startSection = handle;
    }

    public Optional<Long> entryAddress() {
        return Optional.ofNullable(entryAddress);
    }

    void setEntryAddress(long address) {
        this.entryAddress = address;
    }

    public byte[] imageBytes() {
        return imageBytes;
    }

    void setImageBytes(byte[] bytes) {
        this.imageBytes = bytes;
    }

    // endregion

    // region Error reporting

    /**
     * Marks a statement as errored, reports the error and stops the run in fail-fast mode.
     *
     * @param statement The statement.
     * @param code      The error code.
     * @param message   The message.
     * @throws AssemblyException in fail-fast mode.
     */
    void fail(Statement statement, AssemblerErrorCode code, String message) throws AssemblyException {
        statement.fail(code, message);
        reportFailure(statement);
    }

    /**
     * Reports the error of a statement that is already marked as errored.
     *
     * @param statement The errored statement.
     * @throws AssemblyException in fail-fast mode.
     */
    void reportFailure(Statement statement) throws AssemblyException {
        String message = statement.error().orElse("error");
        AssemblerErrorCode code = statement.errorCode().orElse(AssemblerErrorCode.SYNTAX_ERROR);
        diagnostics.reportError(code, message, statement.source(), statement.number());
        AssemblerLogger.debug("statement " + statement.number() + " failed in " + phase + ": " + message);
        if (config.failFast()) {
            throw new AssemblyException(message, statement.source());
        }
    }

    /**
     * Reports an error not tied to a statement and stops the run in fail-fast mode.
     *
     * @param code    The error code.
     * @param message The message.
     * @throws AssemblyException in fail-fast mode.
     */
    void failRun(AssemblerErrorCode code, String message) throws AssemblyException {
        diagnostics.reportError(code, message, sourceName);
        if (config.failFast()) {
            throw new AssemblyException(message);
        }
    }

    // endregion

    // region EvaluationContext

    @Override
    public Evaluation symbol(String name) throws StatementException {
        SymbolEntry entry = lookup(name);
        SymbolValue value = entry.value();
        if (value instanceof SymbolValue.IntegerValue integer) {
            return Evaluation.resolved(ExprValue.of(integer.value()));
        }
        if (value instanceof SymbolValue.AddressValue address) {
            return Evaluation.resolved(ExprValue.of(address.address()));
        }
        if (value instanceof SymbolValue.SectionRef section) {
            return Evaluation.resolved(ExprValue.of(sectionStart(section.section(), entry)));
        }
        if (value instanceof SymbolValue.RegionRef region) {
            return Evaluation.resolved(ExprValue.of(Address.absolute(arena.regions().get(region.index()).start())));
        }
        if (value instanceof SymbolValue.ImageRef) {
            List<Region> regions = arena.regions();
            return Evaluation.resolved(ExprValue.of(Address.absolute(regions.isEmpty() ? 0 : regions.get(0).start())));
        }
        return Evaluation.deferred("symbol '" + entry.name() + "' has no value yet");
    }

    @Override
    public Evaluation attribute(String name, SymbolAttribute attribute) throws StatementException {
        SymbolEntry entry = lookup(name);
        if (!entry.hasAttribute(attribute)) {
            return Evaluation.deferred(attribute.letter() + "' of '" + entry.name() + "' is not known yet");
        }
        return Evaluation.resolved(ExprValue.of(entry.attribute(attribute)));
    }

    @Override
    public Evaluation location() {
        return locationCounter.current()
                .map(address -> Evaluation.resolved(ExprValue.of(address)))
                .orElseGet(() -> Evaluation.deferred("location counter not established"));
    }

    @Override
    public Evaluation literal(LiteralReference literal) throws StatementException {
        LiteralPool.Literal entry = literals.find(literal).orElseThrow(() ->
                new StatementException(AssemblerErrorCode.UNDEFINED_SYMBOL, "literal " + literal + " is not in a pool"));
        Optional<Binary> binary = entry.binary();
        if (binary.isEmpty()) {
            return Evaluation.deferred("literal " + literal + " is not in a pool yet");
        }
        if (!binary.get().isAssigned()) {
            return Evaluation.deferred("literal pool of " + literal + " not allocated yet");
        }
        int length = (int) Math.min(Integer.MAX_VALUE, entry.length());
        return Evaluation.resolved(ExprValue.of(binary.get().location().withLength(length)));
    }

    private SymbolEntry lookup(String name) throws StatementException {
        SymbolEntry entry = symbols.lookup(name);
        if (current != null) {
            symbols.reference(name, current.number());
        }
        return entry;
    }

    private Address sectionStart(SectionHandle handle, SymbolEntry entry) {
        Section section = arena.section(handle);
        int length = entry.hasAttribute(SymbolAttribute.LENGTH)
                ? (int) Math.min(Integer.MAX_VALUE, Math.max(1, entry.attribute(SymbolAttribute.LENGTH))) : 1;
        if (section.location() instanceof Address.Absolute start) {
            return start.withLength(length);
        }
        return new Address.Relative(handle, 0, length);
    }

    // endregion
}
