package org.asma.assembler.engine;

import org.asma.assembler.api.AssemblerErrorCode;
import org.asma.assembler.content.Binary;
import org.asma.assembler.content.Region;
import org.asma.assembler.content.Section;
import org.asma.assembler.diagnostics.AssemblerLogger;
import org.asma.assembler.diagnostics.StatementException;
import org.asma.assembler.expr.LiteralReference;
import org.asma.assembler.statement.DataOperand;
import org.asma.assembler.statement.MachineOperand;
import org.asma.assembler.statement.Statement;
import org.asma.assembler.statement.StatementKind;
import org.asma.assembler.statement.StatementState;
import org.asma.assembler.symbols.SymbolEntry;
import org.asma.assembler.symbols.SymbolKind;
import org.asma.assembler.symbols.SymbolValue;

import java.util.List;
import java.util.Optional;

/**
 * Declares the containers and symbols of each statement as it is submitted.
 * <p>
 * Regions and sections are created or resumed, every content-producing statement
 * receives its {@link Binary} objects in the active section, and names are entered into
 * the symbol table without a value. Content outside of any section manufactures the
 * unnamed region and control section.
 */
final class ParsePhase extends StatementPhase {

    private static final String NOT_ALLOCATED = "not allocated yet";

    ParsePhase(AssemblyContext context) {
        super(context);
    }

    @Override
    public AssemblyPhase phase() {
        return AssemblyPhase.PARSE;
    }

    @Override
    protected StatementState targetState() {
        return StatementState.PARSED;
    }

    @Override
    public void visitStart(Statement statement, StatementKind.Start kind) throws StatementException {
        Region region;
        if (kind.opensRegion()) {
            region = openRegion(statement, kind);
        } else {
            region = context.ensureRegion();
        }
        Section section = newControlSection(statement, region);
        context.activateSection(section);
        marker(statement, section);
        if (context.loadAddress().isEmpty()) {
            context.setLoadAddress(region.start());
            context.setStartSection(section.handle());
        }
    }

    private Region openRegion(Statement statement, StatementKind.Start kind) throws StatementException {
        long start = 0;
        if (kind.address() != null) {
            start = kind.address().requireInteger(context, "START address");
            if (start < 0) {
                throw new StatementException(AssemblerErrorCode.VALUE_OUT_OF_RANGE, "negative START address " + start);
            }
        }
        Region region;
        if (kind.regionName() != null) {
            String name = context.symbols().normalize(kind.regionName());
            context.symbols().define(name, SymbolKind.REGION,
                    new SymbolValue.RegionRef(context.arena().regions().size()), statement.number());
            region = context.arena().newRegion(name, start);
        } else {
            if (context.unnamedRegion() != null) {
                throw new StatementException(AssemblerErrorCode.INVALID_CONTAINER_STATE, "unnamed region already started");
            }
            region = context.arena().newRegion("", start);
            context.setUnnamedRegion(region);
        }
        context.activateRegion(region);
        AssemblerLogger.debug(String.format("opened region %s at %X", region.displayName(), start));
        return region;
    }

    @Override
    public void visitCsect(Statement statement, StatementKind.Csect kind) throws StatementException {
        Section section;
        Optional<String> label = statement.label();
        if (label.isPresent()) {
            section = resume(label.get(), SymbolKind.CSECT);
            if (section == null) {
                section = newControlSection(statement, context.ensureRegion());
            }
        } else if (context.unnamedSection() != null) {
            section = context.unnamedSection();
        } else {
            section = newControlSection(statement, context.ensureRegion());
        }
        context.activateSection(section);
        marker(statement, section);
    }

    @Override
    public void visitDsect(Statement statement, StatementKind.Dsect kind) throws StatementException {
        String name = requireLabel(statement, "DSECT");
        Section section = resume(name, SymbolKind.DSECT);
        if (section == null) {
            SymbolEntry entry = context.symbols().define(name, SymbolKind.DSECT,
                    new SymbolValue.Pending(NOT_ALLOCATED), statement.number());
            section = context.arena().newDummySection(entry.name());
            entry.setValue(new SymbolValue.SectionRef(section.handle()));
        }
        context.activateSection(section);
        marker(statement, section);
    }

    @Override
    public void visitRegion(Statement statement, StatementKind.Region kind) throws StatementException {
        String name = requireLabel(statement, "REGION");
        SymbolEntry entry = context.symbols().lookup(name);
        if (!(entry.value() instanceof SymbolValue.RegionRef ref)) {
            throw new StatementException(AssemblerErrorCode.INVALID_CONTAINER_STATE, "'" + name + "' is not a region");
        }
        context.symbols().reference(name, statement.number());
        context.activateRegion(context.arena().regions().get(ref.index()));
        if (context.currentSection() != null) {
            marker(statement, context.currentSection());
        }
    }

    @Override
    public void visitData(Statement statement, StatementKind.Data kind) throws StatementException {
        Section section = context.ensureSection();
        statement.setSection(section);
        for (DataOperand operand : kind.operands()) {
            long length = Binary.UNKNOWN_LENGTH;
            if (DataLayout.isConstantLength(operand)) {
                length = DataLayout.totalLength(operand, context).orElse(Binary.UNKNOWN_LENGTH);
            }
            Binary binary = new Binary(operand.alignment(), length);
            section.append(binary);
            statement.addContent(binary);
        }
        defineLabel(statement);
    }

    @Override
    public void visitEqu(Statement statement, StatementKind.Equ kind) throws StatementException {
        String name = requireLabel(statement, "EQU");
        context.symbols().define(name, SymbolKind.EQUATE, new SymbolValue.Pending("not evaluated yet"), statement.number());
        if (context.currentSection() != null) {
            marker(statement, context.currentSection());
        }
    }

    @Override
    public void visitOrg(Statement statement, StatementKind.Org kind) throws StatementException {
        marker(statement, context.ensureSection());
        defineLabel(statement);
    }

    @Override
    public void visitUsing(Statement statement, StatementKind.Using kind) throws StatementException {
        directive(statement);
    }

    @Override
    public void visitDrop(Statement statement, StatementKind.Drop kind) throws StatementException {
        directive(statement);
    }

    @Override
    public void visitEntry(Statement statement, StatementKind.Entry kind) throws StatementException {
        directive(statement);
    }

    @Override
    public void visitEnd(Statement statement, StatementKind.End kind) throws StatementException {
        if (!context.literals().hasPending()) {
            directive(statement);
            return;
        }
        placeLiterals(statement, context.ensureSection());
        defineLabel(statement);
    }

    @Override
    public void visitCcw(Statement statement, StatementKind.Ccw kind) throws StatementException {
        content(statement, 8, StatementKind.Ccw.LENGTH);
    }

    @Override
    public void visitPsw(Statement statement, StatementKind.Psw kind) throws StatementException {
        content(statement, kind.format().alignment(), kind.format().length());
    }

    @Override
    public void visitCnop(Statement statement, StatementKind.Cnop kind) throws StatementException {
        // the padding depends on the location, allocation sets the length
        content(statement, 2, Binary.UNKNOWN_LENGTH);
    }

    @Override
    public void visitLtorg(Statement statement, StatementKind.Ltorg kind) throws StatementException {
        Section section = context.ensureSection();
        if (context.literals().hasPending()) {
            placeLiterals(statement, section);
        } else {
            marker(statement, section);
        }
        defineLabel(statement);
    }

    @Override
    public void visitInstruction(Statement statement, StatementKind.Instruction kind) throws StatementException {
        for (MachineOperand operand : kind.operands()) {
            if (operand.primary().expression() instanceof LiteralReference literal) {
                context.literals().register(literal, context);
            }
        }
        content(statement, 2, kind.info().length());
    }

    private void content(Statement statement, int alignment, long length) throws StatementException {
        Section section = context.ensureSection();
        Binary binary = new Binary(alignment, length);
        section.append(binary);
        statement.addContent(binary);
        statement.setSection(section);
        defineLabel(statement);
    }

    /**
     * Appends one Binary per pending literal to the section.
     */
    private void placeLiterals(Statement statement, Section section) throws StatementException {
        if (section.isDummy()) {
            throw new StatementException(AssemblerErrorCode.INVALID_CONTAINER_STATE,
                    "literal pool cannot be placed in dummy section " + section.handle().displayName());
        }
        statement.setSection(section);
        List<LiteralPool.Literal> pool = context.literals().flush(statement.number());
        for (LiteralPool.Literal literal : pool) {
            Binary binary = new Binary(literal.alignment(), literal.length());
            section.append(binary);
            statement.addContent(binary);
            literal.place(binary);
        }
        AssemblerLogger.debug(String.format("statement %d placed %d literal(s) in %s",
                statement.number(), pool.size(), section));
    }

    /**
     * Directives without content only get a position when a section is active or a label needs one.
     */
    private void directive(Statement statement) throws StatementException {
        Section section = statement.label().isPresent() ? context.ensureSection() : context.currentSection();
        if (section != null) {
            marker(statement, section);
        }
        defineLabel(statement);
    }

    private Section newControlSection(Statement statement, Region region) throws StatementException {
        Optional<String> label = statement.label();
        if (label.isEmpty()) {
            if (context.unnamedSection() != null) {
                throw new StatementException(AssemblerErrorCode.INVALID_CONTAINER_STATE, "unnamed control section already started");
            }
            Section section = context.arena().newControlSection("", region);
            context.setUnnamedSection(section);
            return section;
        }
        SymbolEntry entry = context.symbols().define(label.get(), SymbolKind.CSECT,
                new SymbolValue.Pending(NOT_ALLOCATED), statement.number());
        Section section = context.arena().newControlSection(entry.name(), region);
        entry.setValue(new SymbolValue.SectionRef(section.handle()));
        return section;
    }

    /**
     * Finds a section to continue.
     *
     * @return The section, or {@code null} if the name is not defined yet.
     * @throws StatementException if the name is defined as something else.
     */
    private Section resume(String name, SymbolKind kind) throws StatementException {
        Optional<SymbolEntry> existing = context.symbols().find(name);
        if (existing.isEmpty()) {
            return null;
        }
        SymbolEntry entry = existing.get();
        if (entry.kind() != kind || !(entry.value() instanceof SymbolValue.SectionRef ref)) {
            throw new StatementException(AssemblerErrorCode.DUPLICATE_SYMBOL,
                    "'" + entry.name() + "' is already defined at statement " + entry.definedAt());
        }
        return context.arena().section(ref.section());
    }

    private static String requireLabel(Statement statement, String operation) throws StatementException {
        return statement.label().orElseThrow(() ->
                new StatementException(AssemblerErrorCode.MISSING_LABEL, operation + " requires a name"));
    }

    private static void marker(Statement statement, Section section) {
        Binary binary = new Binary(1, 0);
        section.append(binary);
        statement.addContent(binary);
        statement.setSection(section);
    }

    private void defineLabel(Statement statement) throws StatementException {
        if (statement.label().isPresent()) {
            context.symbols().define(statement.label().get(), SymbolKind.LABEL,
                    new SymbolValue.Pending(NOT_ALLOCATED), statement.number());
        }
    }
}
