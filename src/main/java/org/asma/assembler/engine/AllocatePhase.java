package org.asma.assembler.engine;

import org.asma.assembler.address.Address;
import org.asma.assembler.api.AssemblerErrorCode;
import org.asma.assembler.api.AssemblyException;
import org.asma.assembler.content.Binary;
import org.asma.assembler.content.ContainerAllocationException;
import org.asma.assembler.content.Section;
import org.asma.assembler.diagnostics.AssemblerLogger;
import org.asma.assembler.diagnostics.StatementException;
import org.asma.assembler.expr.ExprValue;
import org.asma.assembler.statement.DataOperand;
import org.asma.assembler.statement.DataType;
import org.asma.assembler.statement.Statement;
import org.asma.assembler.statement.StatementKind;
import org.asma.assembler.statement.StatementState;
import org.asma.assembler.symbols.SymbolEntry;
import org.asma.assembler.symbols.SymbolKind;
import org.asma.assembler.symbols.SymbolValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Positions every Binary in its section, in source order.
 * <p>
 * Labels receive their section-relative addresses and length attributes. EQU statements
 * that depend on locations are evaluated as soon as their operands are positioned; those
 * referring forward are retried once all content has been placed. Sections are frozen
 * at the end.
 */
final class AllocatePhase extends StatementPhase {

    private final List<Statement> pendingEquates = new ArrayList<>();

    AllocatePhase(AssemblyContext context) {
        super(context);
    }

    @Override
    public AssemblyPhase phase() {
        return AssemblyPhase.ALLOCATE;
    }

    @Override
    protected StatementState targetState() {
        return StatementState.ALLOCATED;
    }

    @Override
    protected void beforeStatements() {
        context.locationCounter().clear();
        pendingEquates.clear();
    }

    @Override
    protected void process(Statement statement) throws AssemblyException {
        if (statement.isIgnored()) {
            return;
        }
        Section section = statement.section();
        if (section != null && section.isFailed()) {
            // the section's addresses are unreliable from here on, the cause is already reported
            statement.fail(AssemblerErrorCode.CONTAINER_ALLOCATION,
                    "section " + section.handle().displayName() + " is unusable");
            return;
        }
        if (statement.isErrored()) {
            occupy(statement);
            return;
        }
        dispatch(statement);
    }

    /**
     * Reserves the space of an errored statement so that the addresses after it stay correct.
     */
    private void occupy(Statement statement) throws AssemblyException {
        Section section = statement.section();
        if (section == null) {
            return;
        }
        for (Binary binary : statement.content()) {
            if (!binary.hasKnownLength()) {
                // the length never resolved, nothing to reserve
                binary.setLength(0);
            }
            try {
                section.allocate(binary);
            } catch (ContainerAllocationException e) {
                section.fail(e.getMessage());
                context.failRun(e.getCode(), "statement " + statement.number() + ": " + e.getMessage());
                return;
            }
        }
    }

    @Override
    public void visitStart(Statement statement, StatementKind.Start kind) throws ContainerAllocationException {
        place(statement);
    }

    @Override
    public void visitCsect(Statement statement, StatementKind.Csect kind) throws ContainerAllocationException {
        place(statement);
    }

    @Override
    public void visitDsect(Statement statement, StatementKind.Dsect kind) throws ContainerAllocationException {
        place(statement);
    }

    @Override
    public void visitRegion(Statement statement, StatementKind.Region kind) throws ContainerAllocationException {
        place(statement);
    }

    @Override
    public void visitData(Statement statement, StatementKind.Data kind) throws StatementException, ContainerAllocationException {
        Optional<Address> location = place(statement);
        DataOperand first = kind.operands().get(0);
        long length = DataLayout.elementLength(first, context).orElse(1);
        if (location.isPresent()) {
            Optional<SymbolEntry> label = label(statement);
            if (label.isPresent()) {
                define(label.get(), location.get(), length);
                if (first.type() == DataType.F || first.type() == DataType.H || first.type() == DataType.FD) {
                    label.get().setInteger((int) (8 * length - 1));
                }
            }
        }
    }

    @Override
    public void visitEqu(Statement statement, StatementKind.Equ kind) throws StatementException, ContainerAllocationException {
        place(statement);
        if (!EquateResolver.tryResolve(context, statement, kind)) {
            pendingEquates.add(statement);
        }
    }

    @Override
    public void visitOrg(Statement statement, StatementKind.Org kind) throws StatementException, ContainerAllocationException {
        Optional<Address> location = place(statement);
        labelAt(statement, location, 1);
        Section section = statement.section();
        if (kind.target() == null) {
            section.org(Address.relative(section.handle(), section.length()));
            return;
        }
        Optional<ExprValue> target = kind.target().tryResolve(context);
        if (target.isEmpty()) {
            throw new ContainerAllocationException("ORG target '" + kind.target() + "' cannot be resolved: "
                    + kind.target().lastDeferral().orElse("unknown"));
        }
        if (!(target.get() instanceof ExprValue.AddrValue address)) {
            throw new ContainerAllocationException("ORG target '" + kind.target() + "' is not a location");
        }
        section.org(address.address());
    }

    @Override
    public void visitUsing(Statement statement, StatementKind.Using kind) throws ContainerAllocationException {
        labelAt(statement, place(statement), 1);
    }

    @Override
    public void visitDrop(Statement statement, StatementKind.Drop kind) throws ContainerAllocationException {
        labelAt(statement, place(statement), 1);
    }

    @Override
    public void visitEntry(Statement statement, StatementKind.Entry kind) throws ContainerAllocationException {
        labelAt(statement, place(statement), 1);
    }

    @Override
    public void visitEnd(Statement statement, StatementKind.End kind) throws ContainerAllocationException {
        labelAt(statement, place(statement), 1);
    }

    @Override
    public void visitCcw(Statement statement, StatementKind.Ccw kind) throws ContainerAllocationException {
        labelAt(statement, place(statement), StatementKind.Ccw.LENGTH);
    }

    @Override
    public void visitPsw(Statement statement, StatementKind.Psw kind) throws ContainerAllocationException {
        labelAt(statement, place(statement), kind.format().length());
    }

    @Override
    public void visitCnop(Statement statement, StatementKind.Cnop kind) throws StatementException, ContainerAllocationException {
        long offset = kind.offset().requireInteger(context, "CNOP byte");
        long boundary = kind.boundary().requireInteger(context, "CNOP boundary");
        if (boundary != 4 && boundary != 8) {
            throw new StatementException(AssemblerErrorCode.VALUE_OUT_OF_RANGE, "CNOP boundary must be 4 or 8, not " + boundary);
        }
        if (offset < 0 || offset >= boundary || offset % 2 != 0) {
            throw new StatementException(AssemblerErrorCode.VALUE_OUT_OF_RANGE,
                    "CNOP byte " + offset + " is not an even offset within " + boundary);
        }
        // sections start on a doubleword, so the section offset decides the padding
        long halfword = (statement.section().currentAddress().position() + 1) & -2L;
        statement.content().get(0).setLength(Math.floorMod(offset - halfword, boundary));
        labelAt(statement, place(statement), 1);
    }

    @Override
    public void visitLtorg(Statement statement, StatementKind.Ltorg kind) throws ContainerAllocationException {
        Optional<Address> location = place(statement);
        labelAt(statement, location, statement.content().isEmpty() ? 1 : Math.max(1, statement.content().get(0).length()));
    }

    @Override
    public void visitInstruction(Statement statement, StatementKind.Instruction kind) throws ContainerAllocationException {
        labelAt(statement, place(statement), kind.info().length());
    }

    @Override
    protected void afterStatements() throws AssemblyException {
        resolveForwardEquates();
        for (Section section : context.arena().sections()) {
            section.freeze();
        }
        for (SymbolEntry entry : context.symbols().entries()) {
            if (entry.value() instanceof SymbolValue.SectionRef ref) {
                entry.setLength(context.arena().section(ref.section()).length());
            }
        }
    }

    /**
     * Retries the EQU statements that referred forward until no further one can be resolved.
     * Those left over are reported during object generation.
     */
    private void resolveForwardEquates() throws AssemblyException {
        boolean progress = true;
        while (progress && !pendingEquates.isEmpty()) {
            progress = false;
            for (Statement statement : new ArrayList<>(pendingEquates)) {
                context.setCurrent(statement);
                Optional<Address> location = statement.location();
                if (location.isPresent()) {
                    context.locationCounter().establish(location.get());
                } else {
                    context.locationCounter().clear();
                }
                try {
                    if (EquateResolver.tryResolve(context, statement, (StatementKind.Equ) statement.kind())) {
                        pendingEquates.remove(statement);
                        progress = true;
                    }
                } catch (StatementException e) {
                    pendingEquates.remove(statement);
                    context.fail(statement, e.getCode(), e.getMessage());
                }
            }
        }
        context.setCurrent(null);
        if (!pendingEquates.isEmpty()) {
            AssemblerLogger.debug(pendingEquates.size() + " EQU statements still unresolved after allocation");
        }
    }

    /**
     * Positions the statement's content and establishes the location counter at its start.
     *
     * @return The location of the first Binary, empty for statements without content.
     */
    private Optional<Address> place(Statement statement) throws ContainerAllocationException {
        Section section = statement.section();
        if (section == null || statement.content().isEmpty()) {
            return Optional.empty();
        }
        for (Binary binary : statement.content()) {
            section.allocate(binary);
        }
        Address location = statement.content().get(0).location();
        context.locationCounter().establish(location);
        return Optional.of(location);
    }

    private void labelAt(Statement statement, Optional<Address> location, long length) {
        if (location.isPresent()) {
            label(statement).ifPresent(entry -> define(entry, location.get(), length));
        }
    }

    private Optional<SymbolEntry> label(Statement statement) {
        return statement.label()
                .flatMap(name -> context.symbols().find(name))
                .filter(entry -> entry.kind() == SymbolKind.LABEL && entry.definedAt() == statement.number());
    }

    private static void define(SymbolEntry entry, Address location, long length) {
        entry.setValue(new SymbolValue.AddressValue(location.withLength((int) Math.min(Integer.MAX_VALUE, length))));
        entry.setLength(length);
    }
}
