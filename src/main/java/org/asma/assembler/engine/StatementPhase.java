package org.asma.assembler.engine;

import org.asma.assembler.api.AssemblyException;
import org.asma.assembler.content.ContainerAllocationException;
import org.asma.assembler.content.Section;
import org.asma.assembler.diagnostics.StatementException;
import org.asma.assembler.statement.Statement;
import org.asma.assembler.statement.StatementKind;
import org.asma.assembler.statement.StatementState;
import org.asma.assembler.statement.StatementVisitor;

/**
 * Base class of the phases that visit statements in source order.
 * <p>
 * A statement error marks only the statement as errored. A container allocation error
 * additionally marks the statement's section as failed.
 */
abstract class StatementPhase implements IAssemblyPhase, StatementVisitor {

    protected final AssemblyContext context;

    protected StatementPhase(AssemblyContext context) {
        this.context = context;
    }

    /**
     * @return The state a statement reaches when this phase succeeds for it.
     */
    protected abstract StatementState targetState();

    @Override
    public void run() throws AssemblyException {
        beforeStatements();
        for (Statement statement : context.statements()) {
            process(statement);
        }
        context.setCurrent(null);
        afterStatements();
    }

    /**
     * Visits one statement. Ignored and errored statements are skipped.
     *
     * @param statement The statement.
     * @throws AssemblyException if the run must stop.
     */
    protected void process(Statement statement) throws AssemblyException {
        if (statement.isIgnored() || statement.isErrored()) {
            return;
        }
        dispatch(statement);
    }

    protected final void dispatch(Statement statement) throws AssemblyException {
        context.setCurrent(statement);
        try {
            statement.kind().accept(this, statement);
            if (!statement.isErrored()) {
                statement.advance(targetState());
            }
        } catch (StatementException e) {
            context.fail(statement, e.getCode(), e.getMessage());
        } catch (ContainerAllocationException e) {
            Section section = statement.section();
            if (section != null) {
                section.fail(e.getMessage());
            }
            context.fail(statement, e.getCode(), e.getMessage());
        }
    }

    protected void beforeStatements() throws AssemblyException {
    }

    protected void afterStatements() throws AssemblyException {
    }

    @Override
    public void visitIgnored(Statement statement, StatementKind.Ignored kind) {
    }
}
