package org.asma.assembler.engine;

import org.asma.assembler.content.Binary;
import org.asma.assembler.diagnostics.StatementException;
import org.asma.assembler.expr.Resolvable;
import org.asma.assembler.statement.DataOperand;
import org.asma.assembler.statement.MachineOperand;
import org.asma.assembler.statement.Statement;
import org.asma.assembler.statement.StatementKind;
import org.asma.assembler.statement.StatementState;

import java.util.List;
import java.util.OptionalLong;

/**
 * Attempts every expression before any content is positioned.
 * <p>
 * A deferred expression is not an error here. Undefined names are, since every name has
 * been declared during parsing. The phase runs twice so that values depending on
 * later EQU statements settle before allocation.
 */
final class EarlyResolvePhase extends StatementPhase {

    private final boolean retry;
    private int deferred;

    EarlyResolvePhase(AssemblyContext context, boolean retry) {
        super(context);
        this.retry = retry;
    }

    @Override
    public AssemblyPhase phase() {
        return retry ? AssemblyPhase.EARLY_RESOLVE_RETRY : AssemblyPhase.EARLY_RESOLVE;
    }

    @Override
    protected StatementState targetState() {
        return StatementState.EARLY_RESOLVED;
    }

    /**
     * @return The number of expressions still deferred after the last run.
     */
    int deferredCount() {
        return deferred;
    }

    @Override
    protected void beforeStatements() {
        context.locationCounter().clear();
        deferred = 0;
    }

    @Override
    public void visitStart(Statement statement, StatementKind.Start kind) {
    }

    @Override
    public void visitCsect(Statement statement, StatementKind.Csect kind) {
    }

    @Override
    public void visitDsect(Statement statement, StatementKind.Dsect kind) {
    }

    @Override
    public void visitRegion(Statement statement, StatementKind.Region kind) {
    }

    @Override
    public void visitData(Statement statement, StatementKind.Data kind) throws StatementException {
        List<DataOperand> operands = kind.operands();
        for (int i = 0; i < operands.size(); i++) {
            DataOperand operand = operands.get(i);
            Binary binary = statement.content().get(i);
            if (!binary.hasKnownLength()) {
                OptionalLong length = DataLayout.totalLength(operand, context);
                if (length.isPresent()) {
                    binary.setLength(length.getAsLong());
                } else {
                    deferred++;
                }
            }
            attempt(operand.expressions());
        }
    }

    @Override
    public void visitEqu(Statement statement, StatementKind.Equ kind) throws StatementException {
        if (!EquateResolver.tryResolve(context, statement, kind)) {
            deferred++;
        }
    }

    @Override
    public void visitOrg(Statement statement, StatementKind.Org kind) throws StatementException {
        attempt(kind.target());
    }

    @Override
    public void visitUsing(Statement statement, StatementKind.Using kind) throws StatementException {
        attempt(kind.anchor());
        attempt(kind.registers());
    }

    @Override
    public void visitDrop(Statement statement, StatementKind.Drop kind) throws StatementException {
        attempt(kind.registers());
    }

    @Override
    public void visitEntry(Statement statement, StatementKind.Entry kind) throws StatementException {
        attempt(kind.target());
    }

    @Override
    public void visitEnd(Statement statement, StatementKind.End kind) throws StatementException {
        attempt(kind.entry());
    }

    @Override
    public void visitCcw(Statement statement, StatementKind.Ccw kind) throws StatementException {
        attempt(kind.operands());
    }

    @Override
    public void visitPsw(Statement statement, StatementKind.Psw kind) throws StatementException {
        attempt(kind.operands());
    }

    @Override
    public void visitCnop(Statement statement, StatementKind.Cnop kind) throws StatementException {
        attempt(kind.offset());
        attempt(kind.boundary());
    }

    @Override
    public void visitLtorg(Statement statement, StatementKind.Ltorg kind) {
    }

    @Override
    public void visitInstruction(Statement statement, StatementKind.Instruction kind) throws StatementException {
        for (MachineOperand operand : kind.operands()) {
            attempt(operand.primary());
            attempt(operand.first());
            attempt(operand.second());
        }
    }

    private void attempt(List<Resolvable> resolvables) throws StatementException {
        for (Resolvable resolvable : resolvables) {
            attempt(resolvable);
        }
    }

    private void attempt(Resolvable resolvable) throws StatementException {
        if (resolvable != null && resolvable.tryResolve(context).isEmpty()) {
            deferred++;
        }
    }
}
