package org.asma.assembler.statement;

import org.asma.assembler.content.ContainerAllocationException;
import org.asma.assembler.diagnostics.StatementException;

/**
 * One method per {@link StatementKind}. A phase implementing this interface has to
 * decide what to do with every kind of statement.
 */
public interface StatementVisitor {

    void visitIgnored(Statement statement, StatementKind.Ignored kind);

    void visitStart(Statement statement, StatementKind.Start kind) throws StatementException, ContainerAllocationException;

    void visitCsect(Statement statement, StatementKind.Csect kind) throws StatementException, ContainerAllocationException;

    void visitDsect(Statement statement, StatementKind.Dsect kind) throws StatementException, ContainerAllocationException;

    void visitRegion(Statement statement, StatementKind.Region kind) throws StatementException, ContainerAllocationException;

    void visitData(Statement statement, StatementKind.Data kind) throws StatementException, ContainerAllocationException;

    void visitEqu(Statement statement, StatementKind.Equ kind) throws StatementException, ContainerAllocationException;

    void visitOrg(Statement statement, StatementKind.Org kind) throws StatementException, ContainerAllocationException;

    void visitUsing(Statement statement, StatementKind.Using kind) throws StatementException, ContainerAllocationException;

    void visitDrop(Statement statement, StatementKind.Drop kind) throws StatementException, ContainerAllocationException;

    void visitEntry(Statement statement, StatementKind.Entry kind) throws StatementException, ContainerAllocationException;

    void visitEnd(Statement statement, StatementKind.End kind) throws StatementException, ContainerAllocationException;

    void visitCcw(Statement statement, StatementKind.Ccw kind) throws StatementException, ContainerAllocationException;

    void visitPsw(Statement statement, StatementKind.Psw kind) throws StatementException, ContainerAllocationException;

    void visitCnop(Statement statement, StatementKind.Cnop kind) throws StatementException, ContainerAllocationException;

    void visitLtorg(Statement statement, StatementKind.Ltorg kind) throws StatementException, ContainerAllocationException;

    void visitInstruction(Statement statement, StatementKind.Instruction kind) throws StatementException, ContainerAllocationException;
}
