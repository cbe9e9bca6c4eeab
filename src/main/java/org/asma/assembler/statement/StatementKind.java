package org.asma.assembler.statement;

import org.asma.assembler.content.ContainerAllocationException;
import org.asma.assembler.diagnostics.StatementException;
import org.asma.assembler.expr.Resolvable;
import org.asma.assembler.isa.InstructionInfo;

import java.util.List;

/**
 * What a statement does. The set of kinds is closed; every phase handles each of them
 * through {@link StatementVisitor}.
 */
public sealed interface StatementKind {

    /**
     * Dispatches to the visitor method for this kind.
     *
     * @param visitor   The visitor.
     * @param statement The statement carrying this kind.
     * @throws StatementException if the visitor reports a statement error.
     * @throws ContainerAllocationException if the visitor cannot lay out the statement's section.
     */
    void accept(StatementVisitor visitor, Statement statement) throws StatementException, ContainerAllocationException;

    /** Comments, listing control and statements that failed to parse. */
    record Ignored(String reason) implements StatementKind {
        @Override
        public void accept(StatementVisitor visitor, Statement statement) {
            visitor.visitIgnored(statement, this);
        }
    }

    /**
     * {@code [name] START [address][,region]}. Either operand opens a new region.
     *
     * @param address    The region start address, may be {@code null}.
     * @param regionName The region name, may be {@code null}.
     */
    record Start(Resolvable address, String regionName) implements StatementKind {
        public boolean opensRegion() {
            return address != null || regionName != null;
        }

        @Override
        public void accept(StatementVisitor visitor, Statement statement) throws StatementException, ContainerAllocationException {
            visitor.visitStart(statement, this);
        }
    }

    /** {@code [name] CSECT} starts or resumes a control section. */
    record Csect() implements StatementKind {
        @Override
        public void accept(StatementVisitor visitor, Statement statement) throws StatementException, ContainerAllocationException {
            visitor.visitCsect(statement, this);
        }
    }

    /** {@code name DSECT} starts or resumes a dummy section. */
    record Dsect() implements StatementKind {
        @Override
        public void accept(StatementVisitor visitor, Statement statement) throws StatementException, ContainerAllocationException {
            visitor.visitDsect(statement, this);
        }
    }

    /** {@code name REGION} resumes a region opened by START. */
    record Region() implements StatementKind {
        @Override
        public void accept(StatementVisitor visitor, Statement statement) throws StatementException, ContainerAllocationException {
            visitor.visitRegion(statement, this);
        }
    }

    /**
     * DC ({@code reserveOnly == false}) or DS.
     */
    record Data(boolean reserveOnly, List<DataOperand> operands) implements StatementKind {
        @Override
        public void accept(StatementVisitor visitor, Statement statement) throws StatementException, ContainerAllocationException {
            visitor.visitData(statement, this);
        }
    }

    /**
     * {@code name EQU value[,length]}.
     */
    record Equ(Resolvable value, Resolvable length) implements StatementKind {
        @Override
        public void accept(StatementVisitor visitor, Statement statement) throws StatementException, ContainerAllocationException {
            visitor.visitEqu(statement, this);
        }
    }

    /**
     * {@code ORG [target]}. Without a target the location counter moves to the section's high-water mark.
     */
    record Org(Resolvable target) implements StatementKind {
        @Override
        public void accept(StatementVisitor visitor, Statement statement) throws StatementException, ContainerAllocationException {
            visitor.visitOrg(statement, this);
        }
    }

    /**
     * {@code USING anchor,reg[,reg...]}. Each further register covers the next 4096 bytes.
     */
    record Using(Resolvable anchor, List<Resolvable> registers) implements StatementKind {
        @Override
        public void accept(StatementVisitor visitor, Statement statement) throws StatementException, ContainerAllocationException {
            visitor.visitUsing(statement, this);
        }
    }

    /** {@code DROP [reg...]}. Without operands every USING is dropped. */
    record Drop(List<Resolvable> registers) implements StatementKind {
        @Override
        public void accept(StatementVisitor visitor, Statement statement) throws StatementException, ContainerAllocationException {
            visitor.visitDrop(statement, this);
        }
    }

    /** {@code ENTRY address} sets the image entry point. */
    record Entry(Resolvable target) implements StatementKind {
        @Override
        public void accept(StatementVisitor visitor, Statement statement) throws StatementException, ContainerAllocationException {
            visitor.visitEntry(statement, this);
        }
    }

    /** {@code END [entry]}. */
    record End(Resolvable entry) implements StatementKind {
        @Override
        public void accept(StatementVisitor visitor, Statement statement) throws StatementException, ContainerAllocationException {
            visitor.visitEnd(statement, this);
        }
    }

    /**
     * {@code CCW0} or {@code CCW1}: {@code command,address,flags,count}.
     *
     * @param format   The CCW format, 0 or 1.
     * @param operands The four operand expressions.
     */
    record Ccw(int format, List<Resolvable> operands) implements StatementKind {
        /** Channel command words occupy a doubleword. */
        public static final int LENGTH = 8;

        @Override
        public void accept(StatementVisitor visitor, Statement statement) throws StatementException, ContainerAllocationException {
            visitor.visitCcw(statement, this);
        }
    }

    /**
     * A program status word: {@code sys,key,mwp,prog,address[,amode]}.
     */
    record Psw(PswFormat format, List<Resolvable> operands) implements StatementKind {
        @Override
        public void accept(StatementVisitor visitor, Statement statement) throws StatementException, ContainerAllocationException {
            visitor.visitPsw(statement, this);
        }
    }

    /**
     * {@code CNOP byte,boundary} pads with no-operation instructions up to the given
     * byte of the next fullword or doubleword.
     */
    record Cnop(Resolvable offset, Resolvable boundary) implements StatementKind {
        @Override
        public void accept(StatementVisitor visitor, Statement statement) throws StatementException, ContainerAllocationException {
            visitor.visitCnop(statement, this);
        }
    }

    /** {@code LTORG} places the literals referenced since the previous pool. */
    record Ltorg() implements StatementKind {
        @Override
        public void accept(StatementVisitor visitor, Statement statement) throws StatementException, ContainerAllocationException {
            visitor.visitLtorg(statement, this);
        }
    }

    /** A machine instruction. */
    record Instruction(InstructionInfo info, List<MachineOperand> operands) implements StatementKind {
        @Override
        public void accept(StatementVisitor visitor, Statement statement) throws StatementException, ContainerAllocationException {
            visitor.visitInstruction(statement, this);
        }
    }
}
