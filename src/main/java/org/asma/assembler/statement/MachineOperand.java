package org.asma.assembler.statement;

import org.asma.assembler.expr.Resolvable;
import org.asma.assembler.isa.OperandKind;

/**
 * A machine instruction operand.
 * <p>
 * Storage operands are written {@code D(X,B)}, {@code D(,B)}, {@code D(B)} or as a bare
 * expression. The parenthesised parts are kept as written, {@code first} and {@code second};
 * their meaning depends on the operand kind.
 *
 * @param kind        The operand kind from the instruction format.
 * @param primary     The expression before any parentheses.
 * @param parenthesized {@code true} if a parenthesised part was written.
 * @param first       The first parenthesised expression, may be {@code null}.
 * @param second      The second parenthesised expression, may be {@code null}.
 */
public record MachineOperand(
        OperandKind kind,
        Resolvable primary,
        boolean parenthesized,
        Resolvable first,
        Resolvable second
) {
    public static MachineOperand simple(OperandKind kind, Resolvable primary) {
        return new MachineOperand(kind, primary, false, null, null);
    }
}
