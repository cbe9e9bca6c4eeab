package org.asma.assembler.expr;

import org.asma.assembler.diagnostics.StatementException;
import org.asma.assembler.symbols.SymbolAttribute;

/**
 * What an expression can ask the assembler while it is being evaluated.
 */
public interface EvaluationContext {

    /**
     * Evaluates a symbol reference and records it in the cross reference.
     *
     * @param name The symbol name.
     * @return The symbol's value, or a deferral while it has none yet.
     * @throws StatementException if the symbol is not defined.
     */
    Evaluation symbol(String name) throws StatementException;

    /**
     * Evaluates a symbol attribute reference such as {@code L'NAME}.
     *
     * @param name      The symbol name.
     * @param attribute The attribute.
     * @return The attribute value, or a deferral while it is not known.
     * @throws StatementException if the symbol is not defined.
     */
    Evaluation attribute(String name, SymbolAttribute attribute) throws StatementException;

    /**
     * Evaluates a literal operand.
     *
     * @param literal The literal occurrence.
     * @return The address of the literal, or a deferral until its pool is allocated.
     * @throws StatementException if the literal was never registered with a pool.
     */
    Evaluation literal(LiteralReference literal) throws StatementException;

    /**
     * @return The current location counter ({@code *}), or a deferral before allocation.
     */
    Evaluation location();
}
