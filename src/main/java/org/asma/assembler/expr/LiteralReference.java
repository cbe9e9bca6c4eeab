package org.asma.assembler.expr;

import org.asma.assembler.diagnostics.StatementException;

/**
 * A literal operand such as {@code =F'1'}, evaluating to the address of its copy in a
 * literal pool. Each occurrence is a distinct reference; references with the same text
 * share storage when they fall into the same pool.
 *
 * @param text The literal including the leading equal sign.
 */
public record LiteralReference(String text) implements Expression {

    @Override
    public Evaluation tryEvaluate(EvaluationContext context) throws StatementException {
        return context.literal(this);
    }

    /**
     * @return The constant after the equal sign, in DC operand syntax.
     */
    public String constant() {
        return text.substring(1);
    }

    @Override
    public String toString() {
        return text;
    }
}
