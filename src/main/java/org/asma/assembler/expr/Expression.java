package org.asma.assembler.expr;

import org.asma.assembler.diagnostics.StatementException;

import java.util.Optional;

/**
 * An operand expression.
 */
public interface Expression {

    /**
     * Attempts to evaluate the expression.
     *
     * @param context The evaluation context.
     * @return The value, or a deferral.
     * @throws StatementException if the expression is invalid regardless of when it is evaluated.
     */
    Evaluation tryEvaluate(EvaluationContext context) throws StatementException;

    /**
     * @return The leftmost symbol referenced by the expression, used for implied lengths.
     */
    default Optional<String> firstSymbol() {
        return Optional.empty();
    }
}
