package org.asma.assembler.expr;

/**
 * A self-defining term.
 */
public record Constant(long value) implements Expression {

    @Override
    public Evaluation tryEvaluate(EvaluationContext context) {
        return Evaluation.resolved(ExprValue.of(value));
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
