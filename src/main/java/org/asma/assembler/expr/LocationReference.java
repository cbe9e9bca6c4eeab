package org.asma.assembler.expr;

/**
 * The location counter, written {@code *}.
 */
public record LocationReference() implements Expression {

    @Override
    public Evaluation tryEvaluate(EvaluationContext context) {
        return context.location();
    }

    @Override
    public String toString() {
        return "*";
    }
}
