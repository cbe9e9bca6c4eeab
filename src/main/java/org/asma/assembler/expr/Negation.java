package org.asma.assembler.expr;

import org.asma.assembler.api.AssemblerErrorCode;
import org.asma.assembler.diagnostics.StatementException;

import java.util.Optional;

public record Negation(Expression operand) implements Expression {

    @Override
    public Evaluation tryEvaluate(EvaluationContext context) throws StatementException {
        Evaluation evaluation = operand.tryEvaluate(context);
        if (!(evaluation instanceof Evaluation.Resolved resolved)) {
            return evaluation;
        }
        if (!(resolved.value() instanceof ExprValue.IntValue intValue)) {
            throw new StatementException(AssemblerErrorCode.ADDRESS_ARITHMETIC, "cannot negate address " + resolved.value());
        }
        return Evaluation.resolved(ExprValue.of(-intValue.value()));
    }

    @Override
    public Optional<String> firstSymbol() {
        return operand.firstSymbol();
    }

    @Override
    public String toString() {
        return "-" + operand;
    }
}
