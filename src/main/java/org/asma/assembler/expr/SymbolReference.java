package org.asma.assembler.expr;

import org.asma.assembler.diagnostics.StatementException;

import java.util.Optional;

public record SymbolReference(String name) implements Expression {

    @Override
    public Evaluation tryEvaluate(EvaluationContext context) throws StatementException {
        return context.symbol(name);
    }

    @Override
    public Optional<String> firstSymbol() {
        return Optional.of(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
