package org.asma.assembler.expr;

import org.asma.assembler.diagnostics.StatementException;
import org.asma.assembler.symbols.SymbolAttribute;

/**
 * A symbol attribute such as {@code L'BUFFER}.
 */
public record AttributeReference(SymbolAttribute attribute, String name) implements Expression {

    @Override
    public Evaluation tryEvaluate(EvaluationContext context) throws StatementException {
        return context.attribute(name, attribute);
    }

    @Override
    public String toString() {
        return attribute.letter() + "'" + name;
    }
}
