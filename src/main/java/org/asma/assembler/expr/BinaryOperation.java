package org.asma.assembler.expr;

import org.asma.assembler.address.Address;
import org.asma.assembler.address.AddressException;
import org.asma.assembler.api.AssemblerErrorCode;
import org.asma.assembler.diagnostics.StatementException;

import java.util.Optional;

/**
 * An arithmetic expression with two operands.
 * <p>
 * Addresses may be displaced by integers and subtracted from addresses of the same
 * section. Multiplication and division take integers only; division by zero yields zero.
 */
public record BinaryOperation(Operator operator, Expression left, Expression right) implements Expression {

    public enum Operator {
        ADD('+'),
        SUBTRACT('-'),
        MULTIPLY('*'),
        DIVIDE('/');

        private final char symbol;

        Operator(char symbol) {
            this.symbol = symbol;
        }

        public char symbol() {
            return symbol;
        }
    }

    @Override
    public Evaluation tryEvaluate(EvaluationContext context) throws StatementException {
        Evaluation lhs = left.tryEvaluate(context);
        if (lhs instanceof Evaluation.Deferred) {
            return lhs;
        }
        Evaluation rhs = right.tryEvaluate(context);
        if (rhs instanceof Evaluation.Deferred) {
            return rhs;
        }
        ExprValue a = ((Evaluation.Resolved) lhs).value();
        ExprValue b = ((Evaluation.Resolved) rhs).value();
        try {
            return Evaluation.resolved(apply(a, b));
        } catch (AddressException e) {
            throw new StatementException(AssemblerErrorCode.ADDRESS_ARITHMETIC, e.getMessage(), e);
        }
    }

    private ExprValue apply(ExprValue a, ExprValue b) throws StatementException {
        if (a instanceof ExprValue.IntValue x && b instanceof ExprValue.IntValue y) {
            return ExprValue.of(integerResult(x.value(), y.value()));
        }
        switch (operator) {
            case ADD:
                return add(a, b);
            case SUBTRACT:
                return subtract(a, b);
            default:
                throw new StatementException(AssemblerErrorCode.ADDRESS_ARITHMETIC,
                        "operator '" + operator.symbol() + "' is not defined for addresses");
        }
    }

    private long integerResult(long x, long y) {
        switch (operator) {
            case ADD: return x + y;
            case SUBTRACT: return x - y;
            case MULTIPLY: return x * y;
            case DIVIDE: return y == 0 ? 0 : x / y;
            default: throw new IllegalStateException("Unknown operator " + operator);
        }
    }

    private static ExprValue add(ExprValue a, ExprValue b) {
        if (a instanceof ExprValue.AddrValue x && b instanceof ExprValue.IntValue y) {
            return ExprValue.of(x.address().plus(y.value()));
        }
        if (a instanceof ExprValue.IntValue x && b instanceof ExprValue.AddrValue y) {
            return ExprValue.of(y.address().plus(x.value()));
        }
        Address x = ((ExprValue.AddrValue) a).address();
        Address y = ((ExprValue.AddrValue) b).address();
        return ExprValue.of(x.plus(y));
    }

    private static ExprValue subtract(ExprValue a, ExprValue b) throws StatementException {
        if (a instanceof ExprValue.AddrValue x && b instanceof ExprValue.IntValue y) {
            return ExprValue.of(x.address().minus(y.value()));
        }
        if (a instanceof ExprValue.AddrValue x && b instanceof ExprValue.AddrValue y) {
            return ExprValue.of(x.address().distance(y.address()));
        }
        throw new StatementException(AssemblerErrorCode.ADDRESS_ARITHMETIC,
                "cannot subtract an address from an absolute value");
    }

    @Override
    public Optional<String> firstSymbol() {
        Optional<String> first = left.firstSymbol();
        return first.isPresent() ? first : right.firstSymbol();
    }

    @Override
    public String toString() {
        return "(" + left + operator.symbol() + right + ")";
    }
}
