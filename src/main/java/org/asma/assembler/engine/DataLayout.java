package org.asma.assembler.engine;

import org.asma.assembler.api.AssemblerErrorCode;
import org.asma.assembler.diagnostics.StatementException;
import org.asma.assembler.expr.Constant;
import org.asma.assembler.expr.EvaluationContext;
import org.asma.assembler.expr.ExprValue;
import org.asma.assembler.expr.Resolvable;
import org.asma.assembler.statement.DataEncoder;
import org.asma.assembler.statement.DataOperand;
import org.asma.assembler.statement.DataType;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Resolves duplication factors and length modifiers of DC/DS operands.
 */
final class DataLayout {

    private static final long MAX_CONSTANT_LENGTH = 65535;

    private DataLayout() {}

    /**
     * @return {@code true} if the operand's length can be computed without symbols.
     */
    static boolean isConstantLength(DataOperand operand) {
        return isConstant(operand.duplication()) && isConstant(operand.explicitLength());
    }

    private static boolean isConstant(Resolvable resolvable) {
        return resolvable == null || resolvable.expression() instanceof Constant;
    }

    /**
     * @return The total length of the operand, or empty while a modifier is deferred.
     */
    static OptionalLong totalLength(DataOperand operand, EvaluationContext context) throws StatementException {
        OptionalLong duplication = duplication(operand, context);
        OptionalLong element = elementLength(operand, context);
        if (duplication.isEmpty() || element.isEmpty()) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(DataEncoder.totalLength(operand, duplication.getAsLong(), element.getAsLong()));
    }

    static OptionalLong duplication(DataOperand operand, EvaluationContext context) throws StatementException {
        if (operand.duplication() == null) {
            return OptionalLong.of(1);
        }
        OptionalLong value = integer(operand.duplication(), context, "duplication factor");
        if (value.isPresent() && value.getAsLong() < 0) {
            throw new StatementException(AssemblerErrorCode.VALUE_OUT_OF_RANGE,
                    "negative duplication factor " + value.getAsLong());
        }
        return value;
    }

    static OptionalLong elementLength(DataOperand operand, EvaluationContext context) throws StatementException {
        if (operand.explicitLength() == null) {
            return OptionalLong.of(DataEncoder.elementLength(operand, -1));
        }
        OptionalLong value = integer(operand.explicitLength(), context, "length modifier");
        if (value.isPresent() && (value.getAsLong() < 1 || value.getAsLong() > MAX_CONSTANT_LENGTH)) {
            throw new StatementException(AssemblerErrorCode.VALUE_OUT_OF_RANGE,
                    "length modifier " + value.getAsLong() + " out of range 1.." + MAX_CONSTANT_LENGTH);
        }
        if (value.isPresent() && operand.type() == DataType.S && value.getAsLong() != DataType.S.defaultLength()) {
            throw new StatementException(AssemblerErrorCode.VALUE_OUT_OF_RANGE, "S-type constants are 2 bytes long");
        }
        return value.isPresent() ? OptionalLong.of(DataEncoder.elementLength(operand, value.getAsLong())) : value;
    }

    private static OptionalLong integer(Resolvable resolvable, EvaluationContext context, String what) throws StatementException {
        Optional<ExprValue> value = resolvable.tryResolve(context);
        if (value.isEmpty()) {
            return OptionalLong.empty();
        }
        if (!(value.get() instanceof ExprValue.IntValue intValue)) {
            throw new StatementException(AssemblerErrorCode.ADDRESS_ARITHMETIC, what + " must be an absolute value");
        }
        return OptionalLong.of(intValue.value());
    }
}
