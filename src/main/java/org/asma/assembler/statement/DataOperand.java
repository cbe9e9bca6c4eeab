package org.asma.assembler.statement;

import org.asma.assembler.expr.Resolvable;

import java.util.List;

/**
 * One operand of a DC or DS statement, e.g. {@code 2FL3'1,2'} or {@code A(START,END)}.
 *
 * @param type           The constant type.
 * @param duplication    The duplication factor, {@code null} for 1.
 * @param explicitLength The length modifier, {@code null} for the implied length.
 * @param values         The nominal values as written; character constants hold one string.
 * @param expressions    The nominal expressions of address constants.
 */
public record DataOperand(
        DataType type,
        Resolvable duplication,
        Resolvable explicitLength,
        List<String> values,
        List<Resolvable> expressions
) {
    /**
     * @return The number of nominal values; a DS without nominal value counts one.
     */
    public int valueCount() {
        int count = type.nominal() == DataType.Nominal.EXPRESSION ? expressions.size() : values.size();
        return Math.max(1, count);
    }

    /**
     * @return The alignment of the operand. An explicit length suppresses alignment.
     */
    public int alignment() {
        return explicitLength == null ? type.alignment() : 1;
    }

    public boolean hasNominalValue() {
        return !values.isEmpty() || !expressions.isEmpty();
    }
}
