package org.asma.assembler.frontend;

import org.asma.assembler.api.AssemblerErrorCode;
import org.asma.assembler.diagnostics.StatementException;
import org.asma.assembler.expr.Constant;
import org.asma.assembler.statement.DataOperand;
import org.asma.assembler.statement.DataType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class DataOperandParserTest {

    @Test
    void parsesDuplicationTypeLengthAndValues() throws Exception {
        DataOperand operand = DataOperandParser.parse("2FL3'1,-2'", false);

        assertThat(operand.type()).isEqualTo(DataType.F);
        assertThat(operand.duplication().expression()).isEqualTo(new Constant(2));
        assertThat(operand.explicitLength().expression()).isEqualTo(new Constant(3));
        assertThat(operand.values()).containsExactly("1", "-2");
        assertThat(operand.alignment()).isEqualTo(1);
    }

    @Test
    void characterConstantKeepsCommasAndDoubledQuotes() throws Exception {
        DataOperand operand = DataOperandParser.parse("C'IT''S, OK'", false);

        assertThat(operand.values()).containsExactly("IT'S, OK");
        assertThat(operand.valueCount()).isEqualTo(1);
    }

    @Test
    void doublewordTypesUseTwoLetterCodes() throws Exception {
        assertThat(DataOperandParser.parse("FD'1'", false).type()).isEqualTo(DataType.FD);
        assertThat(DataOperandParser.parse("AD(0)", false).type()).isEqualTo(DataType.AD);
        assertThat(DataOperandParser.parse("FD'1'", false).alignment()).isEqualTo(8);
    }

    @Test
    void addressConstantHoldsExpressions() throws Exception {
        DataOperand operand = DataOperandParser.parse("A(START,END-START)", false);

        assertThat(operand.expressions()).hasSize(2);
        assertThat(operand.expressions().get(1).expression()).hasToString("(END-START)");
        assertThat(operand.valueCount()).isEqualTo(2);
    }

    @Test
    void duplicationMayBeAnExpression() throws Exception {
        DataOperand operand = DataOperandParser.parse("(N*2)X'00'", false);

        assertThat(operand.duplication().expression()).hasToString("(N*2)");
    }

    @Test
    void storageReservationNeedsNoNominalValue() throws Exception {
        DataOperand operand = DataOperandParser.parse("CL80", true);

        assertThat(operand.hasNominalValue()).isFalse();
        assertThat(operand.valueCount()).isEqualTo(1);
    }

    @Test
    void constantWithoutNominalValueIsRejected() {
        assertThatThrownBy(() -> DataOperandParser.parse("F", false))
                .isInstanceOf(StatementException.class)
                .satisfies(e -> assertThat(((StatementException) e).getCode()).isEqualTo(AssemblerErrorCode.INVALID_CONSTANT));
    }

    @Test
    void invalidDigitsAreRejected() {
        assertThatThrownBy(() -> DataOperandParser.parse("X'0G'", false)).isInstanceOf(StatementException.class);
        assertThatThrownBy(() -> DataOperandParser.parse("B'102'", false)).isInstanceOf(StatementException.class);
        assertThatThrownBy(() -> DataOperandParser.parse("F'1.5'", false)).isInstanceOf(StatementException.class);
        assertThatThrownBy(() -> DataOperandParser.parse("Q'1'", false)).isInstanceOf(StatementException.class);
    }

    @Test
    void modifierBeyondLongRangeIsOutOfRange() {
        assertThatThrownBy(() -> DataOperandParser.parse("99999999999999999999F", true))
                .isInstanceOf(StatementException.class)
                .satisfies(e -> assertThat(((StatementException) e).getCode()).isEqualTo(AssemblerErrorCode.VALUE_OUT_OF_RANGE));
        assertThatThrownBy(() -> DataOperandParser.parse("CL99999999999999999999", true))
                .isInstanceOf(StatementException.class);
    }
}
