package org.asma.assembler.statement;

import org.asma.assembler.api.AssemblerErrorCode;
import org.asma.assembler.diagnostics.StatementException;
import org.asma.assembler.frontend.DataOperandParser;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class DataEncoderTest {

    private static byte[] encode(String text, long duplication, long explicitLength) throws StatementException {
        DataOperand operand = DataOperandParser.parse(text, false);
        long length = DataEncoder.elementLength(operand, explicitLength);
        return DataEncoder.encode(operand, duplication, length, List.of());
    }

    @Test
    void impliedLengthFollowsNominalValue() throws Exception {
        assertThat(DataEncoder.elementLength(DataOperandParser.parse("C'ABC'", false), -1)).isEqualTo(3);
        assertThat(DataEncoder.elementLength(DataOperandParser.parse("X'ABC'", false), -1)).isEqualTo(2);
        assertThat(DataEncoder.elementLength(DataOperandParser.parse("B'101010101'", false), -1)).isEqualTo(2);
        assertThat(DataEncoder.elementLength(DataOperandParser.parse("H'7'", false), -1)).isEqualTo(2);
        assertThat(DataEncoder.elementLength(DataOperandParser.parse("C", true), -1)).isEqualTo(1);
    }

    @Test
    void fullwordsAreBigEndianTwosComplement() throws Exception {
        assertThat(encode("F'1,-1'", 1, -1)).containsExactly(0, 0, 0, 1, 0xFF, 0xFF, 0xFF, 0xFF);
    }

    @Test
    void characterConstantsAreEbcdicPaddedWithBlanks() throws Exception {
        assertThat(encode("C'AB'", 1, 4)).containsExactly(0xC1, 0xC2, 0x40, 0x40);
        assertThat(encode("C'ABCD'", 1, 2)).containsExactly(0xC1, 0xC2);
    }

    @Test
    void hexConstantsArePaddedAndTruncatedOnTheLeft() throws Exception {
        assertThat(encode("X'ABC'", 1, -1)).containsExactly(0x0A, 0xBC);
        assertThat(encode("X'123456'", 1, 2)).containsExactly(0x34, 0x56);
    }

    @Test
    void duplicationRepeatsAllValues() throws Exception {
        assertThat(encode("X'01,02'", 3, -1)).containsExactly(1, 2, 1, 2, 1, 2);
    }

    @Test
    void addressConstantsUseResolvedValues() throws Exception {
        DataOperand operand = DataOperandParser.parse("A(X,Y)", false);

        byte[] bytes = DataEncoder.encode(operand, 1, 4, List.of(0x1000L, 0x2004L));

        assertThat(bytes).containsExactly(0, 0, 0x10, 0, 0, 0, 0x20, 0x04);
    }

    @Test
    void valueThatDoesNotFitIsRejected() {
        assertThatThrownBy(() -> encode("H'70000'", 1, -1))
                .isInstanceOf(StatementException.class)
                .satisfies(e -> assertThat(((StatementException) e).getCode()).isEqualTo(AssemblerErrorCode.VALUE_OUT_OF_RANGE));
    }

    @Test
    void totalLengthMultipliesDuplicationValuesAndLength() throws Exception {
        DataOperand operand = DataOperandParser.parse("H'1,2,3'", false);

        assertThat(DataEncoder.totalLength(operand, 4, 2)).isEqualTo(24);
    }

    @Test
    void totalLengthRejectsOverflowAndOversizedOperands() throws Exception {
        DataOperand operand = DataOperandParser.parse("F", true);

        assertThatThrownBy(() -> DataEncoder.totalLength(operand, 4611686018427387904L, 4))
                .isInstanceOf(StatementException.class)
                .satisfies(e -> assertThat(((StatementException) e).getCode()).isEqualTo(AssemblerErrorCode.VALUE_OUT_OF_RANGE));
        assertThatThrownBy(() -> DataEncoder.totalLength(operand, 600_000_000L, 4))
                .isInstanceOf(StatementException.class)
                .satisfies(e -> assertThat(((StatementException) e).getCode()).isEqualTo(AssemblerErrorCode.VALUE_OUT_OF_RANGE));
        assertThat(DataEncoder.totalLength(operand, DataEncoder.MAX_OPERAND_LENGTH, 1)).isEqualTo(DataEncoder.MAX_OPERAND_LENGTH);
    }
}
