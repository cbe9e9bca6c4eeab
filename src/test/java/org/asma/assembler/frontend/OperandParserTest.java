package org.asma.assembler.frontend;

import org.asma.assembler.diagnostics.StatementException;
import org.asma.assembler.expr.AttributeReference;
import org.asma.assembler.expr.Constant;
import org.asma.assembler.expr.Expression;
import org.asma.assembler.expr.LocationReference;
import org.asma.assembler.expr.SymbolReference;
import org.asma.assembler.symbols.SymbolAttribute;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class OperandParserTest {

    @Test
    void multiplicationBindsTighterThanAddition() throws Exception {
        Expression expression = OperandParser.parseExpression("A+2*3");

        assertThat(expression).hasToString("(A+(2*3))");
    }

    @Test
    void parenthesesAndUnaryMinus() throws Exception {
        Expression expression = OperandParser.parseExpression("-(B-C)/2");

        assertThat(expression).hasToString("(-(B-C)/2)");
    }

    @Test
    void starIsLocationCounterInOperandPosition() throws Exception {
        Expression expression = OperandParser.parseExpression("*");

        assertThat(expression).isEqualTo(new LocationReference());
        assertThat(OperandParser.parseExpression("*+8")).hasToString("(*+8)");
    }

    @Test
    void primariesMapToExpressionNodes() throws Exception {
        assertThat(OperandParser.parseExpression("X'10'")).isEqualTo(new Constant(16));
        assertThat(OperandParser.parseExpression("NAME")).isEqualTo(new SymbolReference("NAME"));
        assertThat(OperandParser.parseExpression("L'NAME"))
                .isEqualTo(new AttributeReference(SymbolAttribute.LENGTH, "NAME"));
    }

    @Test
    void operandWithIndexAndBase() throws Exception {
        OperandSyntax operand = OperandParser.parseOperand("8(4,12)");

        assertThat(operand.parenthesized()).isTrue();
        assertThat(operand.primary()).isEqualTo(new Constant(8));
        assertThat(operand.first()).isEqualTo(new Constant(4));
        assertThat(operand.second()).isEqualTo(new Constant(12));
    }

    @Test
    void operandWithOmittedIndex() throws Exception {
        OperandSyntax operand = OperandParser.parseOperand("FIELD(,12)");

        assertThat(operand.first()).isNull();
        assertThat(operand.second()).isEqualTo(new Constant(12));
    }

    @Test
    void operandWithoutParentheses() throws Exception {
        OperandSyntax operand = OperandParser.parseOperand("FIELD+4");

        assertThat(operand.parenthesized()).isFalse();
        assertThat(operand.first()).isNull();
    }

    @Test
    void malformedOperandsAreRejected() {
        assertThatThrownBy(() -> OperandParser.parseOperand("4()")).isInstanceOf(StatementException.class);
        assertThatThrownBy(() -> OperandParser.parseExpression("A+")).isInstanceOf(StatementException.class);
        assertThatThrownBy(() -> OperandParser.parseExpression("A B")).isInstanceOf(StatementException.class);
    }
}
