package org.asma.assembler.frontend;

import org.asma.assembler.api.AssemblerErrorCode;
import org.asma.assembler.diagnostics.StatementException;
import org.asma.assembler.expr.AttributeReference;
import org.asma.assembler.expr.BinaryOperation;
import org.asma.assembler.expr.Constant;
import org.asma.assembler.expr.Expression;
import org.asma.assembler.expr.LocationReference;
import org.asma.assembler.expr.Negation;
import org.asma.assembler.expr.SymbolReference;
import org.asma.assembler.symbols.SymbolAttribute;

import java.util.List;

/**
 * Recursive-descent parser for operand expressions.
 * <pre>
 * operand := expr [ '(' [expr] [ ',' expr ] ')' ]
 * expr    := term { ('+' | '-') term }
 * term    := unary { ('*' | '/') unary }
 * unary   := ('-' | '+') unary | primary
 * primary := NUMBER | SELF_DEFINING | IDENTIFIER | ATTRIBUTE | '*' | '(' expr ')'
 * </pre>
 */
public class OperandParser {

    private final List<Token> tokens;
    private final String text;
    private int current = 0;

    private OperandParser(String text) throws StatementException {
        this.text = text;
        this.tokens = new Lexer(text).scanTokens();
    }

    /**
     * Parses a complete expression.
     *
     * @param text The operand text.
     * @return The expression.
     * @throws StatementException if the text is not a well-formed expression.
     */
    public static Expression parseExpression(String text) throws StatementException {
        OperandParser parser = new OperandParser(text);
        Expression expression = parser.expression();
        parser.expectEnd();
        return expression;
    }

    /**
     * Parses an operand that may carry a parenthesised index/base part.
     *
     * @param text The operand text.
     * @return The operand.
     * @throws StatementException if the text is malformed.
     */
    public static OperandSyntax parseOperand(String text) throws StatementException {
        OperandParser parser = new OperandParser(text);
        Expression primary = parser.expression();
        if (!parser.match(TokenType.LEFT_PAREN)) {
            parser.expectEnd();
            return new OperandSyntax(primary, false, null, null);
        }
        Expression first = null;
        Expression second = null;
        if (!parser.check(TokenType.COMMA)) {
            first = parser.expression();
        }
        if (parser.match(TokenType.COMMA)) {
            second = parser.expression();
        }
        parser.consume(TokenType.RIGHT_PAREN, "expected ')'");
        parser.expectEnd();
        if (first == null && second == null) {
            throw parser.error("empty parentheses");
        }
        return new OperandSyntax(primary, true, first, second);
    }

    private Expression expression() throws StatementException {
        Expression left = term();
        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            BinaryOperation.Operator operator = advance().type() == TokenType.PLUS
                    ? BinaryOperation.Operator.ADD : BinaryOperation.Operator.SUBTRACT;
            left = new BinaryOperation(operator, left, term());
        }
        return left;
    }

    private Expression term() throws StatementException {
        Expression left = unary();
        while (check(TokenType.STAR) || check(TokenType.SLASH)) {
            BinaryOperation.Operator operator = advance().type() == TokenType.STAR
                    ? BinaryOperation.Operator.MULTIPLY : BinaryOperation.Operator.DIVIDE;
            left = new BinaryOperation(operator, left, unary());
        }
        return left;
    }

    private Expression unary() throws StatementException {
        if (match(TokenType.MINUS)) {
            return new Negation(unary());
        }
        if (match(TokenType.PLUS)) {
            return unary();
        }
        return primary();
    }

    private Expression primary() throws StatementException {
        Token token = advance();
        switch (token.type()) {
            case NUMBER:
            case SELF_DEFINING:
                return new Constant((Long) token.value());
            case IDENTIFIER:
                return new SymbolReference(token.text());
            case ATTRIBUTE:
                return new AttributeReference((SymbolAttribute) token.value(), token.text());
            case STAR:
                return new LocationReference();
            case LEFT_PAREN: {
                Expression inner = expression();
                consume(TokenType.RIGHT_PAREN, "expected ')'");
                return inner;
            }
            default:
                throw error("unexpected '" + token.text() + "'");
        }
    }

    private boolean check(TokenType type) {
        return tokens.get(current).type() == type;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            current++;
            return true;
        }
        return false;
    }

    private Token advance() {
        Token token = tokens.get(current);
        if (token.type() != TokenType.END) {
            current++;
        }
        return token;
    }

    private void consume(TokenType type, String message) throws StatementException {
        if (!match(type)) {
            throw error(message);
        }
    }

    private void expectEnd() throws StatementException {
        if (!check(TokenType.END)) {
            throw error("unexpected '" + tokens.get(current).text() + "'");
        }
    }

    private StatementException error(String message) {
        return new StatementException(AssemblerErrorCode.SYNTAX_ERROR, message + " in operand '" + text + "'");
    }
}
