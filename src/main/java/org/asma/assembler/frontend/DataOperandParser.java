package org.asma.assembler.frontend;

import org.asma.assembler.api.AssemblerErrorCode;
import org.asma.assembler.diagnostics.StatementException;
import org.asma.assembler.expr.Constant;
import org.asma.assembler.expr.Expression;
import org.asma.assembler.expr.Resolvable;
import org.asma.assembler.statement.DataOperand;
import org.asma.assembler.statement.DataType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses DC and DS operands: {@code [dup]type[Llength][nominal]}.
 * <p>
 * Duplication factor and length are decimal numbers or parenthesised expressions.
 * Address constants take their nominal values in parentheses, all other types in quotes.
 */
public final class DataOperandParser {

    private final String text;
    private int pos;

    private DataOperandParser(String text) {
        this.text = text;
    }

    /**
     * Parses one operand.
     *
     * @param text        The operand text.
     * @param reserveOnly {@code true} for DS, where the nominal value is optional.
     * @return The operand.
     * @throws StatementException if the operand is malformed.
     */
    public static DataOperand parse(String text, boolean reserveOnly) throws StatementException {
        return new DataOperandParser(text.trim()).operand(reserveOnly);
    }

    private DataOperand operand(boolean reserveOnly) throws StatementException {
        Resolvable duplication = modifier();
        DataType type = type();
        Resolvable length = null;
        if (pos < text.length() && Character.toUpperCase(text.charAt(pos)) == 'L') {
            pos++;
            length = modifier();
            if (length == null) {
                throw error("missing length after L");
            }
        }
        List<String> values = new ArrayList<>();
        List<Resolvable> expressions = new ArrayList<>();
        if (pos < text.length()) {
            if (type.nominal() == DataType.Nominal.EXPRESSION) {
                for (String operand : LineScanner.splitOperands(parenthesized())) {
                    expressions.add(new Resolvable(OperandParser.parseExpression(operand)));
                }
            } else {
                String body = quoted();
                if (type.nominal() == DataType.Nominal.STRING) {
                    values.add(body);
                } else {
                    for (String value : body.split(",", -1)) {
                        values.add(validate(type, value.trim()));
                    }
                }
            }
        }
        if (pos != text.length()) {
            throw error("unexpected text after nominal value");
        }
        if (!reserveOnly && values.isEmpty() && expressions.isEmpty()) {
            throw error("DC operand needs a nominal value");
        }
        return new DataOperand(type, duplication, length, List.copyOf(values), List.copyOf(expressions));
    }

    private Resolvable modifier() throws StatementException {
        if (pos >= text.length()) {
            return null;
        }
        if (Character.isDigit(text.charAt(pos))) {
            int start = pos;
            while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                pos++;
            }
            String digits = text.substring(start, pos);
            try {
                return new Resolvable(new Constant(Long.parseLong(digits)));
            } catch (NumberFormatException e) {
                throw new StatementException(AssemblerErrorCode.VALUE_OUT_OF_RANGE,
                        "modifier " + digits + " is too large in '" + text + "'", e);
            }
        }
        if (text.charAt(pos) == '(') {
            Expression expression = OperandParser.parseExpression(parenthesized());
            return new Resolvable(expression);
        }
        return null;
    }

    private DataType type() throws StatementException {
        if (pos >= text.length() || !Character.isLetter(text.charAt(pos))) {
            throw error("missing constant type");
        }
        String single = text.substring(pos, pos + 1).toUpperCase(Locale.ROOT);
        if (pos + 1 < text.length()) {
            String pair = text.substring(pos, pos + 2).toUpperCase(Locale.ROOT);
            if (pair.equals("FD") || pair.equals("AD")) {
                pos += 2;
                return DataType.fromCode(pair).orElseThrow();
            }
        }
        pos++;
        return DataType.fromCode(single).orElseThrow(() -> error("unsupported constant type " + single));
    }

    private String parenthesized() throws StatementException {
        int depth = 0;
        int start = pos;
        boolean quoted = false;
        for (; pos < text.length(); pos++) {
            char c = text.charAt(pos);
            if (c == '\'' && !SymbolNames.isAttributeQuote(text, pos)) {
                quoted = !quoted;
            } else if (!quoted && c == '(') {
                depth++;
            } else if (!quoted && c == ')') {
                depth--;
                if (depth == 0) {
                    pos++;
                    return text.substring(start + 1, pos - 1);
                }
            }
        }
        throw error("unbalanced parentheses");
    }

    private String quoted() throws StatementException {
        if (text.charAt(pos) != '\'') {
            throw error("nominal value must be quoted");
        }
        StringBuilder body = new StringBuilder();
        pos++;
        while (pos < text.length()) {
            char c = text.charAt(pos++);
            if (c == '\'') {
                if (pos < text.length() && text.charAt(pos) == '\'') {
                    body.append('\'');
                    pos++;
                    continue;
                }
                return body.toString();
            }
            body.append(c);
        }
        throw error("unterminated nominal value");
    }

    private String validate(DataType type, String value) throws StatementException {
        String digits = value.startsWith("+") || value.startsWith("-") ? value.substring(1) : value;
        boolean valid;
        switch (type.nominal()) {
            case HEX:
                valid = !value.isEmpty() && value.chars().allMatch(c -> Character.digit(c, 16) >= 0);
                break;
            case BINARY:
                valid = !value.isEmpty() && value.chars().allMatch(c -> c == '0' || c == '1');
                break;
            case NUMBER:
                valid = !digits.isEmpty() && digits.chars().allMatch(Character::isDigit);
                break;
            default:
                valid = true;
                break;
        }
        if (!valid) {
            throw new StatementException(AssemblerErrorCode.INVALID_CONSTANT,
                    "invalid " + type + " constant value '" + value + "'");
        }
        return value;
    }

    private StatementException error(String message) {
        return new StatementException(AssemblerErrorCode.INVALID_CONSTANT, message + " in '" + text + "'");
    }
}
