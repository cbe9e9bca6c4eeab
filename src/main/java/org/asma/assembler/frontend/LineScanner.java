package org.asma.assembler.frontend;

import org.asma.assembler.api.AssemblerErrorCode;
import org.asma.assembler.diagnostics.StatementException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Splits a source line into name, operation, operands and remarks.
 * <p>
 * A name starts in the first column. Fields are separated by blanks; blanks inside
 * quoted strings and parentheses belong to the operand field. Lines starting with
 * {@code *} or {@code .*} are comments.
 */
public final class LineScanner {

    private LineScanner() {}

    /**
     * Splits a line.
     *
     * @param line The source line.
     * @return The fields.
     * @throws StatementException on an unterminated string or unbalanced parentheses.
     */
    public static SourceLine scan(String line) throws StatementException {
        if (line.isBlank() || line.startsWith("*") || line.startsWith(".*")) {
            return new SourceLine(null, null, List.of(), line);
        }
        int pos = 0;
        String label = null;
        if (!Character.isWhitespace(line.charAt(0))) {
            pos = nextBlank(line, 0);
            label = line.substring(0, pos);
        }
        pos = skipBlanks(line, pos);
        if (pos >= line.length()) {
            throw new StatementException(AssemblerErrorCode.SYNTAX_ERROR, "missing operation");
        }
        int opEnd = nextBlank(line, pos);
        String operation = line.substring(pos, opEnd).toUpperCase(Locale.ROOT);
        pos = skipBlanks(line, opEnd);
        int operandEnd = operandFieldEnd(line, pos);
        String operandField = line.substring(pos, operandEnd);
        String remarks = line.substring(skipBlanks(line, operandEnd));
        return new SourceLine(label, operation, splitOperands(operandField), remarks);
    }

    /**
     * Splits an operand field at commas outside strings and parentheses.
     *
     * @param field The operand field.
     * @return The operands, empty for an empty field.
     * @throws StatementException on unbalanced parentheses or quotes.
     */
    public static List<String> splitOperands(String field) throws StatementException {
        List<String> operands = new ArrayList<>();
        if (field.isEmpty()) {
            return operands;
        }
        int depth = 0;
        boolean quoted = false;
        int start = 0;
        for (int i = 0; i < field.length(); i++) {
            char c = field.charAt(i);
            if (c == '\'') {
                if (!quoted && SymbolNames.isAttributeQuote(field, i)) {
                    continue;
                }
                quoted = !quoted;
            } else if (!quoted && c == '(') {
                depth++;
            } else if (!quoted && c == ')') {
                depth--;
                if (depth < 0) {
                    throw new StatementException(AssemblerErrorCode.SYNTAX_ERROR, "unbalanced ')' in " + field);
                }
            } else if (!quoted && depth == 0 && c == ',') {
                operands.add(field.substring(start, i));
                start = i + 1;
            }
        }
        if (quoted) {
            throw new StatementException(AssemblerErrorCode.SYNTAX_ERROR, "unterminated string in " + field);
        }
        if (depth != 0) {
            throw new StatementException(AssemblerErrorCode.SYNTAX_ERROR, "unbalanced '(' in " + field);
        }
        operands.add(field.substring(start));
        return operands;
    }

    private static int operandFieldEnd(String line, int pos) {
        boolean quoted = false;
        int depth = 0;
        for (int i = pos; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '\'') {
                if (!quoted && SymbolNames.isAttributeQuote(line, i)) {
                    continue;
                }
                quoted = !quoted;
            } else if (!quoted && c == '(') {
                depth++;
            } else if (!quoted && c == ')') {
                depth--;
            } else if (!quoted && depth <= 0 && Character.isWhitespace(c)) {
                return i;
            }
        }
        return line.length();
    }

    private static int nextBlank(String line, int pos) {
        while (pos < line.length() && !Character.isWhitespace(line.charAt(pos))) {
            pos++;
        }
        return pos;
    }

    private static int skipBlanks(String line, int pos) {
        while (pos < line.length() && Character.isWhitespace(line.charAt(pos))) {
            pos++;
        }
        return pos;
    }
}
