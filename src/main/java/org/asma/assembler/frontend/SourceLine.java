package org.asma.assembler.frontend;

import java.util.List;

/**
 * The fields of one free-form source line.
 *
 * @param label     The name field, {@code null} if the line starts with a blank.
 * @param operation The operation field, {@code null} for comments and blank lines.
 * @param operands  The operands, split at top-level commas.
 * @param remarks   Text after the operand field.
 */
public record SourceLine(String label, String operation, List<String> operands, String remarks) {

    public boolean isComment() {
        return operation == null;
    }
}
