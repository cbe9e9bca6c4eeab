package org.asma.assembler.diagnostics;

import org.asma.assembler.api.AssemblerErrorCode;

/**
 * Represents a single diagnostic message (error, warning, info)
 * that occurs during an assembly run.
 *
 * @param type            The type of the diagnostic (e.g., ERROR, WARNING).
 * @param code            The error code, or {@code null} for informational messages.
 * @param message         The diagnostic message.
 * @param fileName        The name of the file where the issue occurred.
 * @param lineNumber      The line number of the issue.
 * @param statementNumber The number of the statement the issue belongs to, or 0 for the whole run.
 */
public record Diagnostic(
        Type type,
        AssemblerErrorCode code,
        String message,
        String fileName,
        int lineNumber,
        int statementNumber
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that marks a statement or section as failed. */
        ERROR,
        /** A warning that does not affect the image. */
        WARNING,
        /** An informational message. */
        INFO
    }

    @Override
    public String toString() {
        if (code == null) {
            return String.format("[%s] %s:%d: %s", type, fileName, lineNumber, message);
        }
        return String.format("[%s] %s:%d: %s (%s)", type, fileName, lineNumber, message, code);
    }
}
