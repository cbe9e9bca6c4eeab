package org.asma.assembler.diagnostics;

import org.asma.assembler.api.AssemblerErrorCode;

/**
 * A user error confined to a single statement.
 * <p>
 * The statement is marked as errored and skipped by later phases; the rest of the run
 * continues unless the assembler is configured to fail fast.
 */
public class StatementException extends Exception {

    private final AssemblerErrorCode code;

    /**
     * @param code    The error code.
     * @param message The detail message.
     */
    public StatementException(AssemblerErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    /**
     * @param code    The error code.
     * @param message The detail message.
     * @param cause   The cause.
     */
    public StatementException(AssemblerErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public AssemblerErrorCode getCode() {
        return code;
    }
}
