package org.asma.assembler.diagnostics;

/**
 * Signals a broken internal invariant of the assembler, for example a Binary
 * appended to two containers or an absolute address being rebound.
 * <p>
 * This is never caught by the assembler and always aborts the run.
 */
public class InternalInvariantError extends Error {

    public InternalInvariantError(String message) {
        super(message);
    }
}
