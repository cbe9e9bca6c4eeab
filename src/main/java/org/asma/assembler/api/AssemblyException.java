package org.asma.assembler.api;

/**
 * An exception that is thrown when an assembly run cannot produce a result.
 * <p>
 * It is part of the public API and hides the internal exception types of the assembler.
 * In fail-fast mode it wraps the first statement or container error; in collect mode
 * errors are reported through {@link AssemblyResult#diagnostics()} instead.
 */
public class AssemblyException extends Exception {

    /**
     * Constructs a new assembly exception with the specified detail message.
     * @param message The detail message.
     */
    public AssemblyException(String message) {
        super(message, null);
    }

    /**
     * Constructs a new assembly exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public AssemblyException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs a new assembly exception with the specified detail message and source information.
     * @param message The detail message.
     * @param sourceInfo The source information.
     */
    public AssemblyException(String message, SourceInfo sourceInfo) {
        super(String.format("%s at %s", message, sourceInfo), null);
    }
}
