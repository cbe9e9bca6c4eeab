package org.asma.assembler.diagnostics;

import org.asma.assembler.api.AssemblerErrorCode;
import org.asma.assembler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting and managing diagnostic messages (errors, warnings)
 * that occur during an assembly run.
 * <p>
 * This decouples error reporting from the phases that detect the errors.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error tied to a statement.
     *
     * @param code            The error code.
     * @param message         The error message.
     * @param source          The source line of the statement.
     * @param statementNumber The statement number.
     */
    public void reportError(AssemblerErrorCode code, String message, SourceInfo source, int statementNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, code, message,
                source.fileName(), source.lineNumber(), statementNumber));
    }

    /**
     * Reports an error that is not tied to a single statement.
     *
     * @param code     The error code.
     * @param message  The error message.
     * @param fileName The file in which the error occurred.
     */
    public void reportError(AssemblerErrorCode code, String message, String fileName) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, code, message, fileName, 0, 0));
    }

    /**
     * Reports a warning.
     *
     * @param message         The warning message.
     * @param source          The source line of the statement.
     * @param statementNumber The statement number.
     */
    public void reportWarning(String message, SourceInfo source, int statementNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, null, message,
                source.fileName(), source.lineNumber(), statementNumber));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns the number of reported errors.
     * @return The error count.
     */
    public long errorCount() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).count();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
