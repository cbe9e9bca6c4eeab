package org.asma.assembler.statement;

/**
 * Progress of a statement through the phases. States only move forward;
 * {@link #ERRORED} is terminal.
 */
public enum StatementState {
    PARSED,
    EARLY_RESOLVED,
    ALLOCATED,
    BOUND,
    OBJECT_GENERATED,
    CONSOLIDATED,
    ERRORED
}
