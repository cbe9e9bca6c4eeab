package org.asma.assembler.symbols;

/**
 * What a symbol names.
 */
public enum SymbolKind {
    CSECT,
    DSECT,
    REGION,
    IMAGE,
    /** A statement label. */
    LABEL,
    /** A name defined by EQU. */
    EQUATE
}
