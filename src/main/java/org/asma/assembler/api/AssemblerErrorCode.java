package org.asma.assembler.api;

/**
 * Error codes attached to diagnostics and statement errors.
 */
public enum AssemblerErrorCode {

    // region Syntax
    SYNTAX_ERROR,
    UNKNOWN_OPERATION,
    INVALID_OPERAND_COUNT,
    INVALID_CONSTANT,
    // endregion

    // region Symbols
    DUPLICATE_SYMBOL,
    UNDEFINED_SYMBOL,
    MISSING_LABEL,
    // endregion

    // region Expressions and addresses
    ADDRESS_ARITHMETIC,
    UNRESOLVED_EXPRESSION,
    VALUE_OUT_OF_RANGE,
    // endregion

    // region Containers
    INVALID_CONTAINER_STATE,
    CONTAINER_ALLOCATION,
    ADDRESS_WIDTH_EXCEEDED,
    // endregion

    // region Base registers
    NO_BASE_AVAILABLE,
    INVALID_BASE_ANCHOR,
    INVALID_REGISTER,
    // endregion

    // region Instructions
    UNSUPPORTED_INSTRUCTION
    // endregion
}
