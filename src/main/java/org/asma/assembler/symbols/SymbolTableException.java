package org.asma.assembler.symbols;

import org.asma.assembler.api.AssemblerErrorCode;
import org.asma.assembler.diagnostics.StatementException;

/**
 * A duplicate definition or a reference to an undefined symbol.
 */
public class SymbolTableException extends StatementException {

    private final String symbol;

    public SymbolTableException(AssemblerErrorCode code, String symbol, String message) {
        super(code, message);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    static SymbolTableException duplicate(String name, int firstDefinition) {
        return new SymbolTableException(AssemblerErrorCode.DUPLICATE_SYMBOL, name,
                "symbol '" + name + "' already defined in statement " + firstDefinition);
    }

    static SymbolTableException undefined(String name) {
        return new SymbolTableException(AssemblerErrorCode.UNDEFINED_SYMBOL, name,
                "symbol '" + name + "' is not defined");
    }
}
