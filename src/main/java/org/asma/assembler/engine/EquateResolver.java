package org.asma.assembler.engine;

import org.asma.assembler.address.Address;
import org.asma.assembler.api.AssemblerErrorCode;
import org.asma.assembler.diagnostics.StatementException;
import org.asma.assembler.expr.ExprValue;
import org.asma.assembler.statement.Statement;
import org.asma.assembler.statement.StatementKind;
import org.asma.assembler.symbols.SymbolAttribute;
import org.asma.assembler.symbols.SymbolEntry;
import org.asma.assembler.symbols.SymbolValue;

import java.util.Optional;

/**
 * Gives an EQU symbol its value once the expression can be evaluated.
 * <p>
 * Without an explicit length the symbol takes the length of the first symbol in the
 * expression, or 1 for an expression without symbols.
 */
final class EquateResolver {

    private EquateResolver() {}

    /**
     * @return {@code true} once the symbol has a value.
     */
    static boolean tryResolve(AssemblyContext context, Statement statement, StatementKind.Equ equ) throws StatementException {
        String label = statement.label().orElseThrow(() ->
                new StatementException(AssemblerErrorCode.MISSING_LABEL, "EQU requires a name"));
        SymbolEntry entry = context.symbols().lookup(label);
        if (!entry.isPending()) {
            return true;
        }
        Optional<ExprValue> value = equ.value().tryResolve(context);
        if (value.isEmpty()) {
            return false;
        }
        Optional<Long> length = length(context, equ, value.get());
        if (length.isEmpty()) {
            return false;
        }
        long impliedLength = length.get();
        if (value.get() instanceof ExprValue.AddrValue addr) {
            Address address = addr.address().withLength((int) Math.min(Integer.MAX_VALUE, impliedLength));
            entry.setValue(new SymbolValue.AddressValue(address));
        } else {
            entry.setValue(new SymbolValue.IntegerValue(((ExprValue.IntValue) value.get()).value()));
        }
        entry.setLength(impliedLength);
        return true;
    }

    private static Optional<Long> length(AssemblyContext context, StatementKind.Equ equ, ExprValue value) throws StatementException {
        if (equ.length() != null) {
            Optional<ExprValue> explicit = equ.length().tryResolve(context);
            if (explicit.isEmpty()) {
                return Optional.empty();
            }
            if (!(explicit.get() instanceof ExprValue.IntValue intValue) || intValue.value() < 0) {
                throw new StatementException(AssemblerErrorCode.VALUE_OUT_OF_RANGE, "EQU length must be a non-negative value");
            }
            return Optional.of(intValue.value());
        }
        Optional<String> first = equ.value().expression().firstSymbol();
        if (first.isPresent()) {
            SymbolEntry symbol = context.symbols().lookup(first.get());
            if (!symbol.hasAttribute(SymbolAttribute.LENGTH)) {
                return Optional.empty();
            }
            return Optional.of(symbol.attribute(SymbolAttribute.LENGTH));
        }
        if (value instanceof ExprValue.AddrValue addr) {
            return Optional.of((long) addr.address().length());
        }
        return Optional.of(1L);
    }
}
