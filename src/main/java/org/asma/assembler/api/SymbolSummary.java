package org.asma.assembler.api;

import java.util.List;

/**
 * A symbol as shown in the cross reference.
 *
 * @param name       The symbol name.
 * @param kind       What the symbol names.
 * @param value      The formatted value.
 * @param length     The length attribute, 0 if unknown.
 * @param type       The type attribute.
 * @param definedAt  The defining statement number, 0 for symbols created by the assembler.
 * @param references The referencing statement numbers.
 */
public record SymbolSummary(String name, String kind, String value, long length, char type, int definedAt,
                            List<Integer> references) {
}
