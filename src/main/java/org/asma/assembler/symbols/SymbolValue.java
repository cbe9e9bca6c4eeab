package org.asma.assembler.symbols;

import org.asma.assembler.address.Address;
import org.asma.assembler.address.SectionHandle;

/**
 * The value bound to a symbol.
 */
public sealed interface SymbolValue
        permits SymbolValue.SectionRef, SymbolValue.RegionRef, SymbolValue.ImageRef,
                SymbolValue.AddressValue, SymbolValue.IntegerValue, SymbolValue.Pending {

    /** A CSECT or DSECT name. */
    record SectionRef(SectionHandle section) implements SymbolValue {}

    /** A region name, by its index in the image. */
    record RegionRef(int index) implements SymbolValue {}

    /** The image symbol. */
    record ImageRef() implements SymbolValue {}

    /** A location. */
    record AddressValue(Address address) implements SymbolValue {}

    /** An absolute integer, such as an equated register number. */
    record IntegerValue(long value) implements SymbolValue {}

    /** Declared, but not positioned or evaluated yet. */
    record Pending(String reason) implements SymbolValue {}
}
