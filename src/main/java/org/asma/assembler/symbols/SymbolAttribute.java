package org.asma.assembler.symbols;

import java.util.Optional;

/**
 * The attributes a symbol carries, addressable in expressions as {@code X'NAME}.
 */
public enum SymbolAttribute {
    /** Implied length in bytes. */
    LENGTH('L'),
    /** Scale of a numeric constant. */
    SCALE('S'),
    /** Integer attribute of a numeric constant. */
    INTEGER('I'),
    /** One-letter type code. */
    TYPE('T'),
    /** Displacement of the symbol's location from the start of the image. */
    IMAGE_DISPLACEMENT('M');

    private final char letter;

    SymbolAttribute(char letter) {
        this.letter = letter;
    }

    public char letter() {
        return letter;
    }

    public static Optional<SymbolAttribute> fromLetter(char letter) {
        char upper = Character.toUpperCase(letter);
        for (SymbolAttribute attribute : values()) {
            if (attribute.letter == upper) {
                return Optional.of(attribute);
            }
        }
        return Optional.empty();
    }
}
