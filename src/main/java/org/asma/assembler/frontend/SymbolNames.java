package org.asma.assembler.frontend;

/**
 * Character classes of assembler symbols.
 */
final class SymbolNames {

    private SymbolNames() {}

    static boolean isSymbolStart(char c) {
        return Character.isLetter(c) || c == '@' || c == '#' || c == '$' || c == '_';
    }

    static boolean isSymbolPart(char c) {
        return isSymbolStart(c) || Character.isDigit(c);
    }

    /**
     * Checks whether a quote at {@code index} follows a one-letter attribute such as {@code L'}.
     */
    static boolean isAttributeQuote(String text, int index) {
        if (index < 1 || index + 1 >= text.length()) {
            return false;
        }
        char letter = Character.toUpperCase(text.charAt(index - 1));
        if ("LSITM".indexOf(letter) < 0) {
            return false;
        }
        if (index >= 2 && isSymbolPart(text.charAt(index - 2))) {
            return false;
        }
        return isSymbolStart(text.charAt(index + 1));
    }
}
