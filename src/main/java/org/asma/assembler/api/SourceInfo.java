package org.asma.assembler.api;

/**
 * Identifies the source line a statement came from.
 *
 * @param fileName   The name of the source file.
 * @param lineNumber The 1-based line number within the file.
 * @param text       The raw text of the line.
 */
public record SourceInfo(String fileName, int lineNumber, String text) {

    @Override
    public String toString() {
        return fileName + ":" + lineNumber;
    }
}
