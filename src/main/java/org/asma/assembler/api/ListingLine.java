package org.asma.assembler.api;

/**
 * One statement as printed in the listing.
 *
 * @param statement  The statement number.
 * @param source     The source line.
 * @param location   The location of the statement's content, or {@code null}.
 * @param objectCode The generated bytes, possibly empty.
 * @param error      The error message, or {@code null}.
 */
public record ListingLine(int statement, SourceInfo source, Long location, byte[] objectCode, String error) {
}
