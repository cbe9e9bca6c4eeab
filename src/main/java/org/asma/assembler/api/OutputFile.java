package org.asma.assembler.api;

/**
 * A file produced by an output writer. The assembler never writes files itself.
 *
 * @param name    The file name, without directory.
 * @param content The file content.
 */
public record OutputFile(String name, byte[] content) {
}
