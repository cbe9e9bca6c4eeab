package org.asma.assembler.api;

/**
 * Generated bytes at an absolute storage address, as loaded into the target.
 *
 * @param address The absolute address of the first byte.
 * @param data    The bytes.
 */
public record LoadedBytes(long address, byte[] data) {
}
