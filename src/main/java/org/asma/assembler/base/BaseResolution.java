package org.asma.assembler.base;

/**
 * The result of resolving an implied address into base and displacement.
 *
 * @param register     The base register.
 * @param displacement The unsigned displacement from the register's anchor.
 */
public record BaseResolution(int register, long displacement) {}
