package org.asma.assembler.address;

/**
 * Raised by address arithmetic that is not defined, such as subtracting addresses
 * from different sections or producing a negative address.
 */
public class AddressException extends RuntimeException {

    public AddressException(String message) {
        super(message);
    }
}
