package org.asma.assembler.content;

import org.asma.assembler.api.AssemblerErrorCode;

/**
 * Raised when a section can no longer be laid out, for example when the length of a
 * storage reservation or the target of an ORG cannot be determined.
 * <p>
 * Every address after the failing statement in the same section is unreliable, so the
 * section is excluded from the image. Other sections are unaffected.
 */
public class ContainerAllocationException extends Exception {

    private final AssemblerErrorCode code;

    public ContainerAllocationException(String message) {
        this(AssemblerErrorCode.CONTAINER_ALLOCATION, message);
    }

    public ContainerAllocationException(AssemblerErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public AssemblerErrorCode getCode() {
        return code;
    }
}
