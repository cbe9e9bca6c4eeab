package org.asma.assembler.base;

import org.asma.assembler.api.AssemblerErrorCode;
import org.asma.assembler.diagnostics.StatementException;

/**
 * No active base register can address a location with the available displacement field.
 */
public class NoBaseAvailableException extends StatementException {

    public NoBaseAvailableException(String message) {
        super(AssemblerErrorCode.NO_BASE_AVAILABLE, message);
    }
}
