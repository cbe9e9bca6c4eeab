package org.asma.assembler.engine;

import org.asma.assembler.api.AssemblyException;

/**
 * A phase run over the whole program.
 */
public interface IAssemblyPhase {

    /**
     * @return Which phase this is.
     */
    AssemblyPhase phase();

    /**
     * Runs the phase.
     * @throws AssemblyException if the run must stop.
     */
    void run() throws AssemblyException;
}
