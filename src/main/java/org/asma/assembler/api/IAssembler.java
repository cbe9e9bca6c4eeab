package org.asma.assembler.api;

import java.util.List;

/**
 * The public interface of the assembler.
 */
public interface IAssembler {

    /**
     * Assembles the given source lines into a load image.
     * <p>
     * Statement errors do not abort the run unless the assembler is configured to fail fast.
     * They are returned in {@link AssemblyResult#diagnostics()} together with whatever
     * image content could be produced.
     *
     * @param sourceLines The source lines.
     * @param sourceName  The name used in diagnostics.
     * @return The assembly result.
     * @throws AssemblyException if the run has to stop (fail-fast mode, or an unusable container).
     */
    AssemblyResult assemble(List<String> sourceLines, String sourceName) throws AssemblyException;

    /**
     * Sets the verbosity of the assembler's internal logging.
     * @param level 0=ERROR, 1=WARN, 2=INFO, 3=DEBUG, 4=TRACE.
     */
    void setVerbosity(int level);
}
