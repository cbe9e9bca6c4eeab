package org.asma.assembler.output;

import org.asma.assembler.api.AssemblyResult;
import org.asma.assembler.api.OutputFile;

import java.util.List;

/**
 * Turns an assembly result into the content of one or more output files.
 * <p>
 * Writers never touch the file system; the caller decides where the returned files go.
 */
public interface IOutputWriter {

    /**
     * @param result The completed assembly.
     * @return The files to write, possibly empty.
     */
    List<OutputFile> write(AssemblyResult result);
}
