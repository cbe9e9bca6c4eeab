package org.asma.assembler.output;

import org.asma.assembler.api.AssemblyResult;
import org.asma.assembler.api.LoadedBytes;
import org.asma.assembler.api.OutputFile;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Writes {@code STORE R S ADDR HEX} commands for a management console, or prefixed with
 * {@code CP} for a virtual machine console.
 */
public class StoreCommandWriter implements IOutputWriter {

    private static final int CHUNK_SIZE = 16;

    private final boolean virtualMachine;

    /**
     * @param virtualMachine {@code true} to issue the commands through CP.
     */
    public StoreCommandWriter(boolean virtualMachine) {
        this.virtualMachine = virtualMachine;
    }

    @Override
    public List<OutputFile> write(AssemblyResult result) {
        String prefix = virtualMachine ? "CP " : "";
        StringBuilder commands = new StringBuilder();
        for (LoadedBytes chunk : ContiguousChunks.split(result.content(), CHUNK_SIZE)) {
            commands.append(String.format("%sSTORE R S %X %s\n", prefix, chunk.address(), ContiguousChunks.hex(chunk.data())));
        }
        String extension = virtualMachine ? ".vmc" : ".mc";
        return List.of(new OutputFile(result.imageName() + extension, commands.toString().getBytes(StandardCharsets.US_ASCII)));
    }
}
