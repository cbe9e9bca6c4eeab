package org.asma.assembler.output;

import org.asma.assembler.api.AssemblyResult;
import org.asma.assembler.api.LoadedBytes;
import org.asma.assembler.api.OutputFile;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Writes a Hercules run-commands script that alters real storage, {@code r ADDR=HEX}
 * per line.
 */
public class RcScriptWriter implements IOutputWriter {

    /** Bytes altered by one {@code r} command. */
    public static final int DEFAULT_CHUNK_SIZE = 16;

    private final int chunkSize;

    public RcScriptWriter() {
        this(DEFAULT_CHUNK_SIZE);
    }

    public RcScriptWriter(int chunkSize) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunk size must be positive: " + chunkSize);
        }
        this.chunkSize = chunkSize;
    }

    @Override
    public List<OutputFile> write(AssemblyResult result) {
        StringBuilder script = new StringBuilder();
        for (LoadedBytes chunk : ContiguousChunks.split(result.content(), chunkSize)) {
            script.append(String.format("r %X=%s\n", chunk.address(), ContiguousChunks.hex(chunk.data())));
        }
        return List.of(new OutputFile(result.imageName() + ".rc", script.toString().getBytes(StandardCharsets.US_ASCII)));
    }
}
