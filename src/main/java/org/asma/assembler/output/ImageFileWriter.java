package org.asma.assembler.output;

import org.asma.assembler.api.AssemblyResult;
import org.asma.assembler.api.OutputFile;

import java.util.List;

/**
 * Writes the raw image, all regions concatenated, to {@code <image>.bin}.
 */
public class ImageFileWriter implements IOutputWriter {

    @Override
    public List<OutputFile> write(AssemblyResult result) {
        return List.of(new OutputFile(result.imageName() + ".bin", result.image()));
    }
}
