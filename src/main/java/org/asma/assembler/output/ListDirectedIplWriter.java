package org.asma.assembler.output;

import org.asma.assembler.api.AssemblyResult;
import org.asma.assembler.api.OutputFile;
import org.asma.assembler.api.RegionLayout;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes a list-directed IPL directory: one {@code <region>.bin} file per region and an
 * {@code IMAGE.ipl} control file naming each file with its load address.
 */
public class ListDirectedIplWriter implements IOutputWriter {

    /** The control file read by the IPL function. */
    public static final String CONTROL_FILE = "IMAGE.ipl";

    private final String directory;

    public ListDirectedIplWriter() {
        this("");
    }

    /**
     * @param directory The directory the files are placed in, relative to the output location; empty for none.
     */
    public ListDirectedIplWriter(String directory) {
        this.directory = directory.isEmpty() || directory.endsWith("/") ? directory : directory + "/";
    }

    @Override
    public List<OutputFile> write(AssemblyResult result) {
        List<OutputFile> files = new ArrayList<>();
        StringBuilder control = new StringBuilder();
        for (RegionLayout region : result.regions()) {
            String fileName = region.displayName() + ".bin";
            files.add(new OutputFile(directory + fileName, result.regionBytes(region)));
            control.append(String.format("%s 0x%X\n", fileName, region.address()));
        }
        files.add(new OutputFile(directory + CONTROL_FILE, control.toString().getBytes(StandardCharsets.US_ASCII)));
        return files;
    }
}
