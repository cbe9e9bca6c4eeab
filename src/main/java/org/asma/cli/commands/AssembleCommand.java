package org.asma.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.asma.assembler.Assembler;
import org.asma.assembler.api.AssemblyException;
import org.asma.assembler.api.AssemblyResult;
import org.asma.assembler.api.OutputFile;
import org.asma.assembler.config.AssemblerConfig;
import org.asma.assembler.diagnostics.Diagnostic;
import org.asma.assembler.isa.Architecture;
import org.asma.assembler.output.ImageFileWriter;
import org.asma.assembler.output.JsonSummaryWriter;
import org.asma.assembler.output.ListDirectedIplWriter;
import org.asma.assembler.output.ListingWriter;
import org.asma.assembler.output.RcScriptWriter;
import org.asma.assembler.output.StoreCommandWriter;
import org.asma.cli.CommandLineInterface;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "assemble", description = "Assembles a source file into a load image.")
public class AssembleCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(AssembleCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Parameters(index = "0", description = "The assembler source file.")
    private File source;

    @Option(names = {"-o", "--output-dir"}, description = "Directory receiving the output files (default: current directory).")
    private File outputDir = new File(".");

    @Option(names = "--image", description = "Write the raw image file <image>.bin.")
    private boolean image;

    @Option(names = "--rc", description = "Write a Hercules run-commands script <image>.rc.")
    private boolean rcScript;

    @Option(names = "--mc", description = "Write management console STORE commands <image>.mc.")
    private boolean storeCommands;

    @Option(names = "--vmc", description = "Write virtual machine CP STORE commands <image>.vmc.")
    private boolean vmStoreCommands;

    @Option(names = "--ldipl", paramLabel = "DIR", description = "Write a list-directed IPL directory.")
    private String ldiplDirectory;

    @Option(names = "--listing", description = "Write the assembly listing <image>.lst.")
    private boolean listing;

    @Option(names = "--json", description = "Write a JSON summary of the image <image>.json.")
    private boolean json;

    @Option(names = "--arch", description = "Target architecture: ${COMPLETION-CANDIDATES}.")
    private Architecture architecture;

    @Option(names = "--image-name", description = "Name of the image symbol and output files.")
    private String imageName;

    @Option(names = "--case-sensitive", description = "Keep symbol names as written.")
    private boolean caseSensitive;

    @Option(names = "--fail-fast", description = "Stop at the first error.")
    private boolean failFast;

    @Option(names = {"-v", "--verbosity"}, description = "Assembler log verbosity 0-4 (0=ERROR ... 4=TRACE).")
    private int verbosity = -1;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        AssemblerConfig assemblerConfig;
        int rcChunkSize;
        try {
            Config config = parent.getConfig();
            assemblerConfig = applyOptions(AssemblerConfig.fromConfig(config));
            rcChunkSize = config.hasPath("asma.output.rc-chunk-size")
                    ? config.getInt("asma.output.rc-chunk-size") : RcScriptWriter.DEFAULT_CHUNK_SIZE;
        } catch (ConfigException | IllegalArgumentException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return CommandLineInterface.EXIT_USAGE;
        }

        List<String> lines;
        try {
            lines = Files.readAllLines(source.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Cannot read " + source + ": " + e.getMessage());
            return CommandLineInterface.EXIT_USAGE;
        }

        Assembler assembler = new Assembler(assemblerConfig);
        assembler.setVerbosity(verbosity);
        registerWriters(assembler, rcChunkSize);

        AssemblyResult result;
        try {
            result = assembler.assemble(lines, source.getName());
        } catch (AssemblyException e) {
            err.println("Assembly failed: " + e.getMessage());
            return 1;
        }

        for (Diagnostic diagnostic : result.diagnostics()) {
            err.println(diagnostic);
        }
        try {
            for (OutputFile file : result.outputs()) {
                Path target = outputDir.toPath().resolve(file.name());
                if (target.getParent() != null) {
                    Files.createDirectories(target.getParent());
                }
                Files.write(target, file.content());
                LOGGER.info("Wrote {} ({} bytes)", target, file.content().length);
            }
        } catch (IOException e) {
            err.println("Cannot write output: " + e.getMessage());
            return CommandLineInterface.EXIT_USAGE;
        }

        out.printf("%s: %d bytes, load address %X, entry %X%n",
                result.imageName(), result.image().length, result.loadAddress(), result.entryAddress());
        return result.hasErrors() ? 1 : 0;
    }

    private AssemblerConfig applyOptions(AssemblerConfig config) {
        AssemblerConfig result = config;
        if (architecture != null) {
            result = result.withArchitecture(architecture);
        }
        if (caseSensitive) {
            result = result.withCaseSensitive(true);
        }
        if (failFast) {
            result = result.withFailFast(true);
        }
        if (imageName != null) {
            result = new AssemblerConfig(result.architecture(), result.addressingMode(), result.caseSensitive(),
                    result.maxAddressBits(), result.failFast(), imageName);
        }
        return result;
    }

    private void registerWriters(Assembler assembler, int rcChunkSize) {
        boolean any = rcScript || storeCommands || vmStoreCommands || ldiplDirectory != null || listing || json;
        if (image || !any) {
            assembler.addOutputWriter(new ImageFileWriter());
        }
        if (rcScript) {
            assembler.addOutputWriter(new RcScriptWriter(rcChunkSize));
        }
        if (storeCommands) {
            assembler.addOutputWriter(new StoreCommandWriter(false));
        }
        if (vmStoreCommands) {
            assembler.addOutputWriter(new StoreCommandWriter(true));
        }
        if (ldiplDirectory != null) {
            assembler.addOutputWriter(new ListDirectedIplWriter(ldiplDirectory));
        }
        if (listing) {
            assembler.addOutputWriter(new ListingWriter());
        }
        if (json) {
            assembler.addOutputWriter(new JsonSummaryWriter());
        }
    }
}
