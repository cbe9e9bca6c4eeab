package org.asma.assembler;

import org.asma.assembler.api.AssemblyException;
import org.asma.assembler.api.AssemblyResult;
import org.asma.assembler.api.IAssembler;
import org.asma.assembler.config.AssemblerConfig;
import org.asma.assembler.diagnostics.AssemblerLogger;
import org.asma.assembler.engine.StatementProcessor;
import org.asma.assembler.isa.ConfiguredInstructionSet;
import org.asma.assembler.isa.IInstructionSet;
import org.asma.assembler.output.IOutputWriter;

import java.util.ArrayList;
import java.util.List;

/**
 * The main assembler implementation. Every call to {@link #assemble(List, String)}
 * runs a fresh {@link StatementProcessor}; instances are not thread-safe.
 */
public class Assembler implements IAssembler {

    private final AssemblerConfig config;
    private final IInstructionSet instructionSet;
    private final List<IOutputWriter> writers = new ArrayList<>();
    private int verbosity = -1;

    public Assembler() {
        this(AssemblerConfig.defaults());
    }

    public Assembler(AssemblerConfig config) {
        this(config, ConfiguredInstructionSet.load(config.architecture()));
    }

    /**
     * @param config         The run configuration.
     * @param instructionSet The instructions to accept.
     */
    public Assembler(AssemblerConfig config, IInstructionSet instructionSet) {
        this.config = config;
        this.instructionSet = instructionSet;
    }

    /**
     * Registers a writer that receives every result.
     * @param writer The writer.
     * @return This assembler.
     */
    public Assembler addOutputWriter(IOutputWriter writer) {
        writers.add(writer);
        return this;
    }

    @Override
    public AssemblyResult assemble(List<String> sourceLines, String sourceName) throws AssemblyException {
        if (verbosity >= 0) {
            AssemblerLogger.setLevel(verbosity);
        }
        AssemblerLogger.info("Assembler: " + sourceName + " for " + config.architecture());

        StatementProcessor processor = new StatementProcessor(config, instructionSet, sourceName);
        writers.forEach(processor::addOutputWriter);

        // Phase 1: parse and declare, one line at a time
        for (String line : sourceLines) {
            processor.statement(line);
        }
        return processor.assemble();
    }

    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }

    public AssemblerConfig config() {
        return config;
    }
}
