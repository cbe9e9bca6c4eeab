package org.asma.assembler.engine;

import org.asma.assembler.api.AssemblyException;
import org.asma.assembler.api.AssemblyResult;
import org.asma.assembler.api.SourceInfo;
import org.asma.assembler.config.AssemblerConfig;
import org.asma.assembler.diagnostics.AssemblerLogger;
import org.asma.assembler.frontend.StatementParser;
import org.asma.assembler.isa.IInstructionSet;
import org.asma.assembler.output.IOutputWriter;
import org.asma.assembler.statement.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Drives an assembly run through its phases.
 * <p>
 * Source lines are submitted one at a time with {@link #statement(String)}, which parses
 * them and declares their containers and symbols. {@link #assemble()} then runs the
 * remaining phases in order, each visiting every live statement in source order, and
 * returns the result. A processor assembles exactly once and is not thread-safe.
 */
public class StatementProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(StatementProcessor.class);

    private final AssemblyContext context;
    private final StatementParser parser;
    private final ParsePhase parsePhase;
    private final List<IOutputWriter> writers = new ArrayList<>();
    private int lineNumber;
    private boolean assembled;

    /**
     * @param config         The run configuration.
     * @param instructionSet The machine instructions known to the run.
     * @param sourceName     The name used in diagnostics.
     */
    public StatementProcessor(AssemblerConfig config, IInstructionSet instructionSet, String sourceName) {
        this.context = new AssemblyContext(config, instructionSet, sourceName);
        this.parser = new StatementParser(instructionSet);
        this.parsePhase = new ParsePhase(context);
    }

    /**
     * Registers a writer that receives the result once the image is complete.
     * @param writer The writer.
     */
    public void addOutputWriter(IOutputWriter writer) {
        writers.add(writer);
    }

    /**
     * Parses one source line and declares what it defines.
     *
     * @param line The source line.
     * @return The statement.
     * @throws AssemblyException if the line has an error and the run fails fast.
     */
    public Statement statement(String line) throws AssemblyException {
        if (assembled) {
            throw new IllegalStateException("statements cannot be added after assembly");
        }
        lineNumber++;
        SourceInfo source = new SourceInfo(context.sourceName(), lineNumber, line);
        Statement statement = parser.parse(lineNumber, source);
        context.addStatement(statement);
        if (statement.isErrored()) {
            context.reportFailure(statement);
        } else {
            parsePhase.process(statement);
        }
        AssemblerLogger.trace("parsed " + statement);
        return statement;
    }

    /**
     * Runs every phase after parsing and builds the result.
     *
     * @return The assembly result, including the diagnostics of a collect-and-continue run.
     * @throws AssemblyException if an error occurs and the run fails fast.
     */
    public AssemblyResult assemble() throws AssemblyException {
        if (assembled) {
            throw new IllegalStateException("assemble() may only be called once");
        }
        if (context.literals().hasPending()) {
            // literals referenced after the last pool and no END to place them
            LOG.debug("{}: placing pending literals in an implicit LTORG", context.sourceName());
            statement("         LTORG");
        }
        assembled = true;
        context.setCurrent(null);

        // Phase 2 and 3: resolve what can be resolved before layout
        run(new EarlyResolvePhase(context, false));
        run(new EarlyResolvePhase(context, true));

        // Phase 4: position content in sections
        run(new AllocatePhase(context));

        // Phase 5: place sections in regions, absolute addresses
        run(new BindPhase(context));

        // Phase 6: instructions and constants
        run(new ObjectGenerationPhase(context));

        // Phase 7: build the image
        run(new ConsolidatePhase(context));

        // Phase 8: result and output files
        FinishPhase finish = new FinishPhase(context, List.copyOf(writers));
        run(finish);

        AssemblyResult result = finish.result();
        if (result.hasErrors()) {
            LOG.info("{}: assembled with {} error(s)", context.sourceName(), context.diagnostics().errorCount());
        } else {
            LOG.info("{}: assembled {} statements into {} bytes", context.sourceName(),
                    context.statements().size(), result.image().length);
        }
        return result;
    }

    /**
     * @return The run's state, for inspection after or during assembly.
     */
    public AssemblyContext context() {
        return context;
    }

    private void run(IAssemblyPhase phase) throws AssemblyException {
        context.setPhase(phase.phase());
        AssemblerLogger.debug("phase " + phase.phase());
        LOG.debug("{}: running phase {}", context.sourceName(), phase.phase());
        phase.run();
    }
}
