package org.asma.assembler.engine;

import org.asma.assembler.content.Content;
import org.asma.assembler.content.Image;
import org.asma.assembler.statement.Statement;
import org.asma.assembler.statement.StatementState;

/**
 * Copies the bytes of every built Binary into the image, bottom-up through sections
 * and regions.
 */
final class ConsolidatePhase implements IAssemblyPhase {

    private final AssemblyContext context;

    ConsolidatePhase(AssemblyContext context) {
        this.context = context;
    }

    @Override
    public AssemblyPhase phase() {
        return AssemblyPhase.CONSOLIDATE;
    }

    @Override
    public void run() {
        Image image = context.arena().image();
        if (image.length() > Content.MAX_LENGTH) {
            // reported while binding
            context.setImageBytes(new byte[0]);
            image.freeze();
            return;
        }
        context.setImageBytes(image.insert());
        image.freeze();
        for (Statement statement : context.statements()) {
            if (!statement.isIgnored() && !statement.isErrored()) {
                statement.advance(StatementState.CONSOLIDATED);
            }
        }
    }
}
