package org.asma.assembler.statement;

import org.asma.assembler.address.Address;
import org.asma.assembler.api.AssemblerErrorCode;
import org.asma.assembler.api.SourceInfo;
import org.asma.assembler.content.Binary;
import org.asma.assembler.content.Section;
import org.asma.assembler.diagnostics.InternalInvariantError;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * One source statement and its resolution progress.
 */
public final class Statement {

    private final int number;
    private final SourceInfo source;
    private final String label;
    private final String operation;
    private final StatementKind kind;
    private final List<Binary> content = new ArrayList<>();
    private StatementState state = StatementState.PARSED;
    private Section section;
    private AssemblerErrorCode errorCode;
    private String error;

    /**
     * @param number    The 1-based statement number.
     * @param source    The source line.
     * @param label     The name field, {@code null} if blank.
     * @param operation The operation field, upper case, {@code null} for comments.
     * @param kind      The classified statement.
     */
    public Statement(int number, SourceInfo source, String label, String operation, StatementKind kind) {
        this.number = number;
        this.source = source;
        this.label = label;
        this.operation = operation;
        this.kind = kind;
    }

    public int number() {
        return number;
    }

    public SourceInfo source() {
        return source;
    }

    public Optional<String> label() {
        return Optional.ofNullable(label);
    }

    public String operation() {
        return operation;
    }

    public StatementKind kind() {
        return kind;
    }

    public StatementState state() {
        return state;
    }

    public boolean isIgnored() {
        return kind instanceof StatementKind.Ignored;
    }

    public boolean isErrored() {
        return state == StatementState.ERRORED;
    }

    /**
     * Moves the statement to a later state.
     * @param next The new state.
     */
    public void advance(StatementState next) {
        if (state == StatementState.ERRORED) {
            throw new InternalInvariantError("statement " + number + " is errored and cannot advance to " + next);
        }
        if (next.ordinal() < state.ordinal()) {
            throw new InternalInvariantError("statement " + number + " cannot move back from " + state + " to " + next);
        }
        state = next;
    }

    /**
     * Marks the statement as errored.
     *
     * @param code    The error code.
     * @param message The error message.
     */
    public void fail(AssemblerErrorCode code, String message) {
        if (state != StatementState.ERRORED) {
            state = StatementState.ERRORED;
            errorCode = code;
            error = message;
        }
    }

    public Optional<String> error() {
        return Optional.ofNullable(error);
    }

    public Optional<AssemblerErrorCode> errorCode() {
        return Optional.ofNullable(errorCode);
    }

    /**
     * @return The section the statement's content belongs to, or {@code null}.
     */
    public Section section() {
        return section;
    }

    public void setSection(Section owner) {
        this.section = owner;
    }

    public void addContent(Binary binary) {
        content.add(binary);
    }

    public List<Binary> content() {
        return Collections.unmodifiableList(content);
    }

    public Optional<Binary> firstContent() {
        return content.isEmpty() ? Optional.empty() : Optional.of(content.get(0));
    }

    /**
     * @return The address of the statement's first content, once allocated.
     */
    public Optional<Address> location() {
        return firstContent().filter(Binary::isAssigned).map(Binary::location);
    }

    /**
     * @return The generated bytes of all content, concatenated. Unbuilt content contributes nothing.
     */
    public byte[] objectCode() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (Binary binary : content) {
            binary.bytes().ifPresent(out::writeBytes);
        }
        return out.toByteArray();
    }

    @Override
    public String toString() {
        return number + ": " + source.text();
    }
}
