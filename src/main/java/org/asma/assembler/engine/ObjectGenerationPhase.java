package org.asma.assembler.engine;

import org.asma.assembler.address.Address;
import org.asma.assembler.address.AddressException;
import org.asma.assembler.api.AssemblerErrorCode;
import org.asma.assembler.api.AssemblyException;
import org.asma.assembler.base.BaseResolution;
import org.asma.assembler.content.Binary;
import org.asma.assembler.diagnostics.StatementException;
import org.asma.assembler.expr.ExprValue;
import org.asma.assembler.expr.Resolvable;
import org.asma.assembler.isa.InstructionEncoder;
import org.asma.assembler.isa.InstructionInfo;
import org.asma.assembler.isa.OperandKind;
import org.asma.assembler.isa.ResolvedOperand;
import org.asma.assembler.statement.ControlWordEncoder;
import org.asma.assembler.statement.DataEncoder;
import org.asma.assembler.statement.DataOperand;
import org.asma.assembler.statement.DataType;
import org.asma.assembler.statement.MachineOperand;
import org.asma.assembler.statement.Statement;
import org.asma.assembler.statement.StatementKind;
import org.asma.assembler.statement.StatementState;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Encodes machine instructions, DC constants, channel command and program status words,
 * CNOP padding and literal pools into their Binary objects.
 * <p>
 * Statements are visited in source order so that USING and DROP take effect for the
 * statements that follow them. ENTRY and END set the entry point.
 */
final class ObjectGenerationPhase extends StatementPhase {

    /** Each further register of a USING covers the next 4K. */
    private static final long USING_RANGE = 4096;

    /** CNOP pads with BCR 0,0. */
    private static final byte NOP_OPCODE = 0x07;

    ObjectGenerationPhase(AssemblyContext context) {
        super(context);
    }

    @Override
    public AssemblyPhase phase() {
        return AssemblyPhase.OBJECT_GENERATE;
    }

    @Override
    protected StatementState targetState() {
        return StatementState.OBJECT_GENERATED;
    }

    @Override
    protected void beforeStatements() {
        context.bases().dropAll();
        context.locationCounter().clear();
    }

    @Override
    protected void process(Statement statement) throws AssemblyException {
        if (statement.isIgnored() || statement.isErrored()) {
            return;
        }
        Optional<Address> location = statement.location();
        if (location.isPresent()) {
            context.locationCounter().establish(location.get());
        }
        dispatch(statement);
    }

    @Override
    public void visitStart(Statement statement, StatementKind.Start kind) {
    }

    @Override
    public void visitCsect(Statement statement, StatementKind.Csect kind) {
    }

    @Override
    public void visitDsect(Statement statement, StatementKind.Dsect kind) {
    }

    @Override
    public void visitRegion(Statement statement, StatementKind.Region kind) {
    }

    @Override
    public void visitOrg(Statement statement, StatementKind.Org kind) {
    }

    @Override
    public void visitData(Statement statement, StatementKind.Data kind) throws StatementException {
        if (kind.reserveOnly()) {
            return;
        }
        // all operands are encoded before any is built, an errored DC leaves no bytes behind
        List<byte[]> encoded = new ArrayList<>();
        for (DataOperand operand : kind.operands()) {
            encoded.add(encode(operand));
        }
        for (int i = 0; i < encoded.size(); i++) {
            statement.content().get(i).build(encoded.get(i));
        }
    }

    private byte[] encode(DataOperand operand) throws StatementException {
        long duplication = DataLayout.duplication(operand, context).orElseThrow(() -> unresolved(operand.duplication()));
        long length = DataLayout.elementLength(operand, context).orElseThrow(() -> unresolved(operand.explicitLength()));
        List<Long> values = new ArrayList<>();
        for (Resolvable expression : operand.expressions()) {
            values.add(operand.type() == DataType.S ? storageConstant(expression) : addressConstant(expression));
        }
        return DataEncoder.encode(operand, duplication, length, values);
    }

    /**
     * Resolves the nominal value of an S-type constant to its base and displacement
     * halfword. Absolute values are displacements from base 0.
     */
    private long storageConstant(Resolvable expression) throws StatementException {
        ExprValue value = expression.require(context);
        if (value instanceof ExprValue.IntValue integer) {
            if (integer.value() < 0 || integer.value() > 0xFFF) {
                throw new StatementException(AssemblerErrorCode.VALUE_OUT_OF_RANGE,
                        "S-type displacement " + integer.value() + " out of range 0..4095");
            }
            return integer.value();
        }
        BaseResolution resolution = context.bases().resolve(((ExprValue.AddrValue) value).address(), 12);
        return ((long) resolution.register() << 12) | resolution.displacement();
    }

    /**
     * Encodes the literals placed by a LTORG or END statement.
     */
    private void buildLiterals(Statement statement) throws StatementException {
        List<LiteralPool.Literal> pool = context.literals().placedBy(statement.number());
        List<byte[]> encoded = new ArrayList<>();
        for (LiteralPool.Literal literal : pool) {
            encoded.add(encode(literal.operand()));
        }
        for (int i = 0; i < pool.size(); i++) {
            pool.get(i).binary().orElseThrow().build(encoded.get(i));
        }
    }

    private long addressConstant(Resolvable expression) throws StatementException {
        ExprValue value = expression.require(context);
        if (value instanceof ExprValue.IntValue integer) {
            return integer.value();
        }
        Address address = ((ExprValue.AddrValue) value).address();
        if (!address.isAbsolute() && !address.isDummy()) {
            throw new StatementException(AssemblerErrorCode.UNRESOLVED_EXPRESSION, "address " + address + " is not bound");
        }
        return address.position();
    }

    @Override
    public void visitEqu(Statement statement, StatementKind.Equ kind) throws StatementException {
        if (!EquateResolver.tryResolve(context, statement, kind)) {
            throw new StatementException(AssemblerErrorCode.UNRESOLVED_EXPRESSION, "cannot resolve EQU '"
                    + kind.value() + "': " + kind.value().lastDeferral().orElse("length attribute unknown"));
        }
    }

    @Override
    public void visitUsing(Statement statement, StatementKind.Using kind) throws StatementException {
        ExprValue value = kind.anchor().require(context);
        Address anchor;
        if (value instanceof ExprValue.AddrValue address) {
            anchor = address.address();
        } else {
            long integer = ((ExprValue.IntValue) value).value();
            if (integer < 0) {
                throw new StatementException(AssemblerErrorCode.INVALID_BASE_ANCHOR, "negative USING anchor " + integer);
            }
            anchor = Address.absolute(integer);
        }
        List<Resolvable> registers = kind.registers();
        for (int i = 0; i < registers.size(); i++) {
            int register = register(registers.get(i), "USING register");
            context.bases().assign(register, anchor.plus(USING_RANGE * i));
        }
    }

    @Override
    public void visitDrop(Statement statement, StatementKind.Drop kind) throws StatementException {
        if (kind.registers().isEmpty()) {
            context.bases().dropAll();
            return;
        }
        for (Resolvable resolvable : kind.registers()) {
            context.bases().drop(register(resolvable, "DROP register"));
        }
    }

    @Override
    public void visitEntry(Statement statement, StatementKind.Entry kind) throws StatementException {
        context.setEntryAddress(entryPoint(kind.target()));
    }

    @Override
    public void visitEnd(Statement statement, StatementKind.End kind) throws StatementException {
        buildLiterals(statement);
        if (kind.entry() != null) {
            context.setEntryAddress(entryPoint(kind.entry()));
        }
    }

    @Override
    public void visitCcw(Statement statement, StatementKind.Ccw kind) throws StatementException {
        List<Resolvable> operands = kind.operands();
        byte[] bytes = ControlWordEncoder.ccw(kind.format(),
                operands.get(0).requireInteger(context, "CCW command code"),
                absolute(operands.get(1), "CCW address"),
                operands.get(2).requireInteger(context, "CCW flags"),
                operands.get(3).requireInteger(context, "CCW count"));
        statement.content().get(0).build(bytes);
    }

    @Override
    public void visitPsw(Statement statement, StatementKind.Psw kind) throws StatementException {
        List<Resolvable> operands = kind.operands();
        long amode = operands.size() > 5 ? operands.get(5).requireInteger(context, "PSW addressing mode") : 0;
        byte[] bytes = ControlWordEncoder.psw(kind.format(),
                operands.get(0).requireInteger(context, "PSW system mask"),
                operands.get(1).requireInteger(context, "PSW key"),
                operands.get(2).requireInteger(context, "PSW mode bits"),
                operands.get(3).requireInteger(context, "PSW program mask"),
                absolute(operands.get(4), "PSW address"),
                amode);
        statement.content().get(0).build(bytes);
    }

    @Override
    public void visitCnop(Statement statement, StatementKind.Cnop kind) {
        Binary binary = statement.content().get(0);
        byte[] padding = new byte[(int) binary.length()];
        for (int i = 0; i < padding.length; i += 2) {
            padding[i] = NOP_OPCODE;
        }
        binary.build(padding);
    }

    @Override
    public void visitLtorg(Statement statement, StatementKind.Ltorg kind) throws StatementException {
        buildLiterals(statement);
    }

    /**
     * Evaluates an operand that must be a number or a bound address.
     */
    private long absolute(Resolvable operand, String what) throws StatementException {
        ExprValue value = operand.require(context);
        if (value instanceof ExprValue.IntValue integer) {
            return integer.value();
        }
        Address address = ((ExprValue.AddrValue) value).address();
        if (!address.isAbsolute()) {
            throw new StatementException(AssemblerErrorCode.ADDRESS_ARITHMETIC, what + " " + address + " is not an absolute address");
        }
        return address.position();
    }

    private long entryPoint(Resolvable target) throws StatementException {
        ExprValue value = target.require(context);
        if (value instanceof ExprValue.IntValue integer) {
            return integer.value();
        }
        Address address = ((ExprValue.AddrValue) value).address();
        if (!address.isAbsolute()) {
            throw new StatementException(AssemblerErrorCode.ADDRESS_ARITHMETIC, "entry point " + address + " is not an absolute address");
        }
        return address.position();
    }

    @Override
    public void visitInstruction(Statement statement, StatementKind.Instruction kind) throws StatementException {
        InstructionInfo info = kind.info();
        List<ResolvedOperand> operands = new ArrayList<>();
        for (MachineOperand operand : kind.operands()) {
            operands.add(resolve(statement, info, operand));
        }
        Binary binary = statement.content().get(0);
        binary.build(InstructionEncoder.encode(info, operands));
    }

    private ResolvedOperand resolve(Statement statement, InstructionInfo info, MachineOperand operand) throws StatementException {
        switch (operand.kind()) {
            case REGISTER:
                return new ResolvedOperand.RegisterField(operand.primary().requireInteger(context, "register operand"));
            case IMMEDIATE:
                return new ResolvedOperand.ImmediateField(operand.primary().requireInteger(context, "immediate operand"));
            case RELATIVE:
                return relative(statement, operand);
            default:
                return storage(info, operand);
        }
    }

    private ResolvedOperand relative(Statement statement, MachineOperand operand) throws StatementException {
        ExprValue value = operand.primary().require(context);
        if (!(value instanceof ExprValue.AddrValue target)) {
            throw new StatementException(AssemblerErrorCode.ADDRESS_ARITHMETIC, "relative operand must be a location");
        }
        Address here = statement.location().orElseThrow(() ->
                new StatementException(AssemblerErrorCode.INVALID_CONTAINER_STATE, "instruction has no location"));
        long distance;
        try {
            distance = target.address().distance(here);
        } catch (AddressException e) {
            throw new StatementException(AssemblerErrorCode.ADDRESS_ARITHMETIC, e.getMessage(), e);
        }
        if (distance % 2 != 0) {
            throw new StatementException(AssemblerErrorCode.VALUE_OUT_OF_RANGE,
                    "relative target " + target.address() + " is not on a halfword boundary");
        }
        return new ResolvedOperand.ImmediateField(distance / 2);
    }

    private ResolvedOperand storage(InstructionInfo info, MachineOperand operand) throws StatementException {
        boolean indexed = operand.kind() == OperandKind.INDEXED_STORAGE || operand.kind() == OperandKind.LONG_INDEXED_STORAGE;
        ExprValue primary = operand.primary().require(context);
        int bits = info.format().baseResolutionBits();
        if (!operand.parenthesized()) {
            return implied(primary, 0, bits);
        }
        if (operand.second() == null) {
            if (indexed) {
                long index = register(operand.first(), "index register");
                if (primary instanceof ExprValue.AddrValue) {
                    return implied(primary, index, bits);
                }
                // D(X) addresses from base 0
                return new ResolvedOperand.StorageField(index, 0, displacement(primary));
            }
            long base = register(operand.first(), "base register");
            return new ResolvedOperand.StorageField(0, base, displacement(primary));
        }
        if (!indexed) {
            throw new StatementException(AssemblerErrorCode.SYNTAX_ERROR, "operand does not take an index register");
        }
        long index = operand.first() == null ? 0 : register(operand.first(), "index register");
        long base = register(operand.second(), "base register");
        return new ResolvedOperand.StorageField(index, base, displacement(primary));
    }

    /**
     * Resolves an implied address through the active base registers. Plain numbers
     * are displacements from base 0.
     */
    private ResolvedOperand implied(ExprValue value, long index, int bits) throws StatementException {
        if (value instanceof ExprValue.IntValue integer) {
            return new ResolvedOperand.StorageField(index, 0, integer.value());
        }
        BaseResolution resolution = context.bases().resolve(((ExprValue.AddrValue) value).address(), bits);
        return new ResolvedOperand.StorageField(index, resolution.register(), resolution.displacement());
    }

    private static long displacement(ExprValue value) throws StatementException {
        if (value instanceof ExprValue.IntValue integer) {
            return integer.value();
        }
        Address address = ((ExprValue.AddrValue) value).address();
        if (address.isDummy()) {
            return address.position();
        }
        throw new StatementException(AssemblerErrorCode.ADDRESS_ARITHMETIC,
                "explicit displacement must be absolute, not address " + address);
    }

    private int register(Resolvable resolvable, String what) throws StatementException {
        long value = resolvable.requireInteger(context, what);
        if (value < 0 || value > 15) {
            throw new StatementException(AssemblerErrorCode.INVALID_REGISTER, what + " " + value + " out of range 0..15");
        }
        return (int) value;
    }

    private static StatementException unresolved(Resolvable resolvable) {
        return new StatementException(AssemblerErrorCode.UNRESOLVED_EXPRESSION,
                "cannot resolve '" + resolvable + "': " + resolvable.lastDeferral().orElse("unknown"));
    }
}
