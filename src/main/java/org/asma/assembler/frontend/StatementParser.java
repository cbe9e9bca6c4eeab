package org.asma.assembler.frontend;

import org.asma.assembler.api.AssemblerErrorCode;
import org.asma.assembler.api.SourceInfo;
import org.asma.assembler.diagnostics.StatementException;
import org.asma.assembler.expr.LiteralReference;
import org.asma.assembler.expr.Resolvable;
import org.asma.assembler.isa.Architecture;
import org.asma.assembler.isa.IInstructionSet;
import org.asma.assembler.isa.InstructionInfo;
import org.asma.assembler.isa.OperandKind;
import org.asma.assembler.statement.DataOperand;
import org.asma.assembler.statement.MachineOperand;
import org.asma.assembler.statement.PswFormat;
import org.asma.assembler.statement.Statement;
import org.asma.assembler.statement.StatementKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns source lines into classified statements.
 */
public class StatementParser {

    private static final Set<String> LISTING_CONTROL = Set.of("TITLE", "EJECT", "SPACE", "PRINT");

    private final IInstructionSet instructionSet;

    public StatementParser(IInstructionSet instructionSet) {
        this.instructionSet = instructionSet;
    }

    /**
     * Parses one line. A line that cannot be parsed yields an errored statement.
     *
     * @param number The statement number.
     * @param source The source line.
     * @return The statement.
     */
    public Statement parse(int number, SourceInfo source) {
        SourceLine line;
        try {
            line = LineScanner.scan(source.text());
        } catch (StatementException e) {
            return failed(number, source, null, null, e);
        }
        if (line.isComment()) {
            return new Statement(number, source, null, null, new StatementKind.Ignored("comment"));
        }
        try {
            StatementKind kind = classify(line);
            return new Statement(number, source, line.label(), line.operation(), kind);
        } catch (StatementException e) {
            return failed(number, source, line.label(), line.operation(), e);
        }
    }

    private Statement failed(int number, SourceInfo source, String label, String operation, StatementException e) {
        Statement statement = new Statement(number, source, label, operation, new StatementKind.Ignored(e.getMessage()));
        statement.fail(e.getCode(), e.getMessage());
        return statement;
    }

    /**
     * Classifies the operation of a line and parses its operands.
     *
     * @param line The split line.
     * @return The statement kind.
     * @throws StatementException if the operation is unknown or the operands are malformed.
     */
    public StatementKind classify(SourceLine line) throws StatementException {
        String operation = line.operation();
        List<String> operands = line.operands();
        if (LISTING_CONTROL.contains(operation)) {
            return new StatementKind.Ignored("listing control");
        }
        switch (operation) {
            case "START": {
                expectCount(operation, operands, 0, 2);
                Resolvable address = operands.isEmpty() || operands.get(0).isBlank() ? null : expression(operands.get(0));
                String region = operands.size() < 2 || operands.get(1).isBlank() ? null : operands.get(1).trim();
                return new StatementKind.Start(address, region);
            }
            case "CSECT":
                expectCount(operation, operands, 0, 0);
                return new StatementKind.Csect();
            case "DSECT":
                expectCount(operation, operands, 0, 0);
                return new StatementKind.Dsect();
            case "REGION":
                expectCount(operation, operands, 0, 0);
                return new StatementKind.Region();
            case "DC":
            case "DS": {
                expectCount(operation, operands, 1, Integer.MAX_VALUE);
                boolean reserveOnly = operation.equals("DS");
                List<DataOperand> data = new ArrayList<>();
                for (String operand : operands) {
                    data.add(DataOperandParser.parse(operand, reserveOnly));
                }
                return new StatementKind.Data(reserveOnly, data);
            }
            case "EQU":
                expectCount(operation, operands, 1, 2);
                return new StatementKind.Equ(expression(operands.get(0)),
                        operands.size() > 1 ? expression(operands.get(1)) : null);
            case "ORG":
                expectCount(operation, operands, 0, 1);
                return new StatementKind.Org(operands.isEmpty() || operands.get(0).isBlank()
                        ? null : expression(operands.get(0)));
            case "USING": {
                expectCount(operation, operands, 2, 17);
                return new StatementKind.Using(expression(operands.get(0)), expressions(operands.subList(1, operands.size())));
            }
            case "DROP":
                expectCount(operation, operands, 0, 16);
                return new StatementKind.Drop(expressions(operands));
            case "ENTRY":
                expectCount(operation, operands, 1, 1);
                return new StatementKind.Entry(expression(operands.get(0)));
            case "END":
                expectCount(operation, operands, 0, 1);
                return new StatementKind.End(operands.isEmpty() || operands.get(0).isBlank()
                        ? null : expression(operands.get(0)));
            case "CCW":
            case "CCW0":
            case "CCW1": {
                expectCount(operation, operands, 4, 4);
                return new StatementKind.Ccw(ccwFormat(operation), expressions(operands));
            }
            case "CNOP":
                expectCount(operation, operands, 2, 2);
                return new StatementKind.Cnop(expression(operands.get(0)), expression(operands.get(1)));
            case "LTORG":
                expectCount(operation, operands, 0, 0);
                return new StatementKind.Ltorg();
            default: {
                Optional<PswFormat> psw = operation.equals("PSW")
                        ? Optional.of(PswFormat.forArchitecture(instructionSet.architecture()))
                        : PswFormat.fromOperation(operation);
                if (psw.isPresent()) {
                    expectCount(operation, operands, 5, 6);
                    return new StatementKind.Psw(psw.get(), expressions(operands));
                }
                return instruction(operation, operands);
            }
        }
    }

    /**
     * The generic CCW builds format 0 words up to System/370 and format 1 words from ESA/390 on.
     * The Model 20 has no channel programs.
     */
    private int ccwFormat(String operation) throws StatementException {
        Architecture architecture = instructionSet.architecture();
        if (architecture == Architecture.S360_20) {
            throw new StatementException(AssemblerErrorCode.UNKNOWN_OPERATION,
                    "unknown operation '" + operation + "' for " + architecture);
        }
        if (operation.equals("CCW")) {
            return architecture.includes(Architecture.ESA390) ? 1 : 0;
        }
        return operation.equals("CCW1") ? 1 : 0;
    }

    private StatementKind instruction(String operation, List<String> operands) throws StatementException {
        Optional<InstructionInfo> found = instructionSet.find(operation);
        if (found.isEmpty()) {
            throw new StatementException(AssemblerErrorCode.UNKNOWN_OPERATION,
                    "unknown operation '" + operation + "' for " + instructionSet.architecture());
        }
        InstructionInfo info = found.get();
        List<OperandKind> kinds = info.operandKinds();
        expectCount(operation, operands, kinds.size(), kinds.size());
        List<MachineOperand> machineOperands = new ArrayList<>();
        for (int i = 0; i < kinds.size(); i++) {
            OperandKind kind = kinds.get(i);
            String text = operands.get(i);
            if (isLiteral(kind, text)) {
                machineOperands.add(MachineOperand.simple(kind, new Resolvable(new LiteralReference(text.trim()))));
                continue;
            }
            switch (kind) {
                case STORAGE:
                case INDEXED_STORAGE:
                case LONG_INDEXED_STORAGE: {
                    OperandSyntax syntax = OperandParser.parseOperand(text);
                    machineOperands.add(new MachineOperand(kind, new Resolvable(syntax.primary()), syntax.parenthesized(),
                            syntax.first() == null ? null : new Resolvable(syntax.first()),
                            syntax.second() == null ? null : new Resolvable(syntax.second())));
                    break;
                }
                default:
                    machineOperands.add(MachineOperand.simple(kind, expression(text)));
                    break;
            }
        }
        return new StatementKind.Instruction(info, machineOperands);
    }

    private static boolean isLiteral(OperandKind kind, String text) {
        return kind != OperandKind.REGISTER && kind != OperandKind.IMMEDIATE && kind != OperandKind.RELATIVE
                && text.trim().startsWith("=");
    }

    private static Resolvable expression(String text) throws StatementException {
        return new Resolvable(OperandParser.parseExpression(text.trim()));
    }

    private static List<Resolvable> expressions(List<String> texts) throws StatementException {
        List<Resolvable> result = new ArrayList<>();
        for (String text : texts) {
            result.add(expression(text));
        }
        return result;
    }

    private static void expectCount(String operation, List<String> operands, int min, int max) throws StatementException {
        if (operands.size() < min || operands.size() > max) {
            String expected = min == max ? Integer.toString(min)
                    : max == Integer.MAX_VALUE ? "at least " + min : min + " to " + max;
            throw new StatementException(AssemblerErrorCode.INVALID_OPERAND_COUNT,
                    operation + " expects " + expected + " operands, got " + operands.size());
        }
    }
}
