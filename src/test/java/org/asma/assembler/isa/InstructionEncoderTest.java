package org.asma.assembler.isa;

import org.asma.assembler.api.AssemblerErrorCode;
import org.asma.assembler.diagnostics.StatementException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class InstructionEncoderTest {

    private static IInstructionSet isa;

    @BeforeAll
    static void loadInstructions() {
        isa = ConfiguredInstructionSet.load(Architecture.ZARCH);
    }

    private static InstructionInfo op(String mnemonic) {
        return isa.find(mnemonic).orElseThrow();
    }

    private static ResolvedOperand reg(long r) {
        return new ResolvedOperand.RegisterField(r);
    }

    private static ResolvedOperand imm(long v) {
        return new ResolvedOperand.ImmediateField(v);
    }

    private static ResolvedOperand sto(long index, long base, long displacement) {
        return new ResolvedOperand.StorageField(index, base, displacement);
    }

    @Test
    void encodesRegisterToRegister() throws Exception {
        assertThat(InstructionEncoder.encode(op("LR"), List.of(reg(1), reg(2)))).containsExactly(0x18, 0x12);
    }

    @Test
    void encodesRegisterAndIndexedStorage() throws Exception {
        assertThat(InstructionEncoder.encode(op("L"), List.of(reg(3), sto(4, 12, 8))))
                .containsExactly(0x58, 0x34, 0xC0, 0x08);
    }

    @Test
    void encodesRegisterStorageWithTwoRegisters() throws Exception {
        assertThat(InstructionEncoder.encode(op("STM"), List.of(reg(14), reg(12), sto(0, 13, 12))))
                .containsExactly(0x90, 0xEC, 0xD0, 0x0C);
    }

    @Test
    void encodesStorageImmediate() throws Exception {
        assertThat(InstructionEncoder.encode(op("MVI"), List.of(sto(0, 12, 0), imm(0xFF))))
                .containsExactly(0x92, 0xFF, 0xC0, 0x00);
    }

    @Test
    void encodesTwoByteOpcodeStorageFormat() throws Exception {
        assertThat(InstructionEncoder.encode(op("STCK"), List.of(sto(0, 5, 0))))
                .containsExactly(0xB2, 0x05, 0x50, 0x00);
    }

    @Test
    void encodesSupervisorCall() throws Exception {
        assertThat(InstructionEncoder.encode(op("SVC"), List.of(imm(3)))).containsExactly(0x0A, 0x03);
    }

    @Test
    void encodesRegisterImmediateWithSplitOpcode() throws Exception {
        assertThat(InstructionEncoder.encode(op("LHI"), List.of(reg(1), imm(-1))))
                .containsExactly(0xA7, 0x18, 0xFF, 0xFF);
        assertThat(InstructionEncoder.encode(op("BRC"), List.of(reg(15), imm(4))))
                .containsExactly(0xA7, 0xF4, 0x00, 0x04);
    }

    @Test
    void encodesLongDisplacementHighAndLowParts() throws Exception {
        assertThat(InstructionEncoder.encode(op("LG"), List.of(reg(1), sto(0, 2, 0x12345))))
                .containsExactly(0xE3, 0x10, 0x23, 0x45, 0x12, 0x04);
        assertThat(InstructionEncoder.encode(op("LG"), List.of(reg(1), sto(0, 2, -1))))
                .containsExactly(0xE3, 0x10, 0x2F, 0xFF, 0xFF, 0x04);
    }

    @Test
    void registerOutOfRangeIsRejected() {
        assertThatThrownBy(() -> InstructionEncoder.encode(op("LR"), List.of(reg(16), reg(0))))
                .isInstanceOf(StatementException.class)
                .satisfies(e -> assertThat(((StatementException) e).getCode()).isEqualTo(AssemblerErrorCode.VALUE_OUT_OF_RANGE));
    }

    @Test
    void displacementOutOfRangeIsRejected() {
        assertThatThrownBy(() -> InstructionEncoder.encode(op("L"), List.of(reg(1), sto(0, 12, 4096))))
                .isInstanceOf(StatementException.class)
                .hasMessageContaining("displacement");
    }

    @Test
    void relativeOffsetMustBeSigned() {
        assertThatThrownBy(() -> InstructionEncoder.encode(op("BRC"), List.of(reg(15), imm(0x8000))))
                .isInstanceOf(StatementException.class)
                .hasMessageContaining("relative offset");
    }

    @Test
    void indexOnNonIndexedOperandIsRejected() {
        assertThatThrownBy(() -> InstructionEncoder.encode(op("MVI"), List.of(sto(1, 12, 0), imm(1))))
                .isInstanceOf(StatementException.class)
                .satisfies(e -> assertThat(((StatementException) e).getCode()).isEqualTo(AssemblerErrorCode.SYNTAX_ERROR));
    }

    @Test
    void operandCountMustMatchFormat() {
        assertThatThrownBy(() -> InstructionEncoder.encode(op("LR"), List.of(reg(1))))
                .isInstanceOf(StatementException.class)
                .satisfies(e -> assertThat(((StatementException) e).getCode()).isEqualTo(AssemblerErrorCode.INVALID_OPERAND_COUNT));
    }
}
