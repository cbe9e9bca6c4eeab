package org.asma.assembler;

import org.asma.assembler.api.AssemblerErrorCode;
import org.asma.assembler.api.AssemblyException;
import org.asma.assembler.api.AssemblyResult;
import org.asma.assembler.api.ListingLine;
import org.asma.assembler.api.SymbolSummary;
import org.asma.assembler.config.AssemblerConfig;
import org.asma.assembler.diagnostics.Diagnostic;
import org.asma.assembler.isa.Architecture;
import org.asma.assembler.output.ImageFileWriter;
import org.asma.assembler.output.RcScriptWriter;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Assembles complete programs through the public facade.
 */
@Tag("integration")
public class AssemblerTest {

    private static final List<String> BOOT = List.of(
            "BOOT     START X'2000',LOW",
            "         BASR  12,0",
            "         USING *,12",
            "         LA    1,MSG",
            "         ENTRY GO",
            "GO       SVC   3",
            "MSG      DC    C'HI'",
            "PTR      DC    A(MSG)",
            "         END");

    @Test
    void assemblesBootProgram() throws AssemblyException {
        // Arrange
        Assembler assembler = new Assembler(AssemblerConfig.defaults());

        // Act
        AssemblyResult result = assembler.assemble(BOOT, "boot.asm");

        // Assert
        assertThat(result.hasErrors()).as(result.diagnostics().toString()).isFalse();
        assertThat(result.image()).containsExactly(
                0x0D, 0xC0,
                0x41, 0x10, 0xC0, 0x06,
                0x0A, 0x03,
                0xC8, 0xC9,
                0x00, 0x00,
                0x00, 0x00, 0x20, 0x08);
        assertThat(result.loadAddress()).isEqualTo(0x2000);
        assertThat(result.entryAddress()).isEqualTo(0x2006);
        assertThat(result.addressingMode()).isEqualTo(31);
        assertThat(result.imageName()).isEqualTo("IMAGE");
    }

    @Test
    void reportsSymbolsAndListing() throws AssemblyException {
        AssemblyResult result = new Assembler().assemble(BOOT, "boot.asm");

        assertThat(result.symbols()).extracting(SymbolSummary::name)
                .containsExactly("BOOT", "GO", "IMAGE", "LOW", "MSG", "PTR");
        SymbolSummary msg = result.symbols().get(4);
        assertThat(msg.value()).isEqualTo("00002008");
        assertThat(msg.length()).isEqualTo(2);
        assertThat(msg.type()).isEqualTo('A');
        assertThat(msg.definedAt()).isEqualTo(7);
        assertThat(msg.references()).contains(4);

        assertThat(result.listing()).hasSize(BOOT.size());
        ListingLine svc = result.listing().get(5);
        assertThat(svc.location()).isEqualTo(0x2006L);
        assertThat(svc.objectCode()).containsExactly(0x0A, 0x03);
        assertThat(svc.error()).isNull();
    }

    @Test
    void passesResultToRegisteredWriters() throws AssemblyException {
        Assembler assembler = new Assembler().addOutputWriter(new ImageFileWriter()).addOutputWriter(new RcScriptWriter());

        AssemblyResult result = assembler.assemble(BOOT, "boot.asm");

        assertThat(result.outputs()).extracting(f -> f.name()).containsExactly("IMAGE.bin", "IMAGE.rc");
    }

    @Test
    void foldsSymbolCaseUnlessCaseSensitive() throws AssemblyException {
        List<String> source = List.of(
                "lab      DC    F'1'",
                "         DC    A(LAB)");

        AssemblyResult folded = new Assembler(AssemblerConfig.defaults()).assemble(source, "case.asm");
        AssemblyResult sensitive = new Assembler(AssemblerConfig.defaults().withCaseSensitive(true)).assemble(source, "case.asm");

        assertThat(folded.hasErrors()).isFalse();
        assertThat(folded.image()).containsExactly(0, 0, 0, 1, 0, 0, 0, 0);
        assertThat(sensitive.diagnostics()).extracting(Diagnostic::code).containsExactly(AssemblerErrorCode.UNDEFINED_SYMBOL);
    }

    @Test
    void rejectsInstructionsNewerThanArchitecture() throws AssemblyException {
        Assembler assembler = new Assembler(AssemblerConfig.defaults().withArchitecture(Architecture.S370));

        AssemblyResult result = assembler.assemble(List.of("         LG    1,0(0,2)"), "new.asm");

        assertThat(result.diagnostics()).extracting(Diagnostic::code).containsExactly(AssemblerErrorCode.UNKNOWN_OPERATION);
    }

    @Test
    void failFastThrowsWithSourcePosition() {
        Assembler assembler = new Assembler(AssemblerConfig.defaults().withFailFast(true));

        assertThatThrownBy(() -> assembler.assemble(List.of("         DC    F'1'", "         L     1,NOPE"), "bad.asm"))
                .isInstanceOf(AssemblyException.class)
                .hasMessageContaining("bad.asm:2");
    }

    @Test
    void eachRunStartsFresh() throws AssemblyException {
        Assembler assembler = new Assembler();

        AssemblyResult first = assembler.assemble(BOOT, "boot.asm");
        AssemblyResult second = assembler.assemble(BOOT, "boot.asm");

        assertThat(second.image()).isEqualTo(first.image());
        assertThat(second.diagnostics()).isEmpty();
    }
}
