package org.asma.assembler.diagnostics;

import org.asma.assembler.api.AssemblerErrorCode;
import org.asma.assembler.api.SourceInfo;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class DiagnosticsEngineTest {

    @Test
    void warningsDoNotCountAsErrors() {
        DiagnosticsEngine engine = new DiagnosticsEngine();

        engine.reportWarning("odd alignment", new SourceInfo("a.asm", 4, "X DC H'1'"), 4);

        assertThat(engine.hasErrors()).isFalse();
        assertThat(engine.getDiagnostics()).singleElement()
                .extracting(Diagnostic::type).isEqualTo(Diagnostic.Type.WARNING);
    }

    @Test
    void errorsKeepReportOrderAndSource() {
        // Arrange
        DiagnosticsEngine engine = new DiagnosticsEngine();

        // Act
        engine.reportError(AssemblerErrorCode.UNDEFINED_SYMBOL, "undefined symbol 'X'", new SourceInfo("a.asm", 7, " L 1,X"), 6);
        engine.reportError(AssemblerErrorCode.ADDRESS_WIDTH_EXCEEDED, "region too large", "a.asm");

        // Assert
        assertThat(engine.errorCount()).isEqualTo(2);
        assertThat(engine.getDiagnostics().get(0).lineNumber()).isEqualTo(7);
        assertThat(engine.getDiagnostics().get(0).statementNumber()).isEqualTo(6);
        assertThat(engine.getDiagnostics().get(1).statementNumber()).isZero();
        assertThat(engine.summary()).isEqualTo(
                "[ERROR] a.asm:7: undefined symbol 'X' (UNDEFINED_SYMBOL)\n"
                        + "[ERROR] a.asm:0: region too large (ADDRESS_WIDTH_EXCEEDED)");
    }
}
