package org.asma.assembler.config;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.asma.assembler.isa.Architecture;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class AssemblerConfigTest {

    @Test
    void defaultsComeFromReferenceConf() {
        AssemblerConfig config = AssemblerConfig.defaults();

        assertThat(config.architecture()).isEqualTo(Architecture.ZARCH);
        assertThat(config.addressingMode()).isEqualTo(31);
        assertThat(config.caseSensitive()).isFalse();
        assertThat(config.failFast()).isFalse();
        assertThat(config.imageName()).isEqualTo("IMAGE");
        assertThat(config.effectiveAddressBits()).isEqualTo(64);
    }

    @Test
    void overridesFallBackToReference() {
        // Given
        String hocon = """
                asma.assembler {
                  architecture = "S370"
                  addressing-mode = 24
                  max-address-bits = 20
                }
                """;

        // When
        AssemblerConfig config = AssemblerConfig.fromConfig(ConfigFactory.parseString(hocon));

        // Then
        assertThat(config.architecture()).isEqualTo(Architecture.S370);
        assertThat(config.addressingMode()).isEqualTo(24);
        assertThat(config.effectiveAddressBits()).isEqualTo(20);
        assertThat(config.imageName()).isEqualTo("IMAGE");
    }

    @Test
    void rejectsUnknownArchitecture() {
        assertThatThrownBy(() -> AssemblerConfig.fromConfig(ConfigFactory.parseString("asma.assembler.architecture = Z99")))
                .isInstanceOf(ConfigException.class);
    }

    @Test
    void rejectsInvalidAddressingModeAsBadValue() {
        assertThatThrownBy(() -> AssemblerConfig.fromConfig(ConfigFactory.parseString("asma.assembler.addressing-mode = 16")))
                .isInstanceOf(ConfigException.BadValue.class)
                .hasMessageContaining("24, 31 or 64");
    }

    @Test
    void rejectsBlankImageName() {
        assertThatThrownBy(() -> new AssemblerConfig(Architecture.ZARCH, 31, false, 0, false, " "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void copiesChangeOneSetting() {
        AssemblerConfig base = AssemblerConfig.defaults();

        AssemblerConfig changed = base.withArchitecture(Architecture.S360_20).withFailFast(true).withCaseSensitive(true);

        assertThat(changed.architecture()).isEqualTo(Architecture.S360_20);
        assertThat(changed.failFast()).isTrue();
        assertThat(changed.caseSensitive()).isTrue();
        assertThat(changed.effectiveAddressBits()).isEqualTo(16);
        assertThat(changed.imageName()).isEqualTo(base.imageName());
    }
}
