package org.asma.assembler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.asma.assembler.isa.Architecture;

/**
 * Immutable settings of one assembly run, read from the {@code asma.assembler} block.
 *
 * @param architecture   The target architecture.
 * @param addressingMode The addressing mode recorded for the image (24, 31 or 64).
 * @param caseSensitive  {@code true} to keep symbol names as written.
 * @param maxAddressBits The highest address width a region may reach, 0 to derive it from the architecture.
 * @param failFast       {@code true} to stop at the first error.
 * @param imageName      The name of the image symbol and IPL directory.
 */
public record AssemblerConfig(
        Architecture architecture,
        int addressingMode,
        boolean caseSensitive,
        int maxAddressBits,
        boolean failFast,
        String imageName
) {
    private static final String CONFIG_PATH = "asma.assembler";

    public AssemblerConfig {
        if (addressingMode != 24 && addressingMode != 31 && addressingMode != 64) {
            throw new IllegalArgumentException("addressing mode must be 24, 31 or 64: " + addressingMode);
        }
        if (maxAddressBits < 0 || maxAddressBits > 64) {
            throw new IllegalArgumentException("max address bits out of range: " + maxAddressBits);
        }
        if (imageName == null || imageName.isBlank()) {
            throw new IllegalArgumentException("image name must not be empty");
        }
    }

    /**
     * @return The defaults from {@code reference.conf}.
     */
    public static AssemblerConfig defaults() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Reads the settings from a configuration. Missing keys fall back to {@code reference.conf}.
     *
     * @param config The application configuration.
     * @return The settings.
     * @throws ConfigException if a value is missing or malformed.
     */
    public static AssemblerConfig fromConfig(Config config) {
        Config section = config.withFallback(ConfigFactory.defaultReference()).getConfig(CONFIG_PATH);
        try {
            return new AssemblerConfig(
                    section.getEnum(Architecture.class, "architecture"),
                    section.getInt("addressing-mode"),
                    section.getBoolean("case-sensitive"),
                    section.getInt("max-address-bits"),
                    section.getBoolean("fail-fast"),
                    section.getString("image-name"));
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(section.origin(), CONFIG_PATH, e.getMessage(), e);
        }
    }

    /**
     * @return The address width used for region range checks.
     */
    public int effectiveAddressBits() {
        return maxAddressBits > 0 ? maxAddressBits : architecture.addressBits();
    }

    public AssemblerConfig withArchitecture(Architecture value) {
        return new AssemblerConfig(value, addressingMode, caseSensitive, maxAddressBits, failFast, imageName);
    }

    public AssemblerConfig withFailFast(boolean value) {
        return new AssemblerConfig(architecture, addressingMode, caseSensitive, maxAddressBits, value, imageName);
    }

    public AssemblerConfig withCaseSensitive(boolean value) {
        return new AssemblerConfig(architecture, addressingMode, value, maxAddressBits, failFast, imageName);
    }
}
