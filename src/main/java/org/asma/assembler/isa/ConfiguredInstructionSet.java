package org.asma.assembler.isa;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * An instruction set read from a HOCON table.
 * <p>
 * The table lives under {@code asma.instructions}; each entry names an opcode in hex,
 * a format and the first architecture that provides it:
 * <pre>
 * asma.instructions {
 *   L  { opcode = "58", format = RX, since = S360 }
 * }
 * </pre>
 */
public final class ConfiguredInstructionSet implements IInstructionSet {

    private static final Logger LOG = LoggerFactory.getLogger(ConfiguredInstructionSet.class);

    /** Classpath resource holding the built-in table. */
    public static final String DEFAULT_RESOURCE = "instructions.conf";
    private static final String TABLE_PATH = "asma.instructions";

    private final Architecture architecture;
    private final Map<String, InstructionInfo> instructions;

    private ConfiguredInstructionSet(Architecture architecture, Map<String, InstructionInfo> instructions) {
        this.architecture = architecture;
        this.instructions = instructions;
    }

    /**
     * Loads the built-in table for an architecture.
     * @param architecture The target architecture.
     * @return The instruction set.
     */
    public static ConfiguredInstructionSet load(Architecture architecture) {
        return fromConfig(ConfigFactory.parseResources(DEFAULT_RESOURCE), architecture);
    }

    /**
     * Builds an instruction set from a configuration holding an {@code asma.instructions} table.
     *
     * @param config       The configuration.
     * @param architecture The target architecture; later instructions are left out.
     * @return The instruction set.
     * @throws ConfigException if the table is malformed.
     */
    public static ConfiguredInstructionSet fromConfig(Config config, Architecture architecture) {
        Config table = config.getConfig(TABLE_PATH);
        Map<String, InstructionInfo> result = new TreeMap<>();
        for (String mnemonic : table.root().keySet()) {
            Config entry = table.getConfig(mnemonic);
            String opcodeText = entry.getString("opcode");
            InstructionInfo info;
            try {
                info = new InstructionInfo(
                        mnemonic.toUpperCase(Locale.ROOT),
                        Integer.parseInt(opcodeText, 16),
                        opcodeText.length(),
                        entry.getEnum(InstructionFormat.class, "format"),
                        entry.getEnum(Architecture.class, "since"));
            } catch (NumberFormatException e) {
                throw new ConfigException.BadValue(entry.origin(), "opcode", "not a hexadecimal opcode: " + opcodeText, e);
            }
            if (architecture.includes(info.since())) {
                result.put(info.mnemonic(), info);
            }
        }
        LOG.debug("Loaded {} instructions for {}", result.size(), architecture);
        return new ConfiguredInstructionSet(architecture, Collections.unmodifiableMap(result));
    }

    @Override
    public Optional<InstructionInfo> find(String mnemonic) {
        return Optional.ofNullable(instructions.get(mnemonic.toUpperCase(Locale.ROOT)));
    }

    @Override
    public Architecture architecture() {
        return architecture;
    }

    @Override
    public Set<String> mnemonics() {
        return instructions.keySet();
    }
}
