package org.asma.assembler.isa;

import java.util.Optional;
import java.util.Set;

/**
 * Provides machine instruction metadata for one target architecture.
 */
public interface IInstructionSet {

    /**
     * Looks up an instruction by mnemonic.
     *
     * @param mnemonic The mnemonic, case-insensitive.
     * @return The instruction metadata, or empty if the mnemonic is unknown or not available
     *         on the target architecture.
     */
    Optional<InstructionInfo> find(String mnemonic);

    /**
     * @return The architecture the set was built for.
     */
    Architecture architecture();

    /**
     * @return Every mnemonic in the set.
     */
    Set<String> mnemonics();
}
