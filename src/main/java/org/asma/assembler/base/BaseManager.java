package org.asma.assembler.base;

import org.asma.assembler.address.Address;
import org.asma.assembler.api.AssemblerErrorCode;
import org.asma.assembler.diagnostics.StatementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Tracks USING and DROP and converts implied addresses into base/displacement pairs.
 * <p>
 * Each register holds at most one assignment. Direct-mode registers are always present;
 * a USING on such a register shadows the direct assignment until it is dropped again.
 * <p>
 * Resolution picks the candidate with the smallest displacement. On a tie the highest
 * register wins, unless every tied candidate is a direct-mode register, in which case
 * the lowest one wins. The outcome never depends on the order of USING statements.
 */
public final class BaseManager {

    private static final Logger LOG = LoggerFactory.getLogger(BaseManager.class);

    /** Number of general registers. */
    public static final int REGISTER_COUNT = 16;

    private final Map<Integer, BaseAssignment> direct;
    private final Map<Integer, BaseAssignment> user = new TreeMap<>();

    public BaseManager(DirectMode mode) {
        this.direct = mode.assignments();
    }

    /**
     * Makes a register a base for an anchor address. Replaces any earlier assignment of the register.
     *
     * @param register The register number.
     * @param anchor   The anchor, absolute or relative to a DSECT.
     * @throws StatementException if the register or anchor is unusable.
     */
    public void assign(int register, Address anchor) throws StatementException {
        checkRegister(register);
        if (!anchor.isAbsolute() && !anchor.isDummy()) {
            throw new StatementException(AssemblerErrorCode.INVALID_BASE_ANCHOR,
                    "base anchor " + anchor + " is neither absolute nor in a DSECT");
        }
        BaseAssignment previous = user.put(register, new BaseAssignment(register, anchor, false));
        if (previous != null) {
            LOG.debug("R{} reassigned from {} to {}", register, previous.anchor(), anchor);
        }
    }

    /**
     * Removes a register's assignment. Dropping an unassigned register has no effect.
     *
     * @param register The register number.
     * @throws StatementException if the register number is invalid.
     */
    public void drop(int register) throws StatementException {
        checkRegister(register);
        user.remove(register);
    }

    /**
     * Removes every assignment made with USING.
     */
    public void dropAll() {
        user.clear();
    }

    /**
     * @param register The register number.
     * @return The active assignment of the register, if any.
     */
    public Optional<BaseAssignment> active(int register) {
        BaseAssignment assignment = user.get(register);
        if (assignment == null) {
            assignment = direct.get(register);
        }
        return Optional.ofNullable(assignment);
    }

    /**
     * @return All active assignments ordered by register.
     */
    public List<BaseAssignment> activeAssignments() {
        List<BaseAssignment> result = new ArrayList<>();
        for (int register = 0; register < REGISTER_COUNT; register++) {
            active(register).ifPresent(result::add);
        }
        return result;
    }

    /**
     * Resolves an address into base register and displacement.
     *
     * @param target           The address to reach.
     * @param displacementBits The width of the displacement field (12 or 20).
     * @return The chosen register and displacement.
     * @throws NoBaseAvailableException if no active base reaches the address.
     */
    public BaseResolution resolve(Address target, int displacementBits) throws NoBaseAvailableException {
        long limit = 1L << displacementBits;
        List<BaseAssignment> tied = new ArrayList<>();
        long best = Long.MAX_VALUE;
        for (BaseAssignment candidate : activeAssignments()) {
            if (!candidate.anchor().sameDomain(target)) {
                continue;
            }
            long displacement = target.distance(candidate.anchor());
            if (displacement < 0 || displacement >= limit) {
                continue;
            }
            if (displacement < best) {
                best = displacement;
                tied.clear();
            }
            if (displacement == best) {
                tied.add(candidate);
            }
        }
        if (tied.isEmpty()) {
            throw new NoBaseAvailableException("no base register addresses " + target
                    + " with a " + displacementBits + "-bit displacement");
        }
        boolean allDirect = tied.stream().allMatch(BaseAssignment::direct);
        // tied is in ascending register order
        BaseAssignment chosen = allDirect ? tied.get(0) : tied.get(tied.size() - 1);
        return new BaseResolution(chosen.register(), best);
    }

    private static void checkRegister(int register) throws StatementException {
        if (register < 0 || register >= REGISTER_COUNT) {
            throw new StatementException(AssemblerErrorCode.INVALID_REGISTER, "invalid register " + register);
        }
    }
}
