package org.asma.assembler.base;

import org.asma.assembler.address.Address;
import org.asma.assembler.address.SectionHandle;
import org.asma.assembler.api.AssemblerErrorCode;
import org.asma.assembler.diagnostics.StatementException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class BaseManagerTest {

    @Test
    void directRegisterZeroAddressesLowStorage() throws Exception {
        BaseManager bases = new BaseManager(DirectMode.STANDARD);

        BaseResolution resolution = bases.resolve(Address.absolute(0x10), 12);

        assertThat(resolution).isEqualTo(new BaseResolution(0, 0x10));
    }

    @Test
    void smallestDisplacementWins() throws Exception {
        BaseManager bases = new BaseManager(DirectMode.STANDARD);
        bases.assign(12, Address.absolute(0x1000));
        bases.assign(11, Address.absolute(0x1800));

        assertThat(bases.resolve(Address.absolute(0x1900), 12)).isEqualTo(new BaseResolution(11, 0x100));
        assertThat(bases.resolve(Address.absolute(0x1100), 12)).isEqualTo(new BaseResolution(12, 0x100));
    }

    @Test
    void tieBetweenUserRegistersPicksHighest() throws Exception {
        // Arrange
        BaseManager bases = new BaseManager(DirectMode.STANDARD);
        bases.assign(5, Address.absolute(0x1000));
        bases.assign(9, Address.absolute(0x1000));

        // Act
        BaseResolution resolution = bases.resolve(Address.absolute(0x1004), 12);

        // Assert
        assertThat(resolution).isEqualTo(new BaseResolution(9, 4));
    }

    @Test
    void tieBetweenDirectAndUserRegisterPicksHighest() throws Exception {
        // R1 directly addresses 0x1000-0x1FFF in extended mode
        BaseManager bases = new BaseManager(DirectMode.EXTENDED);
        bases.assign(12, Address.absolute(0x1000));

        assertThat(bases.resolve(Address.absolute(0x1004), 12)).isEqualTo(new BaseResolution(12, 4));
    }

    @Test
    void userRegisterZeroShadowsDirectAssignment() throws Exception {
        BaseManager bases = new BaseManager(DirectMode.EXTENDED);
        bases.assign(0, Address.absolute(0x1000));

        // R0 (user) and R1 (direct) tie; not all tied candidates are direct
        assertThat(bases.resolve(Address.absolute(0x1004), 12)).isEqualTo(new BaseResolution(1, 4));
        assertThat(bases.active(0)).hasValueSatisfying(a -> assertThat(a.direct()).isFalse());

        bases.drop(0);

        assertThat(bases.active(0)).hasValueSatisfying(a -> assertThat(a.direct()).isTrue());
        assertThat(bases.resolve(Address.absolute(0x10), 12)).isEqualTo(new BaseResolution(0, 0x10));
    }

    @Test
    void extendedModeCoversFirst32K() throws Exception {
        BaseManager bases = new BaseManager(DirectMode.EXTENDED);

        assertThat(bases.resolve(Address.absolute(0x7FFF), 12)).isEqualTo(new BaseResolution(7, 0xFFF));
        assertThatThrownBy(() -> bases.resolve(Address.absolute(0x8000), 12))
                .isInstanceOf(NoBaseAvailableException.class);
    }

    @Test
    void addressBelowEveryAnchorIsUnreachable() throws Exception {
        BaseManager bases = new BaseManager(DirectMode.STANDARD);
        bases.assign(12, Address.absolute(0x2000));

        assertThatThrownBy(() -> bases.resolve(Address.absolute(0x1FFF), 12))
                .isInstanceOf(NoBaseAvailableException.class)
                .satisfies(e -> assertThat(((StatementException) e).getCode()).isEqualTo(AssemblerErrorCode.NO_BASE_AVAILABLE));
    }

    @Test
    void longDisplacementReachesFurther() throws Exception {
        BaseManager bases = new BaseManager(DirectMode.STANDARD);
        bases.assign(12, Address.absolute(0x1000));
        Address target = Address.absolute(0x1000 + 0x10000);

        assertThat(bases.resolve(target, 20)).isEqualTo(new BaseResolution(12, 0x10000));
        assertThatThrownBy(() -> bases.resolve(target, 12)).isInstanceOf(NoBaseAvailableException.class);
    }

    @Test
    void dummySectionAnchorResolvesFieldsOfTheSameSection() throws Exception {
        SectionHandle map = new SectionHandle(3, "MAP", true);
        SectionHandle other = new SectionHandle(4, "OTHER", true);
        BaseManager bases = new BaseManager(DirectMode.STANDARD);
        bases.assign(3, Address.relative(map, 0));

        assertThat(bases.resolve(Address.relative(map, 8), 12)).isEqualTo(new BaseResolution(3, 8));
        assertThatThrownBy(() -> bases.resolve(Address.relative(other, 8), 12))
                .isInstanceOf(NoBaseAvailableException.class);
    }

    @Test
    void controlSectionAnchorIsRejected() {
        BaseManager bases = new BaseManager(DirectMode.STANDARD);
        SectionHandle code = new SectionHandle(0, "CODE", false);

        assertThatThrownBy(() -> bases.assign(12, Address.relative(code, 0)))
                .isInstanceOf(StatementException.class)
                .satisfies(e -> assertThat(((StatementException) e).getCode()).isEqualTo(AssemblerErrorCode.INVALID_BASE_ANCHOR));
    }

    @Test
    void invalidRegisterIsRejected() {
        BaseManager bases = new BaseManager(DirectMode.STANDARD);

        assertThatThrownBy(() -> bases.assign(16, Address.absolute(0)))
                .isInstanceOf(StatementException.class)
                .satisfies(e -> assertThat(((StatementException) e).getCode()).isEqualTo(AssemblerErrorCode.INVALID_REGISTER));
        assertThatThrownBy(() -> bases.drop(-1)).isInstanceOf(StatementException.class);
    }

    @Test
    void dropIsIdempotent() throws Exception {
        BaseManager bases = new BaseManager(DirectMode.STANDARD);
        bases.assign(12, Address.absolute(0x1000));

        bases.drop(12);
        bases.drop(12);

        assertThat(bases.active(12)).isEmpty();
        assertThat(bases.activeAssignments()).extracting(BaseAssignment::register).containsExactly(0);
    }

    @Test
    void reassignmentReplacesAnchor() throws Exception {
        BaseManager bases = new BaseManager(DirectMode.STANDARD);
        bases.assign(12, Address.absolute(0x1000));
        bases.assign(12, Address.absolute(0x3000));

        assertThat(bases.resolve(Address.absolute(0x3008), 12)).isEqualTo(new BaseResolution(12, 8));
        assertThatThrownBy(() -> bases.resolve(Address.absolute(0x1008), 12)).isInstanceOf(NoBaseAvailableException.class);
    }

    /**
     * Compares the resolver against an exhaustive search over random USING sets and checks
     * that the order of the USING statements never changes the outcome.
     */
    @Test
    void resolutionMatchesExhaustiveSearchAndIgnoresUsingOrder() throws Exception {
        Random random = new Random(370);
        for (int round = 0; round < 200; round++) {
            // Arrange
            List<int[]> usings = new ArrayList<>();
            for (int register = 1; register < 16; register++) {
                if (random.nextBoolean()) {
                    // anchors on a coarse grid so that ties happen often
                    usings.add(new int[]{register, random.nextInt(8) * 0x400});
                }
            }
            long target = random.nextInt(0x3000);
            List<int[]> shuffled = new ArrayList<>(usings);
            Collections.shuffle(shuffled, random);

            BaseManager inOrder = managerWith(usings);
            BaseManager outOfOrder = managerWith(shuffled);

            // Act
            BaseResolution expected = exhaustive(usings, target);
            BaseResolution first = resolveOrNull(inOrder, target);
            BaseResolution second = resolveOrNull(outOfOrder, target);

            // Assert
            assertThat(first).as("round %d", round).isEqualTo(expected);
            assertThat(second).as("round %d shuffled", round).isEqualTo(expected);
        }
    }

    private static BaseManager managerWith(List<int[]> usings) throws StatementException {
        BaseManager bases = new BaseManager(DirectMode.STANDARD);
        for (int[] using : usings) {
            bases.assign(using[0], Address.absolute(using[1]));
        }
        return bases;
    }

    private static BaseResolution resolveOrNull(BaseManager bases, long target) {
        try {
            return bases.resolve(Address.absolute(target), 12);
        } catch (NoBaseAvailableException e) {
            return null;
        }
    }

    private static BaseResolution exhaustive(List<int[]> usings, long target) {
        BaseResolution best = target < 0x1000 ? new BaseResolution(0, target) : null;
        for (int[] using : usings) {
            long displacement = target - using[1];
            if (displacement < 0 || displacement >= 0x1000) {
                continue;
            }
            // any tie involving a user register goes to the highest register
            if (best == null || displacement < best.displacement()
                    || (displacement == best.displacement() && using[0] > best.register())) {
                best = new BaseResolution(using[0], displacement);
            }
        }
        return best;
    }
}
