package org.asma.assembler.address;

import org.asma.assembler.diagnostics.InternalInvariantError;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class AddressTest {

    private static final SectionHandle CODE = new SectionHandle(0, "CODE", false);
    private static final SectionHandle DATA = new SectionHandle(1, "DATA", false);
    private static final SectionHandle MAP = new SectionHandle(2, "MAP", true);

    @Test
    void distanceWithinSameSection() {
        Address a = Address.relative(CODE, 0x10);
        Address b = Address.relative(CODE, 0x4);

        assertThat(a.distance(b)).isEqualTo(0xC);
        assertThat(b.distance(a)).isEqualTo(-0xC);
    }

    @Test
    void distanceBetweenAbsoluteAddresses() {
        assertThat(Address.absolute(0x2000).distance(Address.absolute(0x1000))).isEqualTo(0x1000);
    }

    @Test
    void distanceAcrossSectionsIsRejected() {
        Address a = Address.relative(CODE, 0);
        Address b = Address.relative(DATA, 0);

        assertThat(a.sameDomain(b)).isFalse();
        assertThatThrownBy(() -> a.distance(b)).isInstanceOf(AddressException.class);
    }

    @Test
    void distanceBetweenRelativeAndAbsoluteIsRejected() {
        assertThatThrownBy(() -> Address.relative(CODE, 4).distance(Address.absolute(4)))
                .isInstanceOf(AddressException.class);
    }

    @Test
    void addingDummyDisplacementActsAsInteger() {
        Address field = Address.relative(MAP, 8);
        Address base = Address.absolute(0x1000);

        assertThat(base.plus(field)).isEqualTo(Address.absolute(0x1008));
        assertThat(field.plus(base)).isEqualTo(Address.absolute(0x1008));
    }

    @Test
    void addingTwoControlSectionAddressesIsRejected() {
        assertThatThrownBy(() -> Address.relative(CODE, 4).plus(Address.relative(CODE, 8)))
                .isInstanceOf(AddressException.class);
    }

    @Test
    void arithmeticBelowZeroIsRejected() {
        assertThatThrownBy(() -> Address.relative(CODE, 4).minus(8)).isInstanceOf(AddressException.class);
        assertThatThrownBy(() -> Address.absolute(4).minus(5)).isInstanceOf(AddressException.class);
    }

    @Test
    void plusKeepsImpliedLength() {
        Address.Relative field = Address.relative(CODE, 0).withLength(4);

        assertThat(field.plus(2).length()).isEqualTo(4);
        assertThat(field.plus(2).offset()).isEqualTo(2);
    }

    @Test
    void bindingConvertsRelativeToAbsolute() {
        Address.Relative relative = new Address.Relative(CODE, 0x24, 2);

        Address.Absolute absolute = relative.toAbsolute(0x1000);

        assertThat(absolute.value()).isEqualTo(0x1024);
        assertThat(absolute.length()).isEqualTo(2);
        assertThat(absolute.isAbsolute()).isTrue();
    }

    @Test
    void dummySectionAddressesNeverBecomeAbsolute() {
        assertThatThrownBy(() -> Address.relative(MAP, 4).toAbsolute(0x1000))
                .isInstanceOf(InternalInvariantError.class);
    }
}
