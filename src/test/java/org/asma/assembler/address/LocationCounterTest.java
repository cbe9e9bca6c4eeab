package org.asma.assembler.address;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class LocationCounterTest {

    @Test
    void emptyUntilEstablished() {
        LocationCounter counter = new LocationCounter();

        assertThat(counter.current()).isEmpty();
    }

    @Test
    void incrementsFromEstablishedAddress() {
        // Arrange
        LocationCounter counter = new LocationCounter();
        SectionHandle section = new SectionHandle(0, "", false);

        // Act
        counter.establish(Address.relative(section, 8));
        counter.increment(4);
        counter.increment(2);

        // Assert
        assertThat(counter.current()).contains(Address.relative(section, 14));
    }

    @Test
    void establishDiscardsEarlierIncrements() {
        LocationCounter counter = new LocationCounter();
        counter.establish(Address.absolute(0x100));
        counter.increment(16);

        counter.establish(Address.absolute(0x200));

        assertThat(counter.current()).contains(Address.absolute(0x200));
    }

    @Test
    void clearForgetsLocation() {
        LocationCounter counter = new LocationCounter();
        counter.establish(Address.absolute(0x100));

        counter.clear();

        assertThat(counter.current()).isEmpty();
    }

    @Test
    void negativeIncrementIsRejected() {
        LocationCounter counter = new LocationCounter();
        counter.establish(Address.absolute(0));

        assertThatThrownBy(() -> counter.increment(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
