package org.asma.assembler.symbols;

import org.asma.assembler.address.Address;
import org.asma.assembler.api.AssemblerErrorCode;
import org.asma.assembler.diagnostics.InternalInvariantError;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link SymbolTable}.
 */
public class SymbolTableTest {

    /**
     * Verifies that names are folded to upper case by default, so that differently
     * written references find the same entry.
     */
    @Test
    @Tag("unit")
    void foldsNamesToUpperCase() throws Exception {
        // Arrange
        SymbolTable table = new SymbolTable(false);

        // Act
        table.define("loop", SymbolKind.LABEL, new SymbolValue.IntegerValue(1), 3);

        // Assert
        assertThat(table.contains("LOOP")).isTrue();
        assertThat(table.lookup("Loop").name()).isEqualTo("LOOP");
    }

    @Test
    @Tag("unit")
    void caseSensitiveTableKeepsNames() throws Exception {
        SymbolTable table = new SymbolTable(true);
        table.define("loop", SymbolKind.LABEL, new SymbolValue.IntegerValue(1), 3);

        assertThat(table.contains("loop")).isTrue();
        assertThat(table.contains("LOOP")).isFalse();
    }

    /**
     * Verifies that a second definition of the same name is rejected with a duplicate error
     * naming the first definition.
     */
    @Test
    @Tag("unit")
    void duplicateDefinitionIsRejected() throws Exception {
        // Arrange
        SymbolTable table = new SymbolTable(false);
        table.define("A", SymbolKind.LABEL, new SymbolValue.IntegerValue(1), 4);

        // Act & Assert
        assertThatThrownBy(() -> table.define("a", SymbolKind.EQUATE, new SymbolValue.IntegerValue(2), 9))
                .isInstanceOf(SymbolTableException.class)
                .hasMessageContaining("statement 4")
                .satisfies(e -> assertThat(((SymbolTableException) e).getCode()).isEqualTo(AssemblerErrorCode.DUPLICATE_SYMBOL));
    }

    @Test
    @Tag("unit")
    void redefinableEntryKeepsReferences() throws Exception {
        SymbolTable table = new SymbolTable(false);
        table.define("IMAGE", SymbolKind.IMAGE, new SymbolValue.ImageRef(), 0, true);
        table.reference("IMAGE", 5);

        SymbolEntry replaced = table.define("IMAGE", SymbolKind.LABEL, new SymbolValue.IntegerValue(7), 8);

        assertThat(replaced.kind()).isEqualTo(SymbolKind.LABEL);
        assertThat(replaced.references()).containsExactly(5);
    }

    @Test
    @Tag("unit")
    void undefinedLookupFails() {
        SymbolTable table = new SymbolTable(false);

        assertThatThrownBy(() -> table.lookup("NOPE"))
                .isInstanceOf(SymbolTableException.class)
                .satisfies(e -> assertThat(((SymbolTableException) e).getCode()).isEqualTo(AssemblerErrorCode.UNDEFINED_SYMBOL));
        assertThat(table.find("NOPE")).isEmpty();
    }

    @Test
    @Tag("unit")
    void referencesAreRecordedOncePerStatement() throws Exception {
        SymbolTable table = new SymbolTable(false);
        table.define("X", SymbolKind.LABEL, new SymbolValue.Pending("not yet"), 1);

        table.reference("X", 3);
        table.reference("x", 3);
        table.reference("X", 7);
        table.reference("UNKNOWN", 7);

        assertThat(table.lookup("X").references()).containsExactly(3, 7);
    }

    @Test
    @Tag("unit")
    void sortedEntriesAreOrderedByName() throws Exception {
        SymbolTable table = new SymbolTable(false);
        table.define("ZED", SymbolKind.LABEL, new SymbolValue.IntegerValue(1), 1);
        table.define("ALPHA", SymbolKind.LABEL, new SymbolValue.IntegerValue(1), 2);

        assertThat(table.sortedEntries()).extracting(SymbolEntry::name).containsExactly("ALPHA", "ZED");
        assertThat(table.entries()).extracting(SymbolEntry::name).containsExactly("ZED", "ALPHA");
    }

    /**
     * Verifies the type codes derived from the kind and value of an entry.
     */
    @Test
    @Tag("unit")
    void typeCodesFollowKindAndValue() throws Exception {
        SymbolTable table = new SymbolTable(false);

        assertThat(table.define("C", SymbolKind.CSECT, new SymbolValue.Pending("p"), 1).typeCode()).isEqualTo('C');
        assertThat(table.define("D", SymbolKind.DSECT, new SymbolValue.Pending("p"), 2).typeCode()).isEqualTo('D');
        assertThat(table.define("R", SymbolKind.REGION, new SymbolValue.RegionRef(0), 3).typeCode()).isEqualTo('R');
        assertThat(table.define("I", SymbolKind.IMAGE, new SymbolValue.ImageRef(), 4).typeCode()).isEqualTo('I');
        assertThat(table.define("A", SymbolKind.LABEL,
                new SymbolValue.AddressValue(Address.absolute(0)), 5).typeCode()).isEqualTo('A');
        assertThat(table.define("L", SymbolKind.EQUATE, new SymbolValue.IntegerValue(15), 6).typeCode()).isEqualTo('L');
        assertThat(table.define("U", SymbolKind.EQUATE, new SymbolValue.Pending("p"), 7).typeCode()).isEqualTo('U');
    }

    @Test
    @Tag("unit")
    void lengthMustBeSetBeforeItIsRead() throws Exception {
        SymbolTable table = new SymbolTable(false);
        SymbolEntry entry = table.define("F", SymbolKind.LABEL, new SymbolValue.Pending("p"), 1);

        assertThat(entry.hasAttribute(SymbolAttribute.LENGTH)).isFalse();
        assertThatThrownBy(() -> entry.attribute(SymbolAttribute.LENGTH)).isInstanceOf(InternalInvariantError.class);

        entry.setLength(4);

        assertThat(entry.attribute(SymbolAttribute.LENGTH)).isEqualTo(4);
        assertThat(entry.attribute(SymbolAttribute.TYPE)).isEqualTo('U');
    }
}
