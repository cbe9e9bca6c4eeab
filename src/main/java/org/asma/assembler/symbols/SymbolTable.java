package org.asma.assembler.symbols;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Holds every symbol of an assembly run.
 * <p>
 * Names are folded to upper case unless the table is case sensitive. A name can only be
 * defined once; entries created as redefinable may be replaced and keep their references.
 */
public class SymbolTable {

    private final Map<String, SymbolEntry> entries = new LinkedHashMap<>();
    private final boolean caseSensitive;

    /**
     * @param caseSensitive {@code true} to keep names as written.
     */
    public SymbolTable(boolean caseSensitive) {
        this.caseSensitive = caseSensitive;
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    /**
     * Normalizes a name according to the table's case rule.
     * @param name The name as written.
     * @return The key under which the symbol is stored.
     */
    public String normalize(String name) {
        return caseSensitive ? name : name.toUpperCase(Locale.ROOT);
    }

    /**
     * Defines a new symbol.
     *
     * @param name      The name.
     * @param kind      What the name denotes.
     * @param value     The initial value.
     * @param statement The defining statement number.
     * @return The new entry.
     * @throws SymbolTableException if the name is already defined and not redefinable.
     */
    public SymbolEntry define(String name, SymbolKind kind, SymbolValue value, int statement) throws SymbolTableException {
        return define(name, kind, value, statement, false);
    }

    /**
     * Defines a symbol, optionally allowing it to be replaced later.
     *
     * @param name        The name.
     * @param kind        What the name denotes.
     * @param value       The initial value.
     * @param statement   The defining statement number.
     * @param redefinable {@code true} if a later definition may replace this one.
     * @return The new entry.
     * @throws SymbolTableException if the name is already defined and not redefinable.
     */
    public SymbolEntry define(String name, SymbolKind kind, SymbolValue value, int statement, boolean redefinable)
            throws SymbolTableException {
        String key = normalize(name);
        SymbolEntry existing = entries.get(key);
        if (existing != null && !existing.isRedefinable()) {
            throw SymbolTableException.duplicate(key, existing.definedAt());
        }
        SymbolEntry entry = new SymbolEntry(key, kind, value, statement, redefinable);
        if (existing != null) {
            entry.inheritReferences(existing);
        }
        entries.put(key, entry);
        return entry;
    }

    /**
     * Records that a statement references a symbol. Repeated references from the same
     * statement are recorded once. References to unknown names are ignored.
     *
     * @param name      The name.
     * @param statement The referencing statement number.
     */
    public void reference(String name, int statement) {
        SymbolEntry entry = entries.get(normalize(name));
        if (entry != null) {
            entry.addReference(statement);
        }
    }

    /**
     * Looks up a symbol.
     *
     * @param name The name.
     * @return The entry.
     * @throws SymbolTableException if the symbol is not defined.
     */
    public SymbolEntry lookup(String name) throws SymbolTableException {
        SymbolEntry entry = entries.get(normalize(name));
        if (entry == null) {
            throw SymbolTableException.undefined(normalize(name));
        }
        return entry;
    }

    public Optional<SymbolEntry> find(String name) {
        return Optional.ofNullable(entries.get(normalize(name)));
    }

    public boolean contains(String name) {
        return entries.containsKey(normalize(name));
    }

    /**
     * @return All entries in definition order.
     */
    public List<SymbolEntry> entries() {
        return new ArrayList<>(entries.values());
    }

    /**
     * @return All entries sorted by name, as printed in a cross reference.
     */
    public List<SymbolEntry> sortedEntries() {
        List<SymbolEntry> sorted = entries();
        sorted.sort(Comparator.comparing(SymbolEntry::name));
        return sorted;
    }

    public int size() {
        return entries.size();
    }
}
