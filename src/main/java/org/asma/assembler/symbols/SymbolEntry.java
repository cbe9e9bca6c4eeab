package org.asma.assembler.symbols;

import org.asma.assembler.diagnostics.InternalInvariantError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A defined symbol with its value, attributes and cross references.
 * <p>
 * The length attribute of containers and the image displacement are only known once the
 * owning container has been positioned; reading them earlier is an internal error, so
 * callers check {@link #hasAttribute(SymbolAttribute)} first.
 */
public final class SymbolEntry {

    private final String name;
    private final SymbolKind kind;
    private final int definedAt;
    private final boolean redefinable;
    private final List<Integer> references = new ArrayList<>();
    private SymbolValue value;
    private Long length;
    private int scale;
    private int integer;
    private Long imageDisplacement;

    SymbolEntry(String name, SymbolKind kind, SymbolValue value, int definedAt, boolean redefinable) {
        this.name = name;
        this.kind = kind;
        this.value = value;
        this.definedAt = definedAt;
        this.redefinable = redefinable;
    }

    public String name() {
        return name;
    }

    public SymbolKind kind() {
        return kind;
    }

    public SymbolValue value() {
        return value;
    }

    public void setValue(SymbolValue value) {
        this.value = value;
    }

    public boolean isPending() {
        return value instanceof SymbolValue.Pending;
    }

    public int definedAt() {
        return definedAt;
    }

    public boolean isRedefinable() {
        return redefinable;
    }

    /**
     * @return The statement numbers referencing this symbol, in first-reference order.
     */
    public List<Integer> references() {
        return Collections.unmodifiableList(references);
    }

    void addReference(int statementNumber) {
        if (!references.contains(statementNumber)) {
            references.add(statementNumber);
        }
    }

    void inheritReferences(SymbolEntry previous) {
        for (Integer reference : previous.references) {
            addReference(reference);
        }
    }

    public void setLength(long length) {
        this.length = length;
    }

    public void setScale(int scale) {
        this.scale = scale;
    }

    public void setInteger(int integer) {
        this.integer = integer;
    }

    public void setImageDisplacement(long displacement) {
        this.imageDisplacement = displacement;
    }

    /**
     * @return The type code: C, D, R or I for containers, A for locations, L for absolute values, U while unknown.
     */
    public char typeCode() {
        switch (kind) {
            case CSECT: return 'C';
            case DSECT: return 'D';
            case REGION: return 'R';
            case IMAGE: return 'I';
            default:
                if (value instanceof SymbolValue.AddressValue) {
                    return 'A';
                }
                if (value instanceof SymbolValue.IntegerValue) {
                    return 'L';
                }
                return 'U';
        }
    }

    public boolean hasAttribute(SymbolAttribute attribute) {
        switch (attribute) {
            case LENGTH: return length != null;
            case IMAGE_DISPLACEMENT: return imageDisplacement != null;
            default: return true;
        }
    }

    /**
     * Reads an attribute as a number. The type attribute yields its character code.
     *
     * @param attribute The attribute.
     * @return The value.
     */
    public long attribute(SymbolAttribute attribute) {
        switch (attribute) {
            case LENGTH:
                if (length == null) {
                    throw new InternalInvariantError("length of '" + name + "' read before it was set");
                }
                return length;
            case SCALE:
                return scale;
            case INTEGER:
                return integer;
            case TYPE:
                return typeCode();
            case IMAGE_DISPLACEMENT:
                if (imageDisplacement == null) {
                    throw new InternalInvariantError("image displacement of '" + name + "' read before bind");
                }
                return imageDisplacement;
            default:
                throw new IllegalArgumentException("Unknown attribute " + attribute);
        }
    }

    @Override
    public String toString() {
        return name + "=" + value;
    }
}
