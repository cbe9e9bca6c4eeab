package org.asma.assembler.content;

import org.asma.assembler.address.Address;
import org.asma.assembler.diagnostics.InternalInvariantError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A container of image content with its own allocation cursor.
 * <p>
 * Children are positioned in order: each is aligned, given the current cursor as its
 * address, and the cursor advances by its length. The container's length is the highest
 * cursor position reached relative to its base, so an ORG backwards never shrinks it.
 *
 * @param <C> The type of the children.
 */
public abstract class Content<C extends Binary> extends Binary {

    /** The longest container the image can hold. */
    public static final long MAX_LENGTH = Integer.MAX_VALUE - 8;

    private final List<C> children = new ArrayList<>();
    private final long base;
    private long current;
    private long highWater;
    private boolean frozen;

    protected Content(int alignment, long start) {
        super(alignment, 0);
        this.base = start;
        this.current = start;
    }

    /**
     * @return The address the next child would receive before alignment.
     */
    public abstract Address currentAddress();

    @Override
    public long length() {
        return highWater;
    }

    @Override
    public void setLength(long newLength) {
        throw new InternalInvariantError("the length of a container is derived from its content");
    }

    public List<C> children() {
        return Collections.unmodifiableList(children);
    }

    protected long base() {
        return base;
    }

    protected long cursor() {
        return current;
    }

    /**
     * Appends a child. A child belongs to exactly one container.
     * @param child The child to append.
     */
    public void append(C child) {
        if (frozen) {
            throw new InternalInvariantError("cannot append to a frozen container");
        }
        child.attach(this);
        children.add(child);
    }

    /**
     * Rounds the cursor up to the child's alignment.
     * @param child The child about to be positioned.
     */
    protected void align(C child) {
        int alignment = child.alignment();
        if (alignment >= 2) {
            current = (current + alignment - 1) & -((long) alignment);
        }
        alloc();
    }

    /**
     * Extends the allocated length to the cursor.
     */
    protected void alloc() {
        highWater = Math.max(highWater, current - base);
    }

    /**
     * @param child A child about to be positioned.
     * @return The length of this container relative to its base once the child is positioned.
     */
    protected long lengthWith(C child) {
        int alignment = child.alignment();
        long start = alignment >= 2 ? (current + alignment - 1) & -((long) alignment) : current;
        return Math.max(highWater, start - base + child.length());
    }

    /**
     * Aligns and positions a child at the cursor and advances the cursor past it.
     * @param child The child.
     */
    protected void assign(C child) {
        if (child.container() != this) {
            throw new InternalInvariantError("child is positioned by a container that does not own it");
        }
        if (!child.hasKnownLength()) {
            throw new InternalInvariantError("child positioned before its length is known");
        }
        align(child);
        child.assign(currentAddress());
        current += child.length();
        alloc();
    }

    /**
     * Positions every child in order.
     */
    public void assignAll() {
        for (C child : children) {
            assign(child);
        }
    }

    /**
     * Moves the cursor to a new position within this container.
     * @param position The cursor position, in the same coordinates as the base.
     */
    protected void moveCursor(long position) {
        current = position;
        alloc();
    }

    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Decides whether a child's bytes take part in {@link #insert()}.
     * @param child The child.
     * @return {@code true} to copy the child's bytes.
     */
    protected boolean contributes(C child) {
        return true;
    }

    /**
     * Builds this container's bytes from its children, bottom-up. Children that were
     * never built or have no length leave zeros behind.
     *
     * @return The bytes of the container.
     */
    public byte[] insert() {
        if (length() > MAX_LENGTH) {
            throw new InternalInvariantError(this + " is too long for the image: " + length());
        }
        byte[] buffer = new byte[Math.toIntExact(length())];
        for (C child : children) {
            if (child.length() == 0 || !contributes(child)) {
                continue;
            }
            byte[] data = child instanceof Content<?> content ? content.insert() : child.rawBytes();
            if (data == null) {
                continue;
            }
            int offset = Math.toIntExact(child.imageOffset() - imageOffset());
            System.arraycopy(data, 0, buffer, offset, data.length);
        }
        setRawBytes(buffer);
        return buffer;
    }
}
