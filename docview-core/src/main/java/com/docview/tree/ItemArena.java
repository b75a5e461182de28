package com.docview.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

/**
 * Owning storage for every item of one parsed document.
 *
 * <p>Items are addressed by a dense id (the root is always {@code 0}). Parent and
 * child links are stored as ids, so the arena is the only owner; dropping the
 * root releases the whole tree. The arena size doubles as the node counter of a
 * load.</p>
 *
 * @param <I> the item type stored in this arena
 */
public final class ItemArena<I extends TreeItem<I>> {

    private final List<I> items = new ArrayList<>();
    private final int capacity;

    public ItemArena(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Arena capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Creates an item through {@code factory}, which receives the id the item must carry.
     *
     * @throws IllegalStateException if the arena is full; builders check {@link #isFull()} first
     *         so they can report where in the input the limit was hit
     */
    public I allocate(IntFunction<I> factory) {
        if (isFull()) {
            throw new IllegalStateException("Arena capacity of " + capacity + " exhausted");
        }
        int id = items.size();
        I item = factory.apply(id);
        if (item.id() != id) {
            throw new IllegalStateException("Item created with id " + item.id() + ", expected " + id);
        }
        items.add(item);
        return item;
    }

    public I get(int id) {
        return items.get(id);
    }

    public boolean contains(int id) {
        return id >= 0 && id < items.size();
    }

    public I root() {
        return items.isEmpty() ? null : items.get(0);
    }

    public int size() {
        return items.size();
    }

    public int capacity() {
        return capacity;
    }

    public boolean isFull() {
        return items.size() >= capacity;
    }
}
