// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjom.runtime.kernel;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

import uk.co.farowl.vsjom.support.InterpreterError;

/**
 * A {@code Layout} (elsewhere called a "hidden class" or "map")
 * describes which attribute names occupy which storage slots in an
 * instance. Instances that acquire the same attribute names in the same
 * order share one {@code Layout}, so that storage is a plain array
 * indexed by slot and the description of it exists only once.
 * <p>
 * A {@code Layout} is immutable once published, except for its table of
 * transitions, which caches the successor reached by adding one more
 * name. Layouts therefore form a tree rooted at the empty layout of
 * their {@link LayoutCache}, keyed by the order in which names were
 * added. Adding {@code x} then {@code y} leads to a different layout
 * from adding {@code y} then {@code x}.
 *
 * @implNote Extension is not synchronised. A host that extends layouts
 *     from several threads must serialise those calls itself.
 */
public final class Layout {

    /** The cache to which this layout belongs. */
    private final LayoutCache cache;

    /** Layout this was extended from, or {@code null} in the root. */
    private final Layout parent;

    /** Name to slot index, in slot order (read-only). */
    private final Map<String, Integer> slots;

    /**
     * Successor layouts by the name added. Created on first extension,
     * since most layouts in a large tree are leaves.
     */
    private Map<String, Layout> transitions;

    /**
     * Create the empty layout at the root of a cache.
     *
     * @param cache to which this layout belongs
     */
    Layout(LayoutCache cache) {
        this.cache = cache;
        this.parent = null;
        this.slots = Collections.emptyMap();
    }

    /**
     * Create the successor of a given layout by adding one name at the
     * next free slot.
     *
     * @param parent layout to extend
     * @param name to add
     */
    private Layout(Layout parent, String name) {
        this.cache = parent.cache;
        this.parent = parent;
        Map<String, Integer> s = new LinkedHashMap<>(parent.slots);
        s.put(name, parent.size());
        this.slots = Collections.unmodifiableMap(s);
    }

    /**
     * Return the slot index of the given attribute name, or -1 if this
     * layout has no slot for it.
     *
     * @param name of the attribute
     * @return slot index or -1
     */
    public int slotOf(String name) {
        Integer i = slots.get(name);
        return i == null ? -1 : i;
    }

    /**
     * Return the layout that has all the names of this one, followed by
     * {@code name} at the next free slot. The first call for a given
     * name creates the successor and every later one returns that same
     * object.
     *
     * @param name to add (not already present)
     * @return the successor layout
     * @throws InterpreterError if {@code name} already has a slot
     */
    public Layout extend(String name) throws InterpreterError {
        Objects.requireNonNull(name, "attribute name");
        if (slots.containsKey(name)) {
            throw new InterpreterError(NAME_PRESENT, name, this);
        }
        Layout next;
        if (transitions == null) {
            transitions = new HashMap<>(4);
            next = null;
        } else {
            next = transitions.get(name);
        }
        if (next == null) {
            next = new Layout(this, name);
            transitions.put(name, next);
            cache.created(next);
        }
        return next;
    }

    private static final String NAME_PRESENT =
            "cannot extend by '%s': already a slot in %s";

    /** @return number of slots in this layout */
    public int size() { return slots.size(); }

    /** @return the attribute names in slot order */
    public List<String> names() { return List.copyOf(slots.keySet()); }

    /**
     * Return a read-only view of the mapping from name to slot, in
     * which iteration is in slot order. This is for diagnostic use.
     *
     * @return name to slot index
     */
    public Map<String, Integer> slots() { return slots; }

    /**
     * @return the layout this was extended from, or {@code null} for
     *     the empty layout
     */
    public Layout parent() { return parent; }

    /** @return the number of successor layouts cached here */
    public int transitionCount() {
        return transitions == null ? 0 : transitions.size();
    }

    /** @return the cache to which this layout belongs */
    public LayoutCache getCache() { return cache; }

    @Override
    public String toString() {
        StringJoiner sj = new StringJoiner(", ", "Layout{", "}");
        for (Map.Entry<String, Integer> e : slots.entrySet()) {
            sj.add(e.getKey() + ":" + e.getValue());
        }
        return sj.toString();
    }
}
