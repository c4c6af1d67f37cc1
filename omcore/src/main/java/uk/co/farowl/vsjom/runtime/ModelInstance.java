// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjom.runtime;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import uk.co.farowl.vsjom.runtime.kernel.Layout;
import uk.co.farowl.vsjom.support.InterpreterError;

/**
 * An instance of a {@link ModelClass}. An instance has no table of its
 * own: its attribute values are held in an array whose meaning, slot by
 * slot, is given by a {@link Layout} shared with every other instance
 * that acquired the same attributes in the same order.
 * <p>
 * An instance starts with the empty layout of its class system. When an
 * attribute is written for the first time, the instance moves to the
 * successor layout and the value is appended. It never moves back.
 */
public final class ModelInstance extends ModelObject {

    private static final int INITIAL_CAPACITY = 4;

    /** The class of this instance. */
    private final ModelClass type;

    /** Describes the meaning of {@link #storage}. */
    private Layout layout;

    /** Attribute values indexed by slot in {@link #layout}. */
    private Object[] storage;

    /**
     * Create an instance with no attributes. Instances are made by
     * {@link ClassSystem#newInstance(ModelObject)}.
     *
     * @param type of the instance
     * @param empty the empty layout of the class system
     */
    ModelInstance(ModelClass type, Layout empty) {
        this.type = type;
        this.layout = empty;
        this.storage = new Object[INITIAL_CAPACITY];
    }

    @Override
    public ModelClass getType() { return type; }

    @Override
    public Object rawRead(String name) {
        int slot = layout.slotOf(name);
        return slot < 0 ? ABSENT : storage[slot];
    }

    @Override
    public void rawWrite(String name, Object value) {
        if (value == ABSENT) {
            throw new InterpreterError(ModelClass.ABSENT_VALUE, name,
                    type.getName());
        }
        int slot = layout.slotOf(name);
        if (slot < 0) {
            // First write of this name: move to the successor layout.
            slot = layout.size();
            layout = layout.extend(name);
            if (slot >= storage.length) {
                storage = Arrays.copyOf(storage, 2 * storage.length);
            }
        }
        storage[slot] = value;
    }

    /**
     * The current layout of this instance. This is for diagnostic use.
     *
     * @return the current layout
     */
    public Layout getLayout() { return layout; }

    /**
     * A snapshot of the attribute values of this instance in slot
     * order. This is for diagnostic use.
     *
     * @return the values in slot order
     */
    public List<Object> storage() {
        return Collections.unmodifiableList(
                Arrays.asList(Arrays.copyOf(storage, layout.size())));
    }

    @Override
    public String toString() {
        return String.format("<%s object @%x>", type.getName(),
                System.identityHashCode(this));
    }
}
