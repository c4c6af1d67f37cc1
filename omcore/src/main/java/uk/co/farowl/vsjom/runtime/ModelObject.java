// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjom.runtime;

/**
 * An object of the modelled language: either a {@link ModelClass} or a
 * {@link ModelInstance}. Every object has exactly one class (its
 * <i>type</i>) and storage for its own attributes.
 * <p>
 * The methods {@link #rawRead(String)} and
 * {@link #rawWrite(String, Object)} are the storage primitives. They
 * see only the object's own storage, never its class, and no hook is
 * consulted. User-facing attribute access goes through {@link Abstract}.
 */
public abstract sealed class ModelObject
        permits ModelClass, ModelInstance {

    /**
     * The value returned by the storage primitives and by class-side
     * lookup when there is no such attribute. It is never a legal
     * attribute value, while {@code null} is.
     */
    public static final Object ABSENT = new Object() {
        @Override
        public String toString() { return "<absent>"; }
    };

    /**
     * The class of this object. For a class, this is its metaclass.
     *
     * @return the class of this object
     */
    public abstract ModelClass getType();

    /**
     * Read an attribute from the object's own storage.
     *
     * @param name of the attribute
     * @return the value or {@link #ABSENT}
     */
    public abstract Object rawRead(String name);

    /**
     * Write an attribute into the object's own storage, creating it if
     * necessary.
     *
     * @param name of the attribute
     * @param value to store (not {@link #ABSENT})
     */
    public abstract void rawWrite(String name, Object value);
}
