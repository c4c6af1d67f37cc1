// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjom.runtime;

/**
 * A {@link Descriptor} that computes the value of an attribute from the
 * object through which it is read, for example a value derived from
 * other attributes. It is read-only: writes go to the write hook like
 * any other.
 */
public final class Property implements Descriptor {

    /** Computes the value of a {@code Property} for an object. */
    @FunctionalInterface
    public interface Getter {
        /**
         * @param obj through which the attribute is read
         * @return the value of the attribute
         * @throws Throwable from the implementation
         */
        Object get(ModelObject obj) throws Throwable;
    }

    /** Name of the attribute, used in messages. */
    private final String name;

    /** The implementation. */
    private final Getter getter;

    /**
     * Create a property.
     *
     * @param name of the attribute
     * @param getter computing its value
     */
    public Property(String name, Getter getter) {
        this.name = name;
        this.getter = getter;
    }

    @Override
    public Object __get__(ModelObject obj, ModelClass type)
            throws Throwable {
        return getter.get(obj);
    }

    /** @return the name of the attribute */
    public String getName() { return name; }

    @Override
    public String toString() { return "<property '" + name + "'>"; }
}
