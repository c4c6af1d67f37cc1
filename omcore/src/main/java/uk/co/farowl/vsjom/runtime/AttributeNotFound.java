// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjom.runtime;

/**
 * Raised when reading an attribute that the object does not hold, its
 * class does not define and no attribute-miss hook supplies. A miss hook
 * may raise this itself to signal that it could not supply the name
 * either.
 */
public class AttributeNotFound extends ObjectModelException {
    private static final long serialVersionUID = 1L;

    /** The object that didn't have {@code name} as an attribute. */
    private final transient Object obj;

    /** The problematic attribute name. */
    private final String name;

    /**
     * Create an exception for the given object and attribute name.
     *
     * @param obj that did not have the attribute
     * @param name of the attribute
     */
    public AttributeNotFound(Object obj, String name) {
        super("%s has no attribute '%s'", describe(obj), name);
        this.obj = obj;
        this.name = name;
    }

    /** @return the name of the attribute not found */
    public String getName() { return name; }

    /** @return the object that did not have the attribute */
    public Object getObject() { return obj; }

    private static String describe(Object obj) {
        if (obj instanceof ModelClass c) {
            return "class '" + c.getName() + "'";
        } else if (obj instanceof ModelObject o) {
            return "'" + o.getType().getName() + "' object";
        } else {
            return String.valueOf(obj);
        }
    }
}
