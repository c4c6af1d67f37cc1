// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjom.runtime;

/**
 * The names of the hooks that the object model looks for on classes.
 * Each is found by class-side lookup only, never through the attribute
 * read protocol itself.
 */
public enum SpecialMethod {

    /**
     * Attribute-miss hook, called as {@code (obj, name)} when a read
     * finds nothing else.
     */
    op_getattr("__getattr__"),

    /**
     * Attribute-write hook, called as {@code (obj, name, value)} by
     * every write. The universal base class defines the default.
     */
    op_setattr("__setattr__"),

    /**
     * Bind hook of a descriptor defined in the modelled language,
     * called as {@code (descr, obj, type)}.
     */
    op_get("__get__"),

    /**
     * Call hook of an object defined in the modelled language, called
     * as {@code (obj, args...)}.
     */
    op_call("__call__");

    /** Name of the attribute on the class. */
    public final String methodName;

    SpecialMethod(String methodName) { this.methodName = methodName; }
}
