// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjom.runtime;

/**
 * Raised when a value that is neither an {@link Invocable} nor an
 * object whose class defines {@code __call__} is called.
 */
public class NotCallable extends ObjectModelException {
    private static final long serialVersionUID = 1L;

    /**
     * Create an exception for the given value.
     *
     * @param callable the value that could not be called
     */
    public NotCallable(Object callable) {
        super("'%s' object is not callable", typeName(callable));
    }

    private static String typeName(Object v) {
        if (v instanceof ModelObject o) {
            return o.getType().getName();
        } else if (v == null) {
            return "null";
        } else {
            return v.getClass().getSimpleName();
        }
    }
}
