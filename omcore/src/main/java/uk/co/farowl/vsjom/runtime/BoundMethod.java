// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjom.runtime;

import uk.co.farowl.vsjom.support.internal.Util;

/**
 * An {@link Invocable} found on the class of an object, bound to that
 * object. Calling it calls the underlying function with the object
 * inserted as the first argument. A new one is made at each attribute
 * read and the object model keeps no reference to it.
 */
public final class BoundMethod implements Invocable {

    /** The function being bound. */
    private final Invocable function;

    /** The target object supplied as the first argument. */
    private final Object self;

    /**
     * Bind a function to its target.
     *
     * @param function to bind
     * @param self to which the function is bound
     */
    public BoundMethod(Invocable function, Object self) {
        this.function = function;
        this.self = self;
    }

    @Override
    public Object call(Object... args) throws ArgumentError, Throwable {
        return function.call(Util.prepend(self, args));
    }

    /**
     * {@inheritDoc}
     * <p>
     * A bound method is not bound again: it returns itself.
     */
    @Override
    public Object bind(ModelObject self, ModelClass type) { return this; }

    /** @return the function being bound */
    public Invocable getFunction() { return function; }

    /** @return the object to which the function is bound */
    public Object getSelf() { return self; }

    @Override
    public String toString() {
        return "<bound method " + function + " of " + self + ">";
    }
}
