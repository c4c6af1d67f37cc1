// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjom.runtime;

/**
 * A value that may be called: a method body supplied by the front end,
 * a {@link JavaFunction}, or a {@link BoundMethod}. The object model
 * treats the body as opaque and only calls it.
 * <p>
 * When an {@code Invocable} is found on the class of an object by an
 * attribute read, the read returns the result of
 * {@link #bind(ModelObject, ModelClass)}, which by default is a
 * {@link BoundMethod} supplying the object as the first argument.
 */
@FunctionalInterface
public interface Invocable {

    /**
     * Call the object with arguments given by position.
     *
     * @param args arguments given by position
     * @return result of the invocation
     * @throws ArgumentError if the arguments are not acceptable
     * @throws Throwable from the implementation
     */
    Object call(Object... args) throws ArgumentError, Throwable;

    /**
     * Bind this to the object on which it was found (through the class
     * of that object) by an attribute read.
     *
     * @implSpec The default returns a {@link BoundMethod}.
     *
     * @param self object through which this was read
     * @param type the class of {@code self}
     * @return the value the attribute read returns
     */
    default Object bind(ModelObject self, ModelClass type) {
        return new BoundMethod(this, self);
    }
}
