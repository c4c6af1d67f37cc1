// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjom.runtime;

/**
 * A value that, found on the class of an object by an attribute read,
 * decides itself what that read returns. It is the Java form of a value
 * with a bind hook ({@code __get__}). The result need not be the
 * descriptor, nor a bound method: a {@link Property} returns a value
 * computed from the object.
 * <p>
 * A descriptor that is also {@link Invocable} is treated as a
 * descriptor: this method, not {@link Invocable#bind(ModelObject,
 * ModelClass)}, makes the result.
 */
@FunctionalInterface
public interface Descriptor {

    /**
     * The {@code __get__} special method of the descriptor protocol.
     *
     * @param obj object on which the attribute is sought
     * @param type the class of {@code obj}, on which this was found
     * @return the value of the attribute read
     * @throws Throwable from the implementation
     */
    Object __get__(ModelObject obj, ModelClass type) throws Throwable;
}
