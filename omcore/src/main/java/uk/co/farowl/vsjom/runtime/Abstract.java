// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjom.runtime;

import static uk.co.farowl.vsjom.runtime.ModelObject.ABSENT;

import uk.co.farowl.vsjom.support.InterpreterError;
import uk.co.farowl.vsjom.support.internal.Util;

/**
 * The "abstract interface" to operations on objects of the modelled
 * language: attribute read and write, and calls. A front end translates
 * attribute access and method calls in the surface language into calls
 * on these methods.
 * <p>
 * Methods here are declared to throw {@code Throwable} because they
 * call hooks and method bodies supplied by the front end. Whatever
 * those raise reaches the caller unchanged.
 */
public class Abstract {

    private Abstract() {} // no instances

    /**
     * Attribute read: {@code obj.name}. The following order of
     * precedence applies:
     * <ol>
     * <li>a value in the storage of {@code obj} itself, returned as it
     * is;</li>
     * <li>a definition found along the ancestors of the class of
     * {@code obj}, which is bound to {@code obj} if it is invocable or a
     * descriptor, and otherwise returned as it is;</li>
     * <li>the result of the attribute-miss hook {@code __getattr__}, if
     * the class defines one, called as {@code (obj, name)}.</li>
     * </ol>
     * The miss hook is found by class-side lookup alone, so that a class
     * without one does not recurse into this method.
     *
     * @param obj object to operate on
     * @param name of attribute
     * @return {@code obj.name}
     * @throws AttributeNotFound if nothing supplies the attribute
     * @throws Throwable from a hook or descriptor
     */
    public static Object getAttr(ModelObject obj, String name)
            throws AttributeNotFound, Throwable {

        // Look in the object's own storage.
        Object v = obj.rawRead(name);
        if (v != ABSENT) { return v; }

        // Look up the name in the type.
        ModelClass type = obj.getType();
        v = type.lookup(name);
        if (v != ABSENT) {
            return switch (Capability.of(v)) {
                case DESCRIPTOR -> bind(v, obj, type);
                case INVOCABLE -> ((Invocable)v).bind(obj, type);
                case DATA -> v;
            };
        }

        // All the look-ups came to nothing: try the miss hook.
        Object getattr = type.lookup(SpecialMethod.op_getattr.methodName);
        if (getattr != ABSENT) { return call(getattr, obj, name); }

        throw new AttributeNotFound(obj, name);
    }

    /**
     * Attribute read: {@code obj.name}, returning {@code ABSENT} where
     * {@link #getAttr(ModelObject, String)} would raise
     * {@link AttributeNotFound}. Other failures propagate.
     *
     * @param obj object to operate on
     * @param name of attribute
     * @return {@code obj.name} or {@link ModelObject#ABSENT}
     * @throws Throwable from a hook or descriptor
     */
    public static Object lookupAttr(ModelObject obj, String name)
            throws Throwable {
        try {
            return getAttr(obj, name);
        } catch (AttributeNotFound e) {
            return ABSENT;
        }
    }

    /**
     * Test whether {@code obj.name} may be read.
     *
     * @param obj object to operate on
     * @param name of attribute
     * @return {@code false} if reading raises {@link AttributeNotFound}
     * @throws Throwable from a hook or descriptor
     */
    public static boolean hasAttr(ModelObject obj, String name)
            throws Throwable {
        return lookupAttr(obj, name) != ABSENT;
    }

    /**
     * Attribute write: {@code obj.name = value}. This always delegates
     * to the write hook {@code __setattr__} found on the class of
     * {@code obj}, called as {@code (obj, name, value)}. The universal
     * base class defines one that stores the value in the object
     * ({@link #genericSetAttr(ModelObject, String, Object)}), so there
     * is always a hook to find.
     *
     * @param obj object to operate on
     * @param name of attribute
     * @param value to set
     * @throws InterpreterError if no write hook is defined
     * @throws Throwable from the hook
     */
    public static void setAttr(ModelObject obj, String name, Object value)
            throws Throwable {
        ModelClass type = obj.getType();
        Object setattr = type.lookup(SpecialMethod.op_setattr.methodName);
        if (setattr == ABSENT) {
            throw new InterpreterError(NO_SETATTR, type.getName());
        }
        call(setattr, obj, name, value);
    }

    private static final String NO_SETATTR =
            "no write hook found for class '%s'";

    /**
     * The behaviour of the default write hook {@code object.__setattr__}:
     * store the value in the object itself. A user-defined write hook
     * delegates here for names it does not treat specially.
     *
     * @param obj object to operate on
     * @param name of attribute
     * @param value to set
     */
    public static void genericSetAttr(ModelObject obj, String name,
            Object value) {
        obj.rawWrite(name, value);
    }

    /**
     * Method call: {@code obj.name(args...)}. This is exactly an
     * attribute read followed by a call of the result.
     *
     * @param obj target of the call
     * @param name of the method
     * @param args other arguments
     * @return the result of the call
     * @throws AttributeNotFound if there is no such attribute
     * @throws NotCallable if the attribute cannot be called
     * @throws Throwable from the method or a hook
     */
    public static Object callMethod(ModelObject obj, String name,
            Object... args)
            throws AttributeNotFound, NotCallable, Throwable {
        return call(getAttr(obj, name), args);
    }

    /**
     * Call {@code callable(args...)}. The callable is either an
     * {@link Invocable}, or an object whose class defines
     * {@code __call__}, which is called with {@code callable} inserted
     * as the first argument.
     *
     * @param callable to call
     * @param args arguments by position
     * @return the result of the call
     * @throws NotCallable if {@code callable} cannot be called
     * @throws Throwable from the implementation
     */
    public static Object call(Object callable, Object... args)
            throws NotCallable, Throwable {
        if (callable instanceof Invocable f) {
            return f.call(args);
        } else if (callable instanceof ModelObject o) {
            Object hook = o.getType().lookup(SpecialMethod.op_call.methodName);
            if (hook != ABSENT) {
                return call(hook, Util.prepend(callable, args));
            }
        }
        throw new NotCallable(callable);
    }

    /**
     * Look for the definition of {@code name} along the ancestors of a
     * class, without binding and without hooks.
     *
     * @param cls on which to look
     * @param name to look up
     * @return the definition or {@link ModelObject#ABSENT}
     */
    public static Object lookup(ModelClass cls, String name) {
        return cls.lookup(name);
    }

    /**
     * Apply the bind hook of a descriptor {@code v}, found on
     * {@code type} by a read of an attribute of {@code obj}.
     *
     * @param v the descriptor
     * @param obj through which it was read
     * @param type class of {@code obj}
     * @return the result of the read
     * @throws Throwable from the hook
     */
    private static Object bind(Object v, ModelObject obj, ModelClass type)
            throws Throwable {
        if (v instanceof Descriptor d) {
            return d.__get__(obj, type);
        }
        // A descriptor defined in the modelled language.
        Object get = ((ModelObject)v).getType()
                .lookup(SpecialMethod.op_get.methodName);
        return call(get, v, obj, type);
    }
}
