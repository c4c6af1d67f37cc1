// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjom.runtime;

/**
 * An {@link Invocable} whose body is Java code. These give the object
 * model its own built-in methods (such as the default
 * {@code object.__setattr__}) and give a front end or a test a concise
 * way to define method bodies.
 * <p>
 * Instances are obtained from the static factory methods, which fix the
 * number of arguments the function expects, or accept any number.
 */
public final class JavaFunction implements Invocable {

    /** Java code that implements a {@code JavaFunction}. */
    @FunctionalInterface
    public interface Body {
        /**
         * @param args arguments by position
         * @return result of the call
         * @throws Throwable from the implementation
         */
        Object call(Object[] args) throws Throwable;
    }

    /** A body taking exactly one argument. */
    @FunctionalInterface
    public interface Unary {
        /**
         * @param a0 first argument
         * @return result of the call
         * @throws Throwable from the implementation
         */
        Object call(Object a0) throws Throwable;
    }

    /** A body taking exactly two arguments. */
    @FunctionalInterface
    public interface Binary {
        /**
         * @param a0 first argument
         * @param a1 second argument
         * @return result of the call
         * @throws Throwable from the implementation
         */
        Object call(Object a0, Object a1) throws Throwable;
    }

    /** A body taking exactly three arguments. */
    @FunctionalInterface
    public interface Ternary {
        /**
         * @param a0 first argument
         * @param a1 second argument
         * @param a2 third argument
         * @return result of the call
         * @throws Throwable from the implementation
         */
        Object call(Object a0, Object a1, Object a2) throws Throwable;
    }

    /** Name of the function, used in messages. */
    private final String name;

    /** Number of arguments expected, or -1 for any number. */
    private final int arity;

    /** The implementation. */
    private final Body body;

    private JavaFunction(String name, int arity, Body body) {
        this.name = name;
        this.arity = arity;
        this.body = body;
    }

    /**
     * A function accepting any number of arguments.
     *
     * @param name of the function
     * @param body implementation
     * @return the function
     */
    public static JavaFunction varargs(String name, Body body) {
        return new JavaFunction(name, -1, body);
    }

    /**
     * A function of one argument. As a method, that is the receiver.
     *
     * @param name of the function
     * @param body implementation
     * @return the function
     */
    public static JavaFunction of(String name, Unary body) {
        return new JavaFunction(name, 1, a -> body.call(a[0]));
    }

    /**
     * A function of two arguments.
     *
     * @param name of the function
     * @param body implementation
     * @return the function
     */
    public static JavaFunction of(String name, Binary body) {
        return new JavaFunction(name, 2, a -> body.call(a[0], a[1]));
    }

    /**
     * A function of three arguments.
     *
     * @param name of the function
     * @param body implementation
     * @return the function
     */
    public static JavaFunction of(String name, Ternary body) {
        return new JavaFunction(name, 3,
                a -> body.call(a[0], a[1], a[2]));
    }

    @Override
    public Object call(Object... args) throws ArgumentError, Throwable {
        if (arity >= 0 && args.length != arity) {
            throw new ArgumentError(WRONG_COUNT, name, arity,
                    args.length);
        }
        return body.call(args);
    }

    private static final String WRONG_COUNT =
            "%s() takes %d arguments (%d given)";

    /** @return the name of the function */
    public String getName() { return name; }

    /** @return number of arguments expected, or -1 for any number */
    public int getArity() { return arity; }

    @Override
    public String toString() { return "<function " + name + ">"; }
}
