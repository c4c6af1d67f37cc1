// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjom.support.internal;

/**
 * Convenient constants etc. for use across the implementation and not
 * needing a class system to be working.
 */
public class Util {

    private Util() {} // no instances

    /**
     * Return a new argument array in which a given element is placed
     * first, followed by the elements of an existing array. The result
     * is always an {@code Object[]}, whatever the run-time type of
     * {@code a1plus}, so that any receiver may be stored in it.
     *
     * @param a0 first element of new array
     * @param a1plus rest of elements in new array
     * @return new copy array with first element inserted
     */
    public static Object[] prepend(Object a0, Object[] a1plus) {
        int n = a1plus.length;
        Object[] a = new Object[1 + n];
        a[0] = a0;
        System.arraycopy(a1plus, 0, a, 1, n);
        return a;
    }
}
