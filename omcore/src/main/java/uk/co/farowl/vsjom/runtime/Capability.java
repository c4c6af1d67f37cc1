// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjom.runtime;

/**
 * The capability of a value found on a class, which decides how the
 * attribute read protocol treats it. We classify a value once and
 * switch on the result, rather than probing for hooks at each step.
 */
public enum Capability {
    /** Plain data: the read returns the value itself. */
    DATA,
    /** An {@link Invocable}: the read returns it bound to the object. */
    INVOCABLE,
    /**
     * A descriptor: the read returns the result of its bind hook. This
     * is either a {@link Descriptor}, or a {@link ModelObject} whose
     * class defines {@code __get__}.
     */
    DESCRIPTOR;

    /**
     * Classify a value.
     *
     * @param v to classify
     * @return capability of {@code v}
     */
    public static Capability of(Object v) {
        if (v instanceof Descriptor) {
            return DESCRIPTOR;
        } else if (v instanceof Invocable) {
            return INVOCABLE;
        } else if (v instanceof ModelObject o
                && o.getType().defines(SpecialMethod.op_get)) {
            return DESCRIPTOR;
        } else {
            return DATA;
        }
    }
}
