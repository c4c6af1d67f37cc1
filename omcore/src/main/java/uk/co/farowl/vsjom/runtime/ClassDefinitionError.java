// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjom.runtime;

/**
 * Raised by {@link ClassSystem#makeClass(String, ModelClass, java.util.Map,
 * ModelClass) makeClass} when the arguments cannot define a class: a
 * missing name, a base or metaclass from another class system, a
 * metaclass that is not derived from {@code type}, or a field holding
 * the absent marker.
 */
public class ClassDefinitionError extends ObjectModelException {
    private static final long serialVersionUID = 1L;

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public ClassDefinitionError(String msg, Object... args) {
        super(msg, args);
    }
}
