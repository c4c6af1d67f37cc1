// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjom.runtime;

/**
 * Base of the exceptions that the object model raises for conditions a
 * front end may report to, or let be caught by, code in the modelled
 * language. Internal failures are signalled by
 * {@link uk.co.farowl.vsjom.support.InterpreterError} instead.
 */
public abstract class ObjectModelException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    protected ObjectModelException(String msg, Object... args) {
        super(String.format(msg, args));
    }
}
