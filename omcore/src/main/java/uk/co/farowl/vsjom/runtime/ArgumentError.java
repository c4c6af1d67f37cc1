// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjom.runtime;

/**
 * Raised when a {@link JavaFunction} is called with the wrong number or
 * kind of arguments.
 */
public class ArgumentError extends ObjectModelException {
    private static final long serialVersionUID = 1L;

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public ArgumentError(String msg, Object... args) {
        super(msg, args);
    }
}
