// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjom.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Internal error thrown when the object model cannot be relied on to
 * work. A language-level exception (that a user hook might catch) is
 * not then appropriate. An {@code InterpreterError} signals a broken
 * bootstrap or misuse of a storage primitive: an instance made from
 * something that is not a class, a layout extended by a name it already
 * holds, or a class graph with no write hook.
 */
public class InterpreterError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /**
     * Logger for interpreter errors. A proportion of these are thrown
     * during bootstrap of a class system, where they are easily lost.
     */
    static final Logger logger =
            LoggerFactory.getLogger(InterpreterError.class);

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public InterpreterError(String msg, Object... args) {
        super(String.format(msg, args));
        logger.atDebug().log(getMessage());
    }
}
