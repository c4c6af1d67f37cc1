/**
 * The {@code support} package contains classes that the object model
 * uses without requiring a class system to exist, in particular the
 * {@link uk.co.farowl.vsjom.support.InterpreterError} thrown when an
 * internal invariant is broken.
 */
package uk.co.farowl.vsjom.support;
