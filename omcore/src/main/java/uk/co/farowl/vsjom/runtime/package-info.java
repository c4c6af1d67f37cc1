/**
 * The object model of a class-based dynamic language: classes with
 * single inheritance, instances whose storage is described by shared
 * layouts, and the attribute protocol with its hooks.
 * <p>
 * A front end begins by creating a {@link
 * uk.co.farowl.vsjom.runtime.ClassSystem}, which provides the root
 * classes {@code object} and {@code type}. It makes classes and
 * instances there, and reads, writes and calls attributes through
 * {@link uk.co.farowl.vsjom.runtime.Abstract}. Method bodies are
 * opaque {@link uk.co.farowl.vsjom.runtime.Invocable}s supplied by the
 * front end.
 */
package uk.co.farowl.vsjom.runtime;
