/**
 * The {@code kernel} package holds the machinery beneath the object
 * model API: the tree of shared instance {@link
 * uk.co.farowl.vsjom.runtime.kernel.Layout}s and the calculation of
 * ancestor sequences.
 * <p>
 * Classes here are public so that the {@code runtime} package can use
 * them, but a front end should need only {@code Layout} (for
 * diagnostics).
 */
package uk.co.farowl.vsjom.runtime.kernel;
