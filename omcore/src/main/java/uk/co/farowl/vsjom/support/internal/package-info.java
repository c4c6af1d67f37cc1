/**
 * Implementation helpers shared across the object model and not part
 * of its API.
 */
package uk.co.farowl.vsjom.support.internal;
