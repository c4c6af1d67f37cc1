// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjom.runtime.kernel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The tree of {@link Layout}s belonging to one class system, rooted at
 * a distinguished empty layout. Every instance made by that class
 * system begins with the empty layout of this cache and moves to its
 * successors as attributes are added.
 * <p>
 * There is deliberately no global cache: independent class systems
 * (for example, one per test) never share layouts.
 */
public final class LayoutCache {

    /** Logger for layout creation. */
    static final Logger logger = LoggerFactory.getLogger(LayoutCache.class);

    /** The root of the layout tree. */
    private final Layout empty;

    /** If {@code true}, log each new layout at debug level. */
    private final boolean trace;

    /** Count of layouts created, including {@link #empty}. */
    private int count;

    /**
     * Create a cache containing only the empty layout.
     *
     * @param trace if {@code true}, log each new layout
     */
    public LayoutCache(boolean trace) {
        this.trace = trace;
        this.empty = new Layout(this);
        this.count = 1;
    }

    /** @return the empty layout (root of the tree) */
    public Layout empty() { return empty; }

    /** @return the number of distinct layouts created so far */
    public int size() { return count; }

    /**
     * Note the creation of a layout by extension.
     *
     * @param layout just created
     */
    void created(Layout layout) {
        count += 1;
        if (trace) {
            logger.atDebug().setMessage("New layout {} from {} ({} total)")
                    .addArgument(layout).addArgument(layout.parent())
                    .addArgument(count).log();
        }
    }
}
