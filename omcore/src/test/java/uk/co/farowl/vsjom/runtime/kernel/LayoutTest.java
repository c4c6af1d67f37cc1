// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjom.runtime.kernel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import uk.co.farowl.vsjom.support.InterpreterError;

/**
 * Tests of the {@link Layout} tree, independent of any class system.
 */
@DisplayName("A Layout")
class LayoutTest {

    LayoutCache cache;
    Layout empty;

    @BeforeEach
    void createCache() {
        cache = new LayoutCache(false);
        empty = cache.empty();
    }

    @Nested
    @DisplayName("when empty")
    class EmptyLayout {

        @Test
        @DisplayName("has no slots")
        void hasNoSlots() {
            assertEquals(0, empty.size());
            assertEquals(-1, empty.slotOf("x"));
            assertEquals(List.of(), empty.names());
            assertEquals("Layout{}", empty.toString());
        }

        @Test
        @DisplayName("is the root of its cache")
        void isRoot() {
            assertNull(empty.parent());
            assertSame(cache, empty.getCache());
            assertEquals(1, cache.size());
        }
    }

    @Nested
    @DisplayName("when extended")
    class Extension {

        @Test
        @DisplayName("places names at successive slots")
        void successiveSlots() {
            Layout xy = empty.extend("x").extend("y");
            assertEquals(2, xy.size());
            assertEquals(0, xy.slotOf("x"));
            assertEquals(1, xy.slotOf("y"));
            assertEquals(-1, xy.slotOf("z"));
            assertEquals(List.of("x", "y"), xy.names());
            assertEquals(Map.of("x", 0, "y", 1), xy.slots());
            assertEquals("Layout{x:0, y:1}", xy.toString());
        }

        @Test
        @DisplayName("returns the identical successor every time")
        void deterministic() {
            Layout x1 = empty.extend("x");
            Layout x2 = empty.extend("x");
            assertSame(x1, x2);
            assertSame(x1.extend("y"), x2.extend("y"));
            assertEquals(3, cache.size());
            assertEquals(1, empty.transitionCount());
        }

        @Test
        @DisplayName("does not change the layout extended")
        void parentUnchanged() {
            Layout x = empty.extend("x");
            Layout xy = x.extend("y");
            assertEquals(1, x.size());
            assertEquals(-1, x.slotOf("y"));
            assertSame(x, xy.parent());
            assertSame(empty, x.parent());
        }

        @Test
        @DisplayName("is sensitive to the order names are added")
        void orderSensitive() {
            Layout xy = empty.extend("x").extend("y");
            Layout yx = empty.extend("y").extend("x");
            assertNotSame(xy, yx);
            assertEquals(0, yx.slotOf("y"));
            assertEquals(1, yx.slotOf("x"));
            assertEquals(2, empty.transitionCount());
            assertEquals(5, cache.size());
        }

        @ParameterizedTest(name = "by ''{0}'' already present")
        @ValueSource(strings = {"x", "y", "z"})
        @DisplayName("fails when the name is present")
        void namePresent(String name) {
            Layout xyz = empty.extend("x").extend("y").extend("z");
            assertThrows(InterpreterError.class, () -> xyz.extend(name));
            // The failure leaves no transition behind
            assertEquals(0, xyz.transitionCount());
        }

        @Test
        @DisplayName("rejects a null name")
        void nullName() {
            assertThrows(NullPointerException.class,
                    () -> empty.extend(null));
        }

        @Test
        @DisplayName("works the same when traced")
        void traced() {
            LayoutCache traced = new LayoutCache(true);
            Layout a = traced.empty().extend("a");
            assertSame(a, traced.empty().extend("a"));
            assertEquals(2, traced.size());
            // Layouts of different caches are distinct
            assertNotSame(a, empty.extend("a"));
        }
    }
}
