package com.redhat.ci.steps;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

public class ParameterMapTest {

    @Test
    public void testValueIsComputedOnEveryRead() throws Exception {
        AtomicInteger reads = new AtomicInteger();
        ParameterMap parameters = ParameterMap.of(new DeferredParameter("IMAGE_SRC",
                () -> "sha256:" + reads.incrementAndGet()));
        assertEquals(0, reads.get());
        assertEquals(Set.of("IMAGE_SRC"), parameters.keys());
        assertEquals("sha256:1", parameters.resolve("IMAGE_SRC"));
        assertEquals("sha256:2", parameters.resolve("IMAGE_SRC"));
    }

    @Test
    public void testResolverFailure() {
        ParameterMap parameters = ParameterMap.of(new DeferredParameter("IMAGE_SRC", () -> {
            throw new IllegalStateException("not built yet");
        }));
        ParameterResolutionException e = assertThrows(ParameterResolutionException.class,
                () -> parameters.resolve("IMAGE_SRC"));
        assertEquals("could not resolve parameter IMAGE_SRC: not built yet", e.getMessage());
    }

    @Test
    public void testUnknownKey() {
        ParameterMap parameters = ParameterMap.of();
        assertFalse(parameters.get("IMAGE_SRC").isPresent());
        assertThrows(ParameterResolutionException.class, () -> parameters.resolve("IMAGE_SRC"));
    }

    @Test
    public void testDuplicateKey() {
        assertThrows(IllegalArgumentException.class, () -> ParameterMap.of(
                new DeferredParameter("IMAGE_SRC", () -> "a"),
                new DeferredParameter("IMAGE_SRC", () -> "b")));
    }
}
