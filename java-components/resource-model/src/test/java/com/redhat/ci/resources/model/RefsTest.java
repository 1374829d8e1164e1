package com.redhat.ci.resources.model;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class RefsTest {

    @Test
    void describeBaseRefOnly() {
        Refs refs = Refs.builder().org("o").repo("r").baseRef("main").build();
        Assertions.assertEquals("main", refs.describe());
    }

    @Test
    void describeWithShaAndPulls() {
        Refs refs = Refs.builder().org("o").repo("r").baseRef("main").baseSha("abc")
                .pulls(List.of(Pull.builder().number(42).sha("def").build(),
                        Pull.builder().number(7).sha("123").ref("refs/pull/7/head").build()))
                .build();
        Assertions.assertEquals("main:abc,42:def,7:123:refs/pull/7/head", refs.describe());
        Assertions.assertTrue(refs.hasPulls());
    }

    @Test
    void effectiveCloneUriDefaultsToGithubHttps() {
        Refs refs = Refs.builder().org("o").repo("r").build();
        Assertions.assertEquals("https://github.com/o/r.git", refs.effectiveCloneUri());
        Assertions.assertEquals("ssh://git@example.com/o/r.git",
                refs.toBuilder().cloneUri("ssh://git@example.com/o/r.git").build().effectiveCloneUri());
    }

    @Test
    void toBuilderLeavesOriginalUntouched() {
        Refs refs = Refs.builder().org("o").repo("r").build();
        Refs copy = refs.toBuilder().cloneUri("https://example.com/o/r.git").build();
        Assertions.assertNull(refs.cloneUri());
        Assertions.assertEquals("https://example.com/o/r.git", copy.cloneUri());
    }

    @Test
    void baseRefIsAlwaysWritten() throws Exception {
        JsonNode json = new ObjectMapper().valueToTree(Refs.builder().org("o").repo("r").baseRef("").build());
        Assertions.assertTrue(json.has("base_ref"));
        Assertions.assertEquals("", json.get("base_ref").asText());
        Assertions.assertFalse(json.has("base_sha"));
        Assertions.assertFalse(json.has("pulls"));
    }
}
