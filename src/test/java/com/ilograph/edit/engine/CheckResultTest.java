package com.ilograph.edit.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ilograph.edit.api.ValidationIssue;
import com.ilograph.edit.api.ValidationMode;

import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;

public class CheckResultTest {

    private final CheckResult result = new CheckResult(ValidationMode.STRICT, List.of(
            new ValidationIssue("broken-reference", "p[0].to", "unknown reference 'x'"),
            new ValidationIssue("broken-reference", "p[1].to", "unknown reference 'y'"),
            new ValidationIssue("duplicate-resource-id", "resources[0]", "duplicate")));

    @Test
    public void testFilterOnlyAndIgnore() {
        assertEquals(2, result.filter(List.of("broken-reference"), List.of()).getIssues().size());
        assertEquals(1, result.filter(null, List.of("broken-reference,restricted-alias-char")).getIssues().size());
        assertTrue(result.filter(List.of("duplicate-resource-id"), List.of("duplicate-resource-id")).isOk());
    }

    @Test
    public void testJsonShape() throws Exception {
        JsonNode json = new ObjectMapper().readTree(result.toJson());
        assertFalse(json.get("ok").asBoolean());
        assertEquals("strict", json.get("mode").asText());
        assertEquals(3, json.get("summary").get("total").asInt());
        assertEquals(2, json.get("summary").get("by_code").get("broken-reference").asInt());
        assertEquals("p[0].to", json.get("issues").get(0).get("path").asText());
    }
}
