package com.ilograph.edit.ref;

import java.util.List;
import java.util.Set;

import org.junit.Test;
import static org.junit.Assert.*;

public class ReferenceParserTest {

    @Test
    public void testSplitRespectsBracketsParensAndQuotes() {
        List<String> parts = ReferenceParser.splitList("a, [b, c], fn(x, y), 'q, r', \"s\\\", t\"");
        assertEquals(List.of("a", "[b, c]", "fn(x, y)", "'q, r'", "\"s\\\", t\""), parts);
    }

    @Test
    public void testSplitDropsEmptySegments() {
        assertEquals(List.of("a", "b"), ReferenceParser.splitList(" a ,, b , "));
        assertTrue(ReferenceParser.splitList("  ").isEmpty());
    }

    @Test
    public void testSplitJoinRoundTrip() {
        String[] inputs = {
                "api, db",
                "[S3 Bucket, primary], ../lambda, fn(a, b)",
                "'quoted, comma', Ext::Thing",
                "a//b/c *clone1, x"
        };
        for (String input : inputs) {
            List<String> parts = ReferenceParser.splitList(input);
            assertEquals(input, parts, ReferenceParser.splitList(ReferenceParser.joinList(parts)));
        }
    }

    @Test
    public void testSegmentComponents() {
        List<ReferenceComponent> cs = ReferenceParser.parseSegment("../vpc//[Subnet A]/web *2");
        assertEquals(3, cs.size());
        assertEquals("vpc", cs.get(0).token());
        assertEquals("Subnet A", cs.get(1).token());
        assertEquals("[Subnet A]", cs.get(1).raw());
        assertEquals("web", cs.get(2).token());
        assertTrue(cs.get(0).relative());
    }

    @Test
    public void testSpecialWildcardAndNamespacedFlags() {
        List<ReferenceComponent> cs = ReferenceParser.parseComponents("*, None, ^, lambda-*, Ext::Thing");
        assertTrue(cs.get(0).special());
        assertTrue(cs.get(1).special());
        assertTrue(cs.get(2).special());
        assertTrue(cs.get(3).wildcard());
        assertFalse(cs.get(3).special());
        assertTrue(cs.get(4).namespaced());
        assertEquals("Ext", cs.get(4).namespace());
    }

    @Test
    public void testCloneSuffixOnlyAfterWhitespace() {
        assertEquals("web", ReferenceParser.stripCloneSuffix("web *2"));
        assertEquals("web*2", ReferenceParser.stripCloneSuffix("web*2"));
        assertEquals("[a *b]", ReferenceParser.stripCloneSuffix("[a *b]"));
    }

    @Test
    public void testExtractTokensSkipsSpecialAndWildcard() {
        Set<String> tokens = ReferenceParser.extractTokens("api, *, db-*, [Load Balancer]/web");
        assertEquals(Set.of("api", "Load Balancer", "web"), tokens);
    }

    @Test
    public void testContainsIdentifierMatchesWholeComponents() {
        assertTrue(ReferenceParser.containsIdentifier("vpc/db, cache", "db"));
        assertFalse(ReferenceParser.containsIdentifier("vpc/db_replica", "db"));
    }

    @Test
    public void testFirstRestrictedChar() {
        assertNull(ReferenceParser.firstRestrictedChar("ok-id_1"));
        assertEquals(Character.valueOf('/'), ReferenceParser.firstRestrictedChar("a/b"));
        assertEquals(Character.valueOf(','), ReferenceParser.firstRestrictedChar("a,b*"));
    }
}
