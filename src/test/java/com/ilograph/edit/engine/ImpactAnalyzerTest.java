package com.ilograph.edit.engine;

import com.ilograph.edit.Fixtures;
import com.ilograph.edit.api.ImpactHit;

import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;

public class ImpactAnalyzerTest {

    @Test
    public void testFindsDefinitionReferencesAndContexts() {
        List<ImpactHit> hits = ImpactAnalyzer.impact(Fixtures.sample(), "db");
        List<String> sections = hits.stream().map(ImpactHit::section).toList();
        assertEquals(List.of("resource", "relations", "aliases", "sequence", "contexts:Default", "contexts:Storage"),
                sections);
        assertEquals("perspectives[0].relations[1].to", hits.get(1).path());
        assertEquals("flow", hits.get(1).perspective());
        assertEquals("roots", hits.get(4).field());
    }

    @Test
    public void testPerspectiveIdentifier() {
        List<ImpactHit> hits = ImpactAnalyzer.impact(Fixtures.sample(), "Steps");
        assertEquals(1, hits.size());
        assertEquals("perspective", hits.get(0).section());
    }
}
