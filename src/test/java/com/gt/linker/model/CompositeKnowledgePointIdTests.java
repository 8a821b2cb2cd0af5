package com.gt.linker.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CompositeKnowledgePointIdTests {

    @Test
    public void testCanonicalForm() {
        CompositeKnowledgePointId id = new CompositeKnowledgePointId(3, 17);

        assertEquals("3:17", id.canonical());
        assertEquals("3:17", id.toString());
        assertEquals(id, CompositeKnowledgePointId.parse("3:17"));
    }

    @Test
    public void testIsCanonical() {
        assertTrue(CompositeKnowledgePointId.isCanonical("3:17"));
        assertFalse(CompositeKnowledgePointId.isCanonical("17"));
        assertFalse(CompositeKnowledgePointId.isCanonical("fallback_abc"));
        assertFalse(CompositeKnowledgePointId.isCanonical(null));
    }

    @Test
    public void testParseRejectsMalformedIds() {
        assertThrows(IllegalArgumentException.class, () -> CompositeKnowledgePointId.parse("3"));
        assertThrows(IllegalArgumentException.class, () -> CompositeKnowledgePointId.parse("a:b"));
        assertThrows(IllegalArgumentException.class, () -> CompositeKnowledgePointId.parse(null));
    }

    @Test
    public void testMasteryTierBoundaries() {
        assertEquals(MasteryTier.Weak, MasteryTier.of(0.0));
        assertEquals(MasteryTier.Weak, MasteryTier.of(1.49));
        assertEquals(MasteryTier.Medium, MasteryTier.of(1.5));
        assertEquals(MasteryTier.Medium, MasteryTier.of(3.49));
        assertEquals(MasteryTier.Strong, MasteryTier.of(3.5));
        assertEquals(MasteryTier.Strong, MasteryTier.of(5.0));
        assertEquals(MasteryTier.Weak, MasteryTier.of(Double.NaN));
        assertEquals(MasteryTier.Medium, MasteryTier.fromCode("medium"));
    }
}
