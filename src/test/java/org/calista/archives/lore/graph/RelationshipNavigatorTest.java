package org.calista.archives.lore.graph;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.calista.archives.lore.LoreFixtures;
import org.calista.archives.lore.engine.LoreEngine;
import org.calista.archives.lore.entry.Category;
import org.calista.archives.lore.entry.RelationshipType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RelationshipNavigatorTest {

    @TempDir
    Path db;

    private LoreEngine engine;

    // hero -ally_of-> mentor -member_of-> order -enemy_of-> hero, hero -related_to-> (missing)
    @BeforeEach
    void setUp() throws Exception {
        ObjectNode hero = LoreFixtures.entry("hero", "Aldric", "A mage");
        LoreFixtures.link(hero, "mentor", "ally_of");
        LoreFixtures.link(hero, "lost-tome", "related_to");

        ObjectNode mentor = LoreFixtures.link(LoreFixtures.entry("mentor", "Ilsa", "An old teacher"), "order", "member_of");
        ObjectNode order = LoreFixtures.link(LoreFixtures.entry("order", "Silver Order", "A guild"), "hero", "enemy_of");

        LoreFixtures.writeCategory(db, Category.CHARACTERS, hero, mentor);
        LoreFixtures.writeCategory(db, Category.ORGANIZATIONS, order);
        engine = LoreFixtures.engine(db);
    }

    private static List<String> ids(List<RelatedEntry> found) {
        ArrayList<String> out = new ArrayList<>();
        for (RelatedEntry r : found) out.add(r.entry.id() + "@" + r.depth);
        return out;
    }

    @Test
    void depthOneReturnsDirectSuccessorsOnly() {
        List<RelatedEntry> found = engine.related("hero");

        assertEquals(List.of("mentor@1"), ids(found));
        assertEquals(RelationshipType.ALLY_OF, found.get(0).relationshipType());
    }

    @Test
    void deeperLevelsFollowTheChain() {
        assertEquals(List.of("mentor@1", "order@2"), ids(engine.related("hero", null, 2)));
    }

    @Test
    void cycleBackToStartIsReportedOnce() {
        assertEquals(List.of("mentor@1", "order@2", "hero@3"), ids(engine.related("hero", null, 3)));
        assertEquals(List.of("mentor@1", "order@2", "hero@3"), ids(engine.related("hero", null, 10)));
    }

    @Test
    void parallelEdgesToOneTargetAreAllReportedAtDepthOne(@TempDir Path other) throws Exception {
        ObjectNode hero = LoreFixtures.entry("hero", "Aldric", "A mage");
        LoreFixtures.link(hero, "villain", "enemy_of");
        LoreFixtures.link(hero, "villain", "related_to");
        ObjectNode villain = LoreFixtures.link(LoreFixtures.entry("villain", "Morvain", "A dark mage"), "keep", "located_in");
        LoreFixtures.writeCategory(other, Category.CHARACTERS, hero, villain);
        LoreFixtures.writeCategory(other, Category.LOCATIONS, LoreFixtures.entry("keep", "Black Keep", "A fortress"));
        LoreEngine twoEdges = LoreFixtures.engine(other);

        List<RelatedEntry> direct = twoEdges.related("hero", null, 1);
        assertEquals(List.of("villain@1", "villain@1"), ids(direct));
        assertEquals(RelationshipType.ENEMY_OF, direct.get(0).relationshipType());
        assertEquals(RelationshipType.RELATED_TO, direct.get(1).relationshipType());

        // the target is expanded once
        assertEquals(List.of("villain@1", "villain@1", "keep@2"), ids(twoEdges.related("hero", null, 3)));
        assertEquals(List.of("villain@1"), ids(twoEdges.related("hero", RelationshipType.RELATED_TO, 1)));
    }

    @Test
    void typeFilterAppliesToEveryEdge() {
        assertTrue(engine.related("hero", RelationshipType.MEMBER_OF, 3).isEmpty());
        assertEquals(List.of("order@1"), ids(engine.related("mentor", RelationshipType.MEMBER_OF, 3)));
    }

    @Test
    void unknownIdOrNonPositiveDepthYieldsNothing() {
        assertTrue(engine.related("nobody").isEmpty());
        assertTrue(engine.related("lost-tome").isEmpty());
        assertTrue(engine.related("hero", null, 0).isEmpty());
    }

    @Test
    void graphViewRestrictsToInducedSubgraph() {
        RelationshipGraph full = engine.graphView(null);
        assertEquals(3, full.nodeCount());
        assertEquals(4, full.edgeCount());
        assertEquals(1, full.inDegree("hero"));

        RelationshipGraph sub = engine.graphView(List.of("hero", "mentor", "lost-tome"));
        assertEquals(2, sub.nodeCount());
        assertEquals(1, sub.edgeCount());
        assertEquals("mentor", sub.outgoing("hero").get(0).targetId);
    }
}
