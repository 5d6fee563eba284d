package org.calista.archives.lore.search;

import org.calista.archives.lore.LoreFixtures;
import org.calista.archives.lore.engine.LoreEngine;
import org.calista.archives.lore.entry.Category;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FuzzySearchEngineTest {

    private static List<String> ids(List<SearchHit> hits) {
        ArrayList<String> out = new ArrayList<>();
        for (SearchHit h : hits) out.add(h.entry.id());
        return out;
    }

    @Test
    void defaultThresholdKeepsOnlyCloseMatchesSortedByScore(@TempDir Path db) throws Exception {
        LoreFixtures.writeRealm(db);
        LoreEngine engine = LoreFixtures.engine(db);

        List<SearchHit> hits = engine.search("Mage");

        assertEquals(List.of("villain", "hero"), ids(hits));
        assertTrue(hits.get(0).score >= hits.get(1).score);
        for (SearchHit h : hits) {
            assertTrue(h.score >= 60.0 && h.score <= 100.0, h.toString());
        }
    }

    @Test
    void zeroThresholdReturnsEverything(@TempDir Path db) throws Exception {
        LoreFixtures.writeRealm(db);
        LoreEngine engine = LoreFixtures.engine(db, 0.0);

        assertEquals(List.of("villain", "hero", "city"), ids(engine.search("mage")));
    }

    @Test
    void blankQueryReturnsNothing(@TempDir Path db) throws Exception {
        LoreFixtures.writeRealm(db);
        LoreEngine engine = LoreFixtures.engine(db, 0.0);

        assertTrue(engine.search("").isEmpty());
        assertTrue(engine.search("   ").isEmpty());
        assertTrue(engine.search(null).isEmpty());
    }

    @Test
    void categoryFilterApplies(@TempDir Path db) throws Exception {
        LoreFixtures.writeRealm(db);
        LoreEngine engine = LoreFixtures.engine(db, 0.0);

        List<SearchHit> hits = engine.search("mage", Category.LOCATIONS, null, null);
        assertEquals(List.of("city"), ids(hits));
        assertTrue(engine.search("mage", Category.ITEMS, null, null).isEmpty());
    }

    @Test
    void tagFilterIsAnyOfAndCaseInsensitive(@TempDir Path db) throws Exception {
        LoreFixtures.writeRealm(db);
        LoreEngine engine = LoreFixtures.engine(db, 0.0);

        assertEquals(List.of("hero"), ids(engine.search("mage", null, List.of("ZELORIA"), null)));
        assertEquals(List.of("hero", "city"), ids(engine.search("mage", null, List.of("zeloria", "capital"), null)));
        assertTrue(engine.search("mage", null, List.of("dragon"), null).isEmpty());
    }

    @Test
    void limitCapsResults(@TempDir Path db) throws Exception {
        LoreFixtures.writeRealm(db);
        LoreEngine engine = LoreFixtures.engine(db, 0.0);

        assertEquals(List.of("villain"), ids(engine.search("mage", null, null, 1)));
    }

    @Test
    void exactNameRanksFirst(@TempDir Path db) throws Exception {
        LoreFixtures.writeRealm(db);
        LoreEngine engine = LoreFixtures.engine(db);

        List<SearchHit> hits = engine.search("Aldric");
        assertFalse(hits.isEmpty());
        assertEquals("hero", hits.get(0).entry.id());
    }

    @Test
    void hitsTiedAtTheCapKeepIndexOrder(@TempDir Path db) throws Exception {
        LoreFixtures.writeCategory(db, Category.CHARACTERS,
                LoreFixtures.entry("zed", "Mage Lord", "mage", "mage"),
                LoreFixtures.entry("abel", "Mage", "mage", "mage"));
        LoreFixtures.writeCategory(db, Category.LOCATIONS,
                LoreFixtures.entry("tower", "Mage", "mage", "mage"));
        LoreEngine engine = LoreFixtures.engine(db);

        List<SearchHit> hits = engine.search("mage");

        assertEquals(List.of("zed", "abel", "tower"), ids(hits));
        for (SearchHit h : hits) assertEquals(100.0, h.score, 1e-9);
    }

    @Test
    void hitsCarryOutgoingRelationships(@TempDir Path db) throws Exception {
        LoreFixtures.writeCategory(db, Category.CHARACTERS,
                LoreFixtures.link(LoreFixtures.entry("hero", "Aldric", "A mage", "mage"), "villain", "enemy_of"),
                LoreFixtures.entry("villain", "Morvain", "A dark mage", "mage"));
        LoreEngine engine = LoreFixtures.engine(db, 0.0);

        SearchHit hero = engine.search("aldric").get(0);
        assertEquals("hero", hero.entry.id());
        assertEquals(1, hero.relationships.size());
        assertEquals("villain", hero.relationships.get(0).targetId);
    }

    @Test
    void invalidConfigurationIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new FuzzySearchEngine((q, e) -> 0.0, 1.5, 20, true));
        assertThrows(IllegalArgumentException.class,
                () -> new FuzzySearchEngine((q, e) -> 0.0, 0.5, 0, true));
    }
}
