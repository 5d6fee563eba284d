package org.calista.archives.lore.text;

import org.calista.archives.lore.entry.Category;
import org.calista.archives.lore.entry.CustomValue;
import org.calista.archives.lore.entry.LoreEntry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SearchableTextTest {

    private static LoreEntry entry() {
        LoreEntry e = new LoreEntry();
        e.id = "hero";
        e.name = "Aldric";
        e.category = Category.CHARACTERS;
        return e;
    }

    @Test
    void joinsNameDescriptionTagsAndCustomValuesLowerCased() {
        LoreEntry e = entry();
        e.description = "A Wandering Mage";
        e.tags = new ArrayList<>(List.of("Mage", "Zeloria"));
        e.customFields.put("title", CustomValue.of("Archmage"));
        e.customFields.put("allies", CustomValue.ofList(List.of("Morvain", 3)));

        assertEquals("aldric a wandering mage mage zeloria archmage morvain 3", SearchableText.of(e));
    }

    @Test
    void skipsEmptyParts() {
        LoreEntry e = entry();
        e.description = "";
        e.tags = new ArrayList<>(List.of("mage"));

        assertEquals("aldric mage", SearchableText.of(e));
    }

    @Test
    void subcategoryIsNotSearchable() {
        LoreEntry e = entry();
        e.subcategory = "Necromancer";
        e.description = "A mage";

        assertFalse(SearchableText.of(e).contains("necromancer"));
    }

    @Test
    void booleanAndNumberValuesAreRendered() {
        LoreEntry e = entry();
        e.customFields.put("immortal", CustomValue.of(true));
        e.customFields.put("age", CustomValue.of(412));

        assertEquals("aldric true 412", SearchableText.of(e));
    }
}
