package org.calista.archives.lore.store;

import com.fasterxml.jackson.databind.JsonNode;
import org.calista.archives.lore.entry.Category;

import java.io.IOException;
import java.util.Map;

/**
 * Read side of the entry store, as consumed by the index builder.
 *
 * <p>Records are returned raw so that binding failures stay local to one entry.</p>
 */
public interface LoreStore {

    /**
     * Raw entry records of one category keyed by identifier, in stored order.
     * A category that has never been written yields an empty map.
     *
     * @throws IOException when the category exists but cannot be read or parsed
     */
    Map<String, JsonNode> readCategory(Category category) throws IOException;
}
