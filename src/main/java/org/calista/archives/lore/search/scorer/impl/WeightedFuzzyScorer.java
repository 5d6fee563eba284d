package org.calista.archives.lore.search.scorer.impl;

import org.calista.archives.lore.index.IndexedEntry;
import org.calista.archives.lore.search.scorer.RelevanceScorer;
import org.calista.archives.lore.text.FuzzyRatio;

/**
 * WeightedFuzzyScorer: mean of weighted fuzzy terms.
 *
 * <pre>
 * name          partialRatio * 2.0
 * description   ratio        * 1.5
 * each tag      ratio        * 1.2   (one term per tag, none when untagged)
 * full text     partialRatio * 1.0
 * </pre>
 *
 * The sum is divided by the number of terms produced. Heavy name weights can push the mean
 * past 100, so the result is capped there to keep the 0..100 contract. Entries that all reach
 * the cap tie at 100 and keep index order (category order, then stored order) in search results.
 */
public final class WeightedFuzzyScorer implements RelevanceScorer {

    public static final double NAME_WEIGHT = 2.0;
    public static final double DESCRIPTION_WEIGHT = 1.5;
    public static final double TAG_WEIGHT = 1.2;
    public static final double TEXT_WEIGHT = 1.0;

    static final double MAX_SCORE = 100.0;

    @Override
    public double score(String query, IndexedEntry entry) {
        if (query == null || query.isEmpty() || entry == null) return 0.0;

        double sum = 0.0;
        int terms = 0;

        sum += FuzzyRatio.partialRatio(query, entry.nameLower()) * NAME_WEIGHT;
        terms++;

        sum += FuzzyRatio.ratio(query, entry.descriptionLower()) * DESCRIPTION_WEIGHT;
        terms++;

        for (String tag : entry.tagsLower()) {
            sum += FuzzyRatio.ratio(query, tag) * TAG_WEIGHT;
            terms++;
        }

        sum += FuzzyRatio.partialRatio(query, entry.searchableText) * TEXT_WEIGHT;
        terms++;

        return Math.min(MAX_SCORE, sum / terms);
    }
}
