package org.calista.archives.lore.suggest;

import org.calista.archives.lore.index.IndexSnapshot;
import org.calista.archives.lore.index.IndexedEntry;
import org.calista.archives.lore.search.Scored;
import org.calista.archives.lore.text.FuzzyRatio;

import java.util.*;

/**
 * Suggests entries whose content resembles a source entry.
 *
 * <p>
 * Similarity is the mean of the components that apply:
 * - tag overlap (|A ∩ B| / |A ∪ B|) * 2.0, only when either side has tags
 * - whole-text ratio of the two searchable texts / 100
 * Only candidates strictly above the minimum similarity are kept. The source is never suggested.
 * </p>
 */
public final class SimilarityRecommender {

    public static final double TAG_WEIGHT = 2.0;
    public static final double TEXT_WEIGHT = 1.0;

    private final double minSimilarity;

    public SimilarityRecommender(double minSimilarity) {
        if (!Double.isFinite(minSimilarity) || minSimilarity < 0.0) {
            throw new IllegalArgumentException("minSimilarity must be >= 0: " + minSimilarity);
        }
        this.minSimilarity = minSimilarity;
    }

    public List<Scored<IndexedEntry>> suggest(IndexSnapshot snapshot, String entryId, int limit) {
        Objects.requireNonNull(snapshot, "snapshot");
        Optional<IndexedEntry> source = snapshot.index.get(entryId);
        if (source.isEmpty() || limit < 1) return List.of();

        IndexedEntry src = source.get();
        Set<String> srcTags = src.entry.tagSet();

        ArrayList<Scored<IndexedEntry>> out = new ArrayList<>();
        for (IndexedEntry other : snapshot.index.entries()) {
            if (other.id().equals(src.id())) continue;

            double s = similarity(src, srcTags, other);
            if (s > minSimilarity) out.add(Scored.of(other, s));
        }

        out.sort(Scored.byScoreDescending());
        return Collections.unmodifiableList(out.size() > limit ? new ArrayList<>(out.subList(0, limit)) : out);
    }

    public double similarity(IndexedEntry a, IndexedEntry b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        return similarity(a, a.entry.tagSet(), b);
    }

    private static double similarity(IndexedEntry a, Set<String> aTags, IndexedEntry b) {
        double sum = 0.0;
        int terms = 0;

        Set<String> bTags = b.entry.tagSet();
        if (!aTags.isEmpty() || !bTags.isEmpty()) {
            HashSet<String> union = new HashSet<>(aTags);
            union.addAll(bTags);
            int common = 0;
            for (String t : aTags) {
                if (bTags.contains(t)) common++;
            }
            sum += ((double) common / union.size()) * TAG_WEIGHT;
            terms++;
        }

        sum += (FuzzyRatio.ratio(a.searchableText, b.searchableText) / 100.0) * TEXT_WEIGHT;
        terms++;

        return sum / terms;
    }
}
