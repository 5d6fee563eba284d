package org.calista.archives.lore.search;

import java.util.Comparator;
import java.util.Objects;

/**
 * Small immutable scored wrapper.
 *
 * <p>No tie-break key on purpose: sorting with {@link #byScoreDescending()} is stable, so equal
 * scores keep the order in which they were produced (index order).</p>
 */
public final class Scored<T> {
    public final T item;
    public final double score;

    public Scored(T item, double score) {
        this.item = Objects.requireNonNull(item, "item");
        this.score = score;
    }

    public static <T> Scored<T> of(T item, double score) {
        return new Scored<>(item, score);
    }

    public static <T> Comparator<Scored<T>> byScoreDescending() {
        return (a, b) -> Double.compare(b.score, a.score);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Scored<?> s)) return false;
        return Double.doubleToLongBits(score) == Double.doubleToLongBits(s.score)
                && Objects.equals(item, s.item);
    }

    @Override
    public int hashCode() {
        return Objects.hash(item, Double.doubleToLongBits(score));
    }

    @Override
    public String toString() {
        return "Scored{score=" + score + ", item=" + item + '}';
    }
}
