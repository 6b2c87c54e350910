package net.recipecatalog.domain.catalog;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Immutable snapshot of the embedding document ({@code recipe_key -> vector}).
 *
 * <p>Vectors are copied on the way in and on the way out, except through
 * {@link #forEachVector(BiConsumer)}.</p>
 */
public final class EmbeddingIndex {

    private static final EmbeddingIndex EMPTY = new EmbeddingIndex(new LinkedHashMap<>());

    private final Map<String, double[]> vectors;

    private EmbeddingIndex(LinkedHashMap<String, double[]> vectors) {
        this.vectors = Collections.unmodifiableMap(vectors);
    }

    public static EmbeddingIndex empty() {
        return EMPTY;
    }

    public static EmbeddingIndex of(Map<String, double[]> vectors) {
        Objects.requireNonNull(vectors, "vectors");
        if (vectors.isEmpty()) {
            return EMPTY;
        }
        LinkedHashMap<String, double[]> copy = new LinkedHashMap<>();
        vectors.forEach((key, vector) -> copy.put(key, vector.clone()));
        return new EmbeddingIndex(copy);
    }

    public int size() {
        return vectors.size();
    }

    public boolean isEmpty() {
        return vectors.isEmpty();
    }

    public boolean containsKey(String key) {
        return vectors.containsKey(key);
    }

    public Set<String> keys() {
        return vectors.keySet();
    }

    public Optional<double[]> vector(String key) {
        double[] vector = vectors.get(key);
        return vector == null ? Optional.empty() : Optional.of(vector.clone());
    }

    /**
     * Overlays {@code entries}: new keys are added, existing keys are replaced.
     */
    public EmbeddingIndex withAll(Map<String, double[]> entries) {
        if (entries.isEmpty()) {
            return this;
        }
        LinkedHashMap<String, double[]> copy = new LinkedHashMap<>(vectors);
        entries.forEach((key, vector) -> copy.put(key, vector.clone()));
        return new EmbeddingIndex(copy);
    }

    public EmbeddingIndex with(String key, double[] vector) {
        return withAll(Map.of(key, vector));
    }

    /**
     * Returns this snapshot unchanged when the key is absent.
     */
    public EmbeddingIndex without(String key) {
        if (!vectors.containsKey(key)) {
            return this;
        }
        LinkedHashMap<String, double[]> copy = new LinkedHashMap<>(vectors);
        copy.remove(key);
        return new EmbeddingIndex(copy);
    }

    /**
     * Visits every entry in insertion order without copying. The arrays are the stored
     * ones and must not be modified.
     */
    public void forEachVector(BiConsumer<String, double[]> action) {
        vectors.forEach(action);
    }

    /**
     * Copy of the entries, safe for the caller to keep or serialize.
     */
    public Map<String, double[]> asMap() {
        LinkedHashMap<String, double[]> copy = new LinkedHashMap<>();
        vectors.forEach((key, vector) -> copy.put(key, vector.clone()));
        return copy;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof EmbeddingIndex index) || index.vectors.size() != vectors.size()) {
            return false;
        }
        for (Map.Entry<String, double[]> entry : vectors.entrySet()) {
            double[] theirs = index.vectors.get(entry.getKey());
            if (theirs == null || !Arrays.equals(entry.getValue(), theirs)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 0;
        for (Map.Entry<String, double[]> entry : vectors.entrySet()) {
            hash += entry.getKey().hashCode() ^ Arrays.hashCode(entry.getValue());
        }
        return hash;
    }

    @Override
    public String toString() {
        return "EmbeddingIndex{size=" + vectors.size() + "}";
    }
}
