package net.recipecatalog.domain.similarity;

import java.util.Objects;
import net.recipecatalog.domain.catalog.EmbeddingIndex;
import net.recipecatalog.exception.DimensionMismatchException;

/**
 * Cosine-similarity duplicate detector over an {@link EmbeddingIndex} snapshot.
 *
 * <p>Lookups are a linear scan. The catalog is small enough that an ANN structure
 * would cost more to keep consistent with the stored document than it saves.</p>
 */
public final class SimilarityIndex {

    public static final double DEFAULT_THRESHOLD = 0.85;

    private final EmbeddingIndex embeddings;
    private final double threshold;

    public SimilarityIndex(EmbeddingIndex embeddings, double threshold) {
        this.embeddings = Objects.requireNonNull(embeddings, "embeddings");
        if (Double.isNaN(threshold) || threshold < -1.0 || threshold > 1.0) {
            throw new IllegalArgumentException("Similarity threshold must be within [-1, 1], got " + threshold);
        }
        this.threshold = threshold;
    }

    public SimilarityIndex(EmbeddingIndex embeddings) {
        this(embeddings, DEFAULT_THRESHOLD);
    }

    /**
     * Cosine similarity of two vectors.
     *
     * @return a value in [-1, 1]; exactly {@code 0.0} when either vector has zero magnitude
     * @throws DimensionMismatchException if the vectors differ in length
     */
    public static double cosineSimilarity(double[] first, double[] second) {
        if (first.length != second.length) {
            throw new DimensionMismatchException(first.length, second.length);
        }
        double dot = 0.0;
        double firstSquares = 0.0;
        double secondSquares = 0.0;
        for (int i = 0; i < first.length; i++) {
            dot += first[i] * second[i];
            firstSquares += first[i] * first[i];
            secondSquares += second[i] * second[i];
        }
        if (firstSquares == 0.0 || secondSquares == 0.0) {
            return 0.0;
        }
        double similarity = dot / (Math.sqrt(firstSquares) * Math.sqrt(secondSquares));
        // rounding can push |similarity| a hair past 1
        return Math.max(-1.0, Math.min(1.0, similarity));
    }

    /**
     * Closest stored vector to {@code query}. Only positive scores count as a match.
     */
    public SimilarityMatch findMostSimilar(double[] query) {
        if (embeddings.isEmpty()) {
            return SimilarityMatch.none();
        }
        SimilarityMatch[] best = {SimilarityMatch.none()};
        embeddings.forEachVector((key, vector) -> {
            double score = cosineSimilarity(query, vector);
            if (score > best[0].score()) {
                best[0] = new SimilarityMatch(key, score);
            }
        });
        return best[0];
    }

    /**
     * Duplicate iff the best score is strictly greater than the threshold.
     */
    public DuplicateCheck checkDuplicate(double[] query) {
        SimilarityMatch match = findMostSimilar(query);
        if (match.score() > threshold) {
            return new DuplicateCheck(true, match.recipeKey(), match.score());
        }
        return new DuplicateCheck(false, null, match.score());
    }

    public boolean isDuplicate(double[] query) {
        return checkDuplicate(query).duplicate();
    }

    /**
     * New index that also screens against {@code vector}; this one is unchanged.
     */
    public SimilarityIndex withEntry(String key, double[] vector) {
        return new SimilarityIndex(embeddings.with(key, vector), threshold);
    }

    public double threshold() {
        return threshold;
    }

    public int size() {
        return embeddings.size();
    }
}
