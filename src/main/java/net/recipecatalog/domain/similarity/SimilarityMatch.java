package net.recipecatalog.domain.similarity;

import jakarta.annotation.Nullable;

/**
 * Best match of a nearest-neighbour scan.
 *
 * @param recipeKey key of the closest stored vector, {@code null} when nothing scored above zero
 * @param score cosine similarity of that vector, {@code 0.0} when there is no match
 */
public record SimilarityMatch(@Nullable String recipeKey, double score) {

    private static final SimilarityMatch NONE = new SimilarityMatch(null, 0.0);

    public static SimilarityMatch none() {
        return NONE;
    }
}
