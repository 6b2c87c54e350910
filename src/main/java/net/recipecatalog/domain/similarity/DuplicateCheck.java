package net.recipecatalog.domain.similarity;

import jakarta.annotation.Nullable;
import java.util.Locale;

/**
 * Outcome of a duplicate screen against the embedding index.
 *
 * @param duplicate whether the best score is strictly above the threshold
 * @param matchedKey key of the recipe this one duplicates; {@code null} unless {@code duplicate}
 * @param score best similarity found, reported for both outcomes
 */
public record DuplicateCheck(boolean duplicate, @Nullable String matchedKey, double score) {

    /**
     * User-facing rejection reason, e.g. {@code Duplicate of recipe 12 (0.93)}.
     */
    public String describe() {
        return String.format(Locale.ROOT, "Duplicate of recipe %s (%.2f)", matchedKey, score);
    }
}
