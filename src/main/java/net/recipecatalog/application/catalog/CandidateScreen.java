package net.recipecatalog.application.catalog;

import jakarta.annotation.Nullable;

/**
 * Extra admission check run by {@link BatchCatalogWriter} after its own title and image checks.
 *
 * <p>A fresh screen is requested for every write attempt, so state it accumulates through
 * {@link #admitted(int, String)} only ever reflects candidates of the current attempt that
 * were actually given a key.</p>
 */
public interface CandidateScreen {

    CandidateScreen ACCEPT_ALL = new CandidateScreen() {
        @Override
        public String rejectionReason(int position, RecipeCandidate candidate) {
            return null;
        }

        @Override
        public void admitted(int position, String recipeKey) {
        }
    };

    /**
     * @return why the candidate at {@code position} must be skipped, or {@code null} to admit it
     */
    @Nullable
    String rejectionReason(int position, RecipeCandidate candidate);

    /**
     * Called once the candidate at {@code position} has been assigned {@code recipeKey}.
     */
    void admitted(int position, String recipeKey);
}
