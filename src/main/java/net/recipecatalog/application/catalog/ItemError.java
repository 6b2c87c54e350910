package net.recipecatalog.application.catalog;

/**
 * Soft, per-candidate failure reported next to the successes of a batch.
 *
 * @param position zero-based index of the candidate in the caller's input list
 * @param title title as submitted
 * @param reason human-readable rejection reason
 */
public record ItemError(int position, String title, String reason) {
}
