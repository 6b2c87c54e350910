package net.recipecatalog.application.catalog;

import java.util.List;
import java.util.Map;
import net.recipecatalog.domain.catalog.RecipeCatalog;

/**
 * Outcome of one {@link BatchCatalogWriter#batchWrite(List)} call.
 *
 * @param catalog catalog as written, or as loaded when nothing was accepted
 * @param committedKeys keys written, in input order
 * @param positionToKey input position to assigned key, for accepted candidates only
 * @param errors soft failures, in input order
 */
public record BatchWriteResult(RecipeCatalog catalog,
                               List<String> committedKeys,
                               Map<Integer, String> positionToKey,
                               List<ItemError> errors) {

    public BatchWriteResult {
        committedKeys = List.copyOf(committedKeys);
        positionToKey = Map.copyOf(positionToKey);
        errors = List.copyOf(errors);
    }

    public boolean hasCommits() {
        return !committedKeys.isEmpty();
    }
}
