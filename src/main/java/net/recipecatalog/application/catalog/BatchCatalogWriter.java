package net.recipecatalog.application.catalog;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import net.recipecatalog.domain.catalog.Recipe;
import net.recipecatalog.domain.catalog.RecipeCatalog;
import net.recipecatalog.domain.catalog.VersionedDocument;
import net.recipecatalog.exception.RetryBudgetExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Appends a batch of recipes to the catalog document as one conditional write.
 *
 * <p>Each attempt reloads the catalog, re-runs key assignment and title checks from
 * scratch against that snapshot, and tries a single compare-and-swap. A lost race
 * throws the attempt's decisions away and starts over with the original candidates
 * after a jittered pause. Per-candidate rejections are soft: they are reported next
 * to the successes and never use up an attempt. Callers can add their own admission
 * rule through a {@link CandidateScreen}, which sees only candidates that passed the
 * writer's checks.</p>
 */
public class BatchCatalogWriter {

    private static final Logger logger = LoggerFactory.getLogger(BatchCatalogWriter.class);

    static final String DUPLICATE_TITLE_REASON = "Recipe title already exists";
    static final String MISSING_TITLE_REASON = "Recipe title is required";
    static final String MISSING_IMAGES_REASON = "No image search results available";

    private final VersionedDocumentStore<RecipeCatalog> catalogStore;
    private final ConflictRetryPolicy retryPolicy;
    private final Clock clock;

    private final Counter batchCommits;
    private final Counter batchConflicts;
    private final Counter batchExhausted;

    public BatchCatalogWriter(VersionedDocumentStore<RecipeCatalog> catalogStore,
                              ConflictRetryPolicy retryPolicy,
                              Clock clock,
                              MeterRegistry meterRegistry) {
        this.catalogStore = Objects.requireNonNull(catalogStore, "catalogStore");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.batchCommits = meterRegistry.counter("recipe.catalog.batch.commits");
        this.batchConflicts = meterRegistry.counter("recipe.catalog.batch.conflicts");
        this.batchExhausted = meterRegistry.counter("recipe.catalog.batch.exhausted");
    }

    /**
     * Writes every acceptable candidate in one atomic catalog update.
     *
     * @param candidates recipes in the order keys should be assigned
     * @return committed keys, the position-to-key map and soft errors; when nothing was
     *         accepted the loaded catalog is returned and no write happens
     * @throws RetryBudgetExhaustedException if every attempt lost its conditional write
     * @throws net.recipecatalog.exception.DocumentStoreException on any other store failure
     */
    public BatchWriteResult batchWrite(List<RecipeCandidate> candidates) {
        return batchWrite(candidates, () -> CandidateScreen.ACCEPT_ALL);
    }

    /**
     * Same as {@link #batchWrite(List)}, additionally asking a fresh screen from
     * {@code screens} on every attempt whether each otherwise acceptable candidate may go in.
     */
    public BatchWriteResult batchWrite(List<RecipeCandidate> candidates, Supplier<CandidateScreen> screens) {
        Objects.requireNonNull(candidates, "candidates");
        Objects.requireNonNull(screens, "screens");
        // one timestamp for the whole call, reused by every attempt
        Instant uploadedAt = clock.instant();
        int maxAttempts = retryPolicy.maxAttempts();
        String documentKey = catalogStore.documentKey();

        try {
            return retryPolicy.execute(documentKey, attempt -> {
                logger.info("Batch write attempt {}/{} for {} candidate(s) on {}",
                    attempt + 1, maxAttempts, candidates.size(), documentKey);

                VersionedDocument<RecipeCatalog> snapshot = catalogStore.load();
                AttemptPlan plan = planAttempt(snapshot.document(), candidates, screens.get(), uploadedAt);

                if (plan.committedKeys().isEmpty()) {
                    logger.info("No candidates accepted ({} rejected); skipping catalog write", plan.errors().size());
                    return Optional.of(new BatchWriteResult(snapshot.document(), List.of(), Map.of(), plan.errors()));
                }
                if (!catalogStore.save(plan.catalog(), snapshot.version())) {
                    logger.warn("Conditional write conflict on {} (attempt {}/{}); version {} is stale",
                        documentKey, attempt + 1, maxAttempts, snapshot.version());
                    return Optional.empty();
                }
                batchCommits.increment();
                logger.info("Committed {} recipe(s) {} with {} rejection(s) on attempt {}",
                    plan.committedKeys().size(), plan.committedKeys(), plan.errors().size(), attempt + 1);
                return Optional.of(new BatchWriteResult(plan.catalog(), plan.committedKeys(), plan.positionToKey(), plan.errors()));
            }, attempt -> batchConflicts.increment());
        } catch (RetryBudgetExhaustedException exhausted) {
            batchExhausted.increment();
            logger.error("Batch write gave up after {} conflicting attempts on {}", maxAttempts, documentKey);
            throw exhausted;
        }
    }

    /**
     * Decides, against one freshly loaded snapshot, which candidates go in and under which keys.
     */
    private AttemptPlan planAttempt(RecipeCatalog reloaded,
                                    List<RecipeCandidate> candidates,
                                    CandidateScreen screen,
                                    Instant uploadedAt) {
        Set<String> takenTitles = new HashSet<>();
        for (Recipe existing : reloaded.asMap().values()) {
            takenTitles.add(existing.normalizedTitle());
        }

        RecipeCatalog working = reloaded;
        int nextKey = reloaded.nextKeyCandidate();
        List<String> committedKeys = new ArrayList<>();
        Map<Integer, String> positionToKey = new LinkedHashMap<>();
        List<ItemError> errors = new ArrayList<>();

        for (int position = 0; position < candidates.size(); position++) {
            RecipeCandidate candidate = candidates.get(position);
            Recipe recipe = candidate.recipe();
            String title = recipe.title();
            String normalizedTitle = recipe.normalizedTitle();

            if (normalizedTitle.isEmpty()) {
                errors.add(new ItemError(position, title, MISSING_TITLE_REASON));
                continue;
            }
            if (takenTitles.contains(normalizedTitle)) {
                logger.debug("Candidate {} '{}' collides with an existing title", position, title);
                errors.add(new ItemError(position, title, DUPLICATE_TITLE_REASON));
                continue;
            }
            if (candidate.imageSearchResults().isEmpty()) {
                errors.add(new ItemError(position, title, MISSING_IMAGES_REASON));
                continue;
            }
            String screenedOut = screen.rejectionReason(position, candidate);
            if (screenedOut != null) {
                errors.add(new ItemError(position, title, screenedOut));
                continue;
            }

            int assigned = working.firstFreeKeyFrom(nextKey);
            String key = Integer.toString(assigned);
            working = working.with(key, recipe.stampedForCatalog(key, uploadedAt, candidate.imageSearchResults()));
            takenTitles.add(normalizedTitle);
            committedKeys.add(key);
            positionToKey.put(position, key);
            screen.admitted(position, key);
            nextKey = assigned + 1;
        }

        return new AttemptPlan(working, committedKeys, positionToKey, errors);
    }

    private record AttemptPlan(RecipeCatalog catalog,
                               List<String> committedKeys,
                               Map<Integer, String> positionToKey,
                               List<ItemError> errors) {
    }
}
