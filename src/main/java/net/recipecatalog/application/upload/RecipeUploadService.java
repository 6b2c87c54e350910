package net.recipecatalog.application.upload;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import net.recipecatalog.adapters.persistence.UploadStatusRepository;
import net.recipecatalog.application.catalog.BatchCatalogWriter;
import net.recipecatalog.application.catalog.BatchWriteResult;
import net.recipecatalog.application.catalog.CandidateScreen;
import net.recipecatalog.application.catalog.EmbeddingIndexWriter;
import net.recipecatalog.application.catalog.RecipeCandidate;
import net.recipecatalog.domain.catalog.EmbeddingIndex;
import net.recipecatalog.domain.similarity.DuplicateCheck;
import net.recipecatalog.domain.similarity.SimilarityIndex;
import net.recipecatalog.exception.DimensionMismatchException;
import net.recipecatalog.exception.DocumentStoreException;
import net.recipecatalog.exception.RetryBudgetExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one upload job end to end: the batch catalog write with embedding duplicate
 * screening, the embedding merge for what was committed, and the job status document.
 *
 * <p>Embedding screening runs inside each write attempt, after the title and image
 * checks, so a batch item only screens later items once it has been given a key.
 * A vector whose length does not match the index is a per-item rejection.</p>
 *
 * <p>The catalog and the embedding index are separate documents. Once the catalog write
 * has landed it stays committed even if the embedding merge then fails; the failure is
 * logged and reported as a warning.</p>
 */
public class RecipeUploadService {

    private static final Logger logger = LoggerFactory.getLogger(RecipeUploadService.class);

    private static final String PENDING_KEY_PREFIX = "pending:";
    static final String DIMENSION_MISMATCH_REASON = "Embedding dimension mismatch: ";

    private final BatchCatalogWriter batchWriter;
    private final EmbeddingIndexWriter embeddingWriter;
    private final UploadStatusRepository statusRepository;
    private final double similarityThreshold;
    private final Clock clock;

    public RecipeUploadService(BatchCatalogWriter batchWriter,
                               EmbeddingIndexWriter embeddingWriter,
                               UploadStatusRepository statusRepository,
                               double similarityThreshold,
                               Clock clock) {
        this.batchWriter = Objects.requireNonNull(batchWriter, "batchWriter");
        this.embeddingWriter = Objects.requireNonNull(embeddingWriter, "embeddingWriter");
        this.statusRepository = Objects.requireNonNull(statusRepository, "statusRepository");
        this.similarityThreshold = similarityThreshold;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Uploads {@code candidates} under {@code jobId}.
     *
     * @throws RetryBudgetExhaustedException if the catalog write kept conflicting
     * @throws DocumentStoreException on a store fault before the catalog write landed
     */
    public UploadResult upload(String jobId, List<UploadCandidate> candidates) {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(candidates, "candidates");
        logger.info("Upload job {} started with {} recipe(s)", jobId, candidates.size());
        recordStatus(UploadStatus.processing(jobId, candidates.size(), clock.instant()));

        try {
            UploadResult result = runUpload(jobId, candidates);
            recordStatus(new UploadStatus(jobId, UploadState.COMPLETED, candidates.size(),
                result.committedKeys().size(), result.committedKeys(), result.errors(),
                result.indexWarning(), clock.instant()));
            logger.info("Upload job {} completed: {} committed, {} rejected",
                jobId, result.committedKeys().size(), result.errors().size());
            return result;
        } catch (RuntimeException failure) {
            logger.error("Upload job {} failed: {}", jobId, failure.getMessage(), failure);
            recordStatus(new UploadStatus(jobId, UploadState.FAILED, candidates.size(), 0,
                List.of(), List.of(), failure.getMessage(), clock.instant()));
            throw failure;
        }
    }

    private UploadResult runUpload(String jobId, List<UploadCandidate> candidates) {
        EmbeddingIndex storedIndex = embeddingWriter.currentIndex();
        List<RecipeCandidate> recipeCandidates = new ArrayList<>(candidates.size());
        for (UploadCandidate candidate : candidates) {
            recipeCandidates.add(new RecipeCandidate(candidate.recipe(), candidate.imageSearchResults()));
        }

        BatchWriteResult written = batchWriter.batchWrite(recipeCandidates,
            () -> new EmbeddingScreen(jobId, candidates, new SimilarityIndex(storedIndex, similarityThreshold)));

        Map<Integer, String> positionToKey = new LinkedHashMap<>();
        written.positionToKey().entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .forEach(entry -> positionToKey.put(entry.getKey(), entry.getValue()));

        String indexWarning = mergeEmbeddings(jobId, candidates, positionToKey);
        return new UploadResult(jobId, written.committedKeys(), positionToKey, written.errors(), indexWarning);
    }

    private String mergeEmbeddings(String jobId, List<UploadCandidate> candidates, Map<Integer, String> positionToKey) {
        Map<String, double[]> entries = new LinkedHashMap<>();
        positionToKey.forEach((position, key) -> {
            UploadCandidate candidate = candidates.get(position);
            if (candidate.hasEmbedding()) {
                entries.put(key, candidate.embedding());
            }
        });
        if (entries.isEmpty()) {
            return null;
        }
        try {
            embeddingWriter.merge(entries);
            return null;
        } catch (RetryBudgetExhaustedException | DocumentStoreException indexFailure) {
            logger.error("Job {}: catalog keys {} committed but embedding merge failed: {}",
                jobId, entries.keySet(), indexFailure.getMessage(), indexFailure);
            return "Embeddings not stored for " + entries.keySet() + ": " + indexFailure.getMessage();
        }
    }

    private void recordStatus(UploadStatus status) {
        try {
            statusRepository.save(status);
        } catch (DocumentStoreException statusFailure) {
            logger.warn("Could not record status {} for upload job {}: {}",
                status.status().wireValue(), status.jobId(), statusFailure.getMessage());
        }
    }

    /**
     * Embedding duplicate check for one write attempt. Screens against the stored index
     * plus the vectors of batch items this attempt has already admitted.
     */
    private static final class EmbeddingScreen implements CandidateScreen {

        private final String jobId;
        private final List<UploadCandidate> candidates;
        private SimilarityIndex index;

        EmbeddingScreen(String jobId, List<UploadCandidate> candidates, SimilarityIndex index) {
            this.jobId = jobId;
            this.candidates = candidates;
            this.index = index;
        }

        @Override
        public String rejectionReason(int position, RecipeCandidate candidate) {
            UploadCandidate upload = candidates.get(position);
            if (!upload.hasEmbedding()) {
                return null;
            }
            String reason;
            try {
                DuplicateCheck check = index.checkDuplicate(upload.embedding());
                if (!check.duplicate()) {
                    return null;
                }
                reason = duplicateReason(check);
            } catch (DimensionMismatchException mismatch) {
                reason = DIMENSION_MISMATCH_REASON + mismatch.getMessage();
            }
            logger.info("Job {}: recipe {} '{}' rejected: {}", jobId, position, candidate.recipe().title(), reason);
            return reason;
        }

        @Override
        public void admitted(int position, String recipeKey) {
            UploadCandidate upload = candidates.get(position);
            if (upload.hasEmbedding()) {
                index = index.withEntry(PENDING_KEY_PREFIX + position, upload.embedding());
            }
        }

        private static String duplicateReason(DuplicateCheck check) {
            String matchedKey = check.matchedKey();
            if (matchedKey != null && matchedKey.startsWith(PENDING_KEY_PREFIX)) {
                return String.format(Locale.ROOT, "Duplicate of batch item %s (%.2f)",
                    matchedKey.substring(PENDING_KEY_PREFIX.length()), check.score());
            }
            return check.describe();
        }
    }
}
