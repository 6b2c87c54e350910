package net.recipecatalog.controller;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import net.recipecatalog.adapters.persistence.UploadStatusRepository;
import net.recipecatalog.application.catalog.AtomicRecipeDeleter;
import net.recipecatalog.application.catalog.DeleteOutcome;
import net.recipecatalog.application.image.RecipeImageSelectionService;
import net.recipecatalog.application.upload.RecipeUploadService;
import net.recipecatalog.application.upload.UploadCandidate;
import net.recipecatalog.application.upload.UploadResult;
import net.recipecatalog.controller.dto.BatchUploadRequest;
import net.recipecatalog.controller.dto.BatchUploadResponse;
import net.recipecatalog.controller.dto.DeleteRecipeResponse;
import net.recipecatalog.controller.dto.ErrorResponse;
import net.recipecatalog.controller.dto.ImageSelectionResponse;
import net.recipecatalog.controller.dto.RecipeUploadItem;
import net.recipecatalog.domain.catalog.Recipe;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * HTTP surface of the recipe catalog.
 *
 * <p>Validates path and body shape, then delegates; status mapping for thrown exceptions
 * lives in {@link CatalogErrorAdvice}.</p>
 */
@Slf4j
@RestController
public class RecipeCatalogController {

    private static final Pattern RECIPE_KEY_PATTERN = Pattern.compile("^[A-Za-z0-9_-]+$");

    private final RecipeUploadService uploadService;
    private final AtomicRecipeDeleter recipeDeleter;
    private final RecipeImageSelectionService imageSelectionService;
    private final UploadStatusRepository uploadStatusRepository;

    public RecipeCatalogController(RecipeUploadService uploadService,
                                   AtomicRecipeDeleter recipeDeleter,
                                   RecipeImageSelectionService imageSelectionService,
                                   UploadStatusRepository uploadStatusRepository) {
        this.uploadService = uploadService;
        this.recipeDeleter = recipeDeleter;
        this.imageSelectionService = imageSelectionService;
        this.uploadStatusRepository = uploadStatusRepository;
    }

    /**
     * Appends a batch of recipes. Rejected recipes are listed in {@code errors}; the call
     * still succeeds as long as the batch itself ran.
     */
    @PostMapping(path = "/api/recipes/batch", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> uploadBatch(@RequestBody BatchUploadRequest request) {
        if (request == null || request.recipes() == null || request.recipes().isEmpty()) {
            return badRequest("No recipes provided");
        }
        String jobId = request.jobId() == null || request.jobId().isBlank()
            ? UUID.randomUUID().toString()
            : request.jobId();
        if (!UploadStatusRepository.isValidJobId(jobId)) {
            return badRequest("Invalid jobId format");
        }

        List<UploadCandidate> candidates = new ArrayList<>(request.recipes().size());
        for (RecipeUploadItem item : request.recipes()) {
            if (item == null || item.recipe() == null) {
                return badRequest("Every batch item needs a recipe object");
            }
            candidates.add(new UploadCandidate(Recipe.of(item.recipe()), item.imageSearchResults(), item.embedding()));
        }

        log.info("Batch upload {} received with {} recipe(s)", jobId, candidates.size());
        UploadResult result = uploadService.upload(jobId, candidates);
        return ResponseEntity.ok(BatchUploadResponse.from(result));
    }

    @DeleteMapping("/api/recipes/{recipeKey}")
    public ResponseEntity<?> deleteRecipe(@PathVariable String recipeKey) {
        if (!isValidRecipeKey(recipeKey)) {
            log.warn("Rejected delete for malformed recipe key '{}'", recipeKey);
            return badRequest("Invalid recipe_key format");
        }
        DeleteOutcome outcome = recipeDeleter.delete(recipeKey);
        if (!outcome.success()) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.of(outcome.error()));
        }
        return ResponseEntity.ok(new DeleteRecipeResponse(true, "Recipe " + recipeKey + " deleted successfully"));
    }

    /**
     * Stores the chosen image for a recipe and records its source URL in the catalog.
     */
    @PostMapping(path = "/api/recipes/{recipeKey}/image", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> selectImage(@PathVariable String recipeKey,
                                         @RequestParam(name = "imageUrl", required = false) String imageUrl,
                                         @RequestParam(name = "image", required = false) MultipartFile image) throws IOException {
        if (!isValidRecipeKey(recipeKey)) {
            return badRequest("Invalid recipe_key format");
        }
        if (imageUrl == null || imageUrl.isBlank()) {
            return badRequest("imageUrl is required");
        }
        if (image == null || image.isEmpty()) {
            return badRequest("image file is required");
        }
        Recipe updated = imageSelectionService.selectImage(recipeKey, imageUrl, image.getBytes());
        return ResponseEntity.ok(new ImageSelectionResponse(true, updated.fields()));
    }

    @GetMapping("/api/upload-status/{jobId}")
    public ResponseEntity<?> uploadStatus(@PathVariable String jobId) {
        if (!UploadStatusRepository.isValidJobId(jobId)) {
            return badRequest("Invalid jobId format");
        }
        return uploadStatusRepository.find(jobId)
            .<ResponseEntity<?>>map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorResponse.of("Upload job " + jobId + " not found")));
    }

    static boolean isValidRecipeKey(String recipeKey) {
        return recipeKey != null && RECIPE_KEY_PATTERN.matcher(recipeKey).matches();
    }

    private static ResponseEntity<ErrorResponse> badRequest(String error) {
        return ResponseEntity.badRequest().body(ErrorResponse.of(error));
    }
}
