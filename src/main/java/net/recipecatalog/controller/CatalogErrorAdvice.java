package net.recipecatalog.controller;

import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import net.recipecatalog.controller.dto.ErrorResponse;
import net.recipecatalog.exception.DocumentStoreException;
import net.recipecatalog.exception.RecipeNotFoundException;
import net.recipecatalog.exception.RetryBudgetExhaustedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps catalog exceptions to HTTP status codes and the shared error payload.
 */
@Slf4j
@RestControllerAdvice(assignableTypes = RecipeCatalogController.class)
public class CatalogErrorAdvice {

    @ExceptionHandler(RecipeNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(RecipeNotFoundException ex) {
        log.info("Recipe '{}' not found", ex.getRecipeKey());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of(ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadInput(IllegalArgumentException ex) {
        log.warn("Rejected catalog request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.of(ex.getMessage()));
    }

    @ExceptionHandler(RetryBudgetExhaustedException.class)
    public ResponseEntity<ErrorResponse> handleExhausted(RetryBudgetExhaustedException ex) {
        log.error("Catalog write gave up: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ErrorResponse.of(ex.getMessage()));
    }

    @ExceptionHandler(DocumentStoreException.class)
    public ResponseEntity<ErrorResponse> handleStoreFailure(DocumentStoreException ex) {
        log.error("Store failure on {}: {}", ex.getDocumentKey(), ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.of(ex.getMessage()));
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<ErrorResponse> handleUploadRead(IOException ex) {
        log.error("Could not read uploaded image: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ErrorResponse.of("Could not read uploaded image: " + ex.getMessage()));
    }
}
