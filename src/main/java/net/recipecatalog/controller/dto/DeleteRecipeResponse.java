package net.recipecatalog.controller.dto;

public record DeleteRecipeResponse(boolean success, String message) {
}
