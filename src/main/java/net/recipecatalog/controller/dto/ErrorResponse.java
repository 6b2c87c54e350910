package net.recipecatalog.controller.dto;

/**
 * Error payload shared by every catalog endpoint: {@code {"success": false, "error": "..."}}.
 */
public record ErrorResponse(boolean success, String error) {

    public static ErrorResponse of(String error) {
        return new ErrorResponse(false, error);
    }
}
