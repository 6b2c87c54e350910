package net.recipecatalog.controller.dto;

import java.util.Map;

public record ImageSelectionResponse(boolean success, Map<String, Object> recipe) {
}
