package net.recipecatalog.domain.catalog;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable view of one recipe entry in the catalog document.
 *
 * <p>Only the fields the catalog writer reasons about are typed. Everything else
 * ({@code Ingredients}, {@code Directions}, {@code Servings}, {@code Type},
 * {@code Description}, and whatever the OCR pipeline adds later) is carried through
 * untouched in insertion order.</p>
 */
public final class Recipe {

    public static final String TITLE = "Title";
    public static final String KEY = "key";
    public static final String UPLOADED_AT = "uploadedAt";
    public static final String IMAGE_URL = "image_url";
    public static final String IMAGE_SEARCH_RESULTS = "image_search_results";

    private final Map<String, Object> fields;

    private Recipe(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    /**
     * Wraps a decoded JSON object. The map is copied; nested values are shared.
     */
    public static Recipe of(Map<String, ?> fields) {
        Objects.requireNonNull(fields, "fields");
        return new Recipe(new LinkedHashMap<>(fields));
    }

    /**
     * Returns the raw title, or an empty string when the field is absent or not textual.
     */
    public String title() {
        Object value = fields.get(TITLE);
        return value instanceof String text ? text : "";
    }

    /**
     * Title in the form used for collision checks: trimmed and lower-cased.
     */
    public String normalizedTitle() {
        return normalizeTitle(title());
    }

    public static String normalizeTitle(String title) {
        if (title == null) {
            return "";
        }
        return title.strip().toLowerCase(Locale.ROOT);
    }

    public Optional<String> key() {
        return textField(KEY);
    }

    public Optional<String> uploadedAt() {
        return textField(UPLOADED_AT);
    }

    public Optional<String> imageUrl() {
        return textField(IMAGE_URL);
    }

    public List<String> imageSearchResults() {
        Object value = fields.get(IMAGE_SEARCH_RESULTS);
        if (!(value instanceof List<?> candidates)) {
            return List.of();
        }
        List<String> urls = new ArrayList<>(candidates.size());
        for (Object candidate : candidates) {
            if (candidate != null) {
                urls.add(candidate.toString());
            }
        }
        return List.copyOf(urls);
    }

    /**
     * Stamps the writer-owned fields for insertion under {@code key}.
     */
    public Recipe stampedForCatalog(String key, Instant uploadedAt, List<String> imageSearchResults) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.put(KEY, key);
        copy.put(IMAGE_SEARCH_RESULTS, List.copyOf(imageSearchResults));
        copy.put(UPLOADED_AT, uploadedAt.toString());
        return new Recipe(copy);
    }

    /**
     * Records the user's image pick: sets {@code image_url} and drops the pending candidates.
     */
    public Recipe withSelectedImage(String imageUrl) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.put(IMAGE_URL, imageUrl);
        copy.remove(IMAGE_SEARCH_RESULTS);
        return new Recipe(copy);
    }

    /**
     * Read-only field map, in the order the fields were first written.
     */
    public Map<String, Object> fields() {
        return fields;
    }

    private Optional<String> textField(String name) {
        Object value = fields.get(name);
        if (value == null) {
            return Optional.empty();
        }
        return Optional.of(value.toString());
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof Recipe recipe && fields.equals(recipe.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "Recipe{key=" + fields.get(KEY) + ", title='" + title() + "'}";
    }
}
