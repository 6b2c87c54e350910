package net.recipecatalog.adapters.persistence;

/**
 * Converts one versioned document type to and from its stored JSON form.
 *
 * @param <T> document type
 */
public interface JsonDocumentCodec<T> {

    /**
     * Value a missing object decodes to.
     */
    T empty();

    /**
     * @throws tools.jackson.core.JacksonException when the body is not valid JSON of the expected shape
     */
    T decode(String json);

    String encode(T document);
}
