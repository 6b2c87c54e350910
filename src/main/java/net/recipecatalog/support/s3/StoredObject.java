package net.recipecatalog.support.s3;

/**
 * UTF-8 object payload together with the ETag it was read at.
 */
public record StoredObject(String body, String eTag) {
}
