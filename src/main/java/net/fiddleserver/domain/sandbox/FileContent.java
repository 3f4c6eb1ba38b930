package net.fiddleserver.domain.sandbox;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import org.springframework.lang.Nullable;

/**
 * One file of a published sandbox bundle as read from object storage.
 *
 * <p>Every metadata field is optional and stays {@code null} when the store did not return it, so
 * callers can emit only the headers that were actually present on the source object.</p>
 *
 * @param body          raw file bytes
 * @param contentType   MIME type recorded on the object
 * @param contentLength byte length recorded on the object
 * @param lastModified  last modification time recorded on the object
 * @param eTag          entity tag recorded on the object, quotes included
 */
public record FileContent(byte[] body,
                          @Nullable String contentType,
                          @Nullable Long contentLength,
                          @Nullable Instant lastModified,
                          @Nullable String eTag) {

    public FileContent {
        Objects.requireNonNull(body, "body must not be null");
    }

    public Optional<String> contentTypeValue() {
        return Optional.ofNullable(contentType).filter(value -> !value.isBlank());
    }

    /**
     * Zero-length objects report no usable length.
     */
    public Optional<Long> contentLengthValue() {
        return Optional.ofNullable(contentLength).filter(length -> length > 0);
    }

    public Optional<Instant> lastModifiedValue() {
        return Optional.ofNullable(lastModified);
    }

    public Optional<String> eTagValue() {
        return Optional.ofNullable(eTag).filter(value -> !value.isBlank());
    }
}
