/**
 * Represents the result of attempting to fetch an object from S3 storage
 * - Distinguishes a missing or inaccessible object from a failing store
 * - Missing and denied objects are stable outcomes and safe to memoize
 * - Service errors are transient and must not be memoized
 *
 * @param <T> The type of data contained in a successful result
 */
package net.fiddleserver.service.s3;

import java.util.Optional;

public final class S3FetchResult<T> {

    public enum Status {
        SUCCESS,        // Object was retrieved
        NOT_FOUND,      // Object does not exist under the key
        ACCESS_DENIED,  // Store refused the read for this key
        SERVICE_ERROR   // Store or network failure (temporary)
    }

    private final Status status;
    private final T data;
    private final String errorMessage;

    private S3FetchResult(Status status, T data, String errorMessage) {
        if (status == Status.SUCCESS && data == null) {
            throw new IllegalArgumentException("SUCCESS result requires non-null data");
        }
        if (status != Status.SUCCESS && errorMessage == null) {
            throw new IllegalArgumentException(status + " result requires non-null errorMessage");
        }
        this.status = status;
        this.data = data;
        this.errorMessage = errorMessage;
    }

    /**
     * Create a successful result with data
     *
     * @param data The data retrieved from S3
     * @return A successful S3FetchResult containing the data
     */
    public static <T> S3FetchResult<T> success(T data) {
        return new S3FetchResult<>(Status.SUCCESS, data, null);
    }

    /**
     * Create a not found result
     *
     * @return A not found S3FetchResult
     */
    public static <T> S3FetchResult<T> notFound() {
        return new S3FetchResult<>(Status.NOT_FOUND, null, "Object not found in S3");
    }

    /**
     * Create an access denied result
     *
     * @param errorMessage Message reported by the store
     * @return An access denied S3FetchResult
     */
    public static <T> S3FetchResult<T> accessDenied(String errorMessage) {
        return new S3FetchResult<>(Status.ACCESS_DENIED, null, errorMessage);
    }

    /**
     * Create a service error result
     *
     * @param errorMessage Description of the error
     * @return A service error S3FetchResult with the error message
     */
    public static <T> S3FetchResult<T> serviceError(String errorMessage) {
        return new S3FetchResult<>(Status.SERVICE_ERROR, null, errorMessage);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isNotFound() {
        return status == Status.NOT_FOUND;
    }

    public boolean isAccessDenied() {
        return status == Status.ACCESS_DENIED;
    }

    public boolean isServiceError() {
        return status == Status.SERVICE_ERROR;
    }

    /**
     * Get the data if this result was successful
     *
     * @return An Optional containing the data if successful, empty otherwise
     */
    public Optional<T> getData() {
        return Optional.ofNullable(data);
    }

    /**
     * Get the error message if this result was not successful
     *
     * @return An Optional containing the error message if there was an error, empty otherwise
     */
    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }
}
