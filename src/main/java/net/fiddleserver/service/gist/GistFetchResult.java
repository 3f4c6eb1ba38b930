package net.fiddleserver.service.gist;

import java.util.Optional;

/**
 * Outcome of resolving a gist into playground source text.
 * - SUCCESS carries the source
 * - NOT_FOUND means no file or no content could be selected
 * - UPSTREAM_ERROR carries the status to propagate with an empty body
 */
public final class GistFetchResult {

    public enum Status {
        SUCCESS,
        NOT_FOUND,
        UPSTREAM_ERROR
    }

    private static final GistFetchResult NOT_FOUND = new GistFetchResult(Status.NOT_FOUND, null, 404);

    private final Status status;
    private final String source;
    private final int httpStatus;

    private GistFetchResult(Status status, String source, int httpStatus) {
        if (status == Status.SUCCESS && source == null) {
            throw new IllegalArgumentException("SUCCESS result requires non-null source");
        }
        this.status = status;
        this.source = source;
        this.httpStatus = httpStatus;
    }

    public static GistFetchResult success(String source) {
        return new GistFetchResult(Status.SUCCESS, source, 200);
    }

    public static GistFetchResult notFound() {
        return NOT_FOUND;
    }

    /**
     * @param httpStatus status to hand back to the caller, verbatim from the gist API or derived from a transport failure
     */
    public static GistFetchResult upstreamError(int httpStatus) {
        return new GistFetchResult(Status.UPSTREAM_ERROR, null, httpStatus);
    }

    public Optional<String> getSource() {
        return Optional.ofNullable(source);
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isNotFound() {
        return status == Status.NOT_FOUND;
    }

    public boolean isUpstreamError() {
        return status == Status.UPSTREAM_ERROR;
    }

    @Override
    public String toString() {
        return "GistFetchResult{status=" + status + ", httpStatus=" + httpStatus + "}";
    }
}
