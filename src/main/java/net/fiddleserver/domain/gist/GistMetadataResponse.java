package net.fiddleserver.domain.gist;

import org.springframework.lang.Nullable;

/**
 * Status and decoded body of one gist API metadata call. This is the value held in the gist cache.
 *
 * @param status  HTTP status returned by the gist API
 * @param payload decoded body, present only for status 200
 */
public record GistMetadataResponse(int status, @Nullable GistPayload payload) {

    public static GistMetadataResponse ok(GistPayload payload) {
        return new GistMetadataResponse(200, payload);
    }

    public static GistMetadataResponse status(int status) {
        return new GistMetadataResponse(status, null);
    }

    public boolean isOk() {
        return status == 200 && payload != null;
    }
}
