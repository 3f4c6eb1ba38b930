package net.fiddleserver.application.sandbox;

import java.util.Objects;
import org.springframework.http.HttpHeaders;

/**
 * A sandbox file ready to be written as a {@code 200} response.
 *
 * @param body    file bytes
 * @param headers only the metadata headers the stored object actually carried
 */
public record AssetResponse(byte[] body, HttpHeaders headers) {

    public AssetResponse {
        Objects.requireNonNull(body, "body must not be null");
        Objects.requireNonNull(headers, "headers must not be null");
    }
}
