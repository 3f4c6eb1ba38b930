package net.fiddleserver.application.sandbox;

import java.util.Objects;
import java.util.Optional;
import net.fiddleserver.domain.sandbox.FileContent;
import net.fiddleserver.service.sandbox.SandboxContext;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

/**
 * Serves individual files of a published sandbox version.
 */
@Service
public class SandboxAssetUseCase {

    private final SandboxContext sandboxContext;

    public SandboxAssetUseCase(SandboxContext sandboxContext) {
        this.sandboxContext = Objects.requireNonNull(sandboxContext, "sandboxContext must not be null");
    }

    /**
     * Resolves {@code path} inside {@code version}.
     *
     * @return the file response, or empty when the version or the file is unknown
     * @throws net.fiddleserver.exception.ObjectStoreUnavailableException when the store could not be read
     */
    public Optional<AssetResponse> serve(String version, String path) {
        return sandboxContext.registry().reader(version)
            .flatMap(reader -> reader.get(path))
            .map(file -> new AssetResponse(file.body(), buildHeaders(file)));
    }

    /**
     * Copies object metadata into response headers, skipping every field the store did not return.
     */
    static HttpHeaders buildHeaders(FileContent file) {
        HttpHeaders headers = new HttpHeaders();
        file.contentTypeValue().ifPresent(contentType -> headers.set(HttpHeaders.CONTENT_TYPE, contentType));
        file.contentLengthValue().ifPresent(headers::setContentLength);
        file.lastModifiedValue().ifPresent(headers::setLastModified);
        file.eTagValue().ifPresent(eTag -> headers.set(HttpHeaders.ETAG, eTag));
        return headers;
    }
}
