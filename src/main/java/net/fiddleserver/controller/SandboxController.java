package net.fiddleserver.controller;

import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import net.fiddleserver.application.sandbox.AssetResponse;
import net.fiddleserver.application.sandbox.SandboxAssetUseCase;
import net.fiddleserver.application.sandbox.SandboxPageUseCase;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

/**
 * Routes for the playground page and the files of each sandbox version.
 *
 * <p>The page is rendered from the version's {@code index.html}; the root and the
 * version-less gist route use the latest published version.
 */
@RestController
@Slf4j
public class SandboxController {

    private final SandboxPageUseCase sandboxPageUseCase;
    private final SandboxAssetUseCase sandboxAssetUseCase;

    public SandboxController(SandboxPageUseCase sandboxPageUseCase, SandboxAssetUseCase sandboxAssetUseCase) {
        this.sandboxPageUseCase = sandboxPageUseCase;
        this.sandboxAssetUseCase = sandboxAssetUseCase;
    }

    @GetMapping("/")
    public ResponseEntity<String> home() {
        return page(null, null);
    }

    @GetMapping("/sandbox/{version}")
    public ResponseEntity<String> sandbox(@PathVariable String version) {
        return page(version, null);
    }

    @GetMapping("/gist/{gistId}")
    public ResponseEntity<String> gist(@PathVariable String gistId) {
        return page(null, gistId);
    }

    @GetMapping("/gist/{version}/{gistId}")
    public ResponseEntity<String> versionedGist(@PathVariable String version, @PathVariable String gistId) {
        return page(version, gistId);
    }

    /**
     * Serves {@code path} from the bundle of {@code version}. The captured path keeps its leading slash.
     * The response is written directly so that only headers backed by object metadata are sent.
     */
    @GetMapping("/sandbox/{version}/{*path}")
    public void asset(@PathVariable String version, @PathVariable String path, HttpServletResponse response)
            throws IOException {
        String relativePath = stripLeadingSlashes(path);
        Optional<AssetResponse> asset = StringUtils.hasText(relativePath)
            ? sandboxAssetUseCase.serve(version, relativePath)
            : Optional.empty();
        if (asset.isEmpty()) {
            log.debug("No file '{}' in sandbox version '{}'", relativePath, version);
            response.setStatus(HttpStatus.NOT_FOUND.value());
            return;
        }
        writeAsset(asset.get(), response);
    }

    private ResponseEntity<String> page(String version, String gistId) {
        return sandboxPageUseCase.render(version, gistId)
            .map(html -> ResponseEntity.ok()
                .contentType(MediaType.TEXT_HTML)
                .body(html))
            .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).build());
    }

    static void writeAsset(AssetResponse asset, HttpServletResponse response) throws IOException {
        response.setStatus(HttpStatus.OK.value());
        asset.headers().forEach((name, values) -> values.forEach(value -> response.addHeader(name, value)));
        response.getOutputStream().write(asset.body());
    }

    static String stripLeadingSlashes(String path) {
        if (path == null) {
            return "";
        }
        int start = 0;
        while (start < path.length() && path.charAt(start) == '/') {
            start++;
        }
        return path.substring(start);
    }
}
