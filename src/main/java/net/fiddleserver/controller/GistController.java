package net.fiddleserver.controller;

import net.fiddleserver.service.gist.GistFetchResult;
import net.fiddleserver.service.gist.GistFetcher;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Hands the playground the source text of a gist.
 * Success answers {@code text/plain}; every other outcome answers its status with an empty body.
 */
@RestController
@RequestMapping("/api/v1/gist")
public class GistController {

    private static final MediaType TEXT_PLAIN_UTF8 = MediaType.parseMediaType("text/plain;charset=UTF-8");

    private final GistFetcher gistFetcher;

    public GistController(GistFetcher gistFetcher) {
        this.gistFetcher = gistFetcher;
    }

    @GetMapping("/{gistId}")
    public Mono<ResponseEntity<String>> getGist(@PathVariable String gistId) {
        return gistFetcher.fetch(gistId).map(GistController::toResponse);
    }

    static ResponseEntity<String> toResponse(GistFetchResult result) {
        if (result.isSuccess()) {
            return ResponseEntity.ok()
                .contentType(TEXT_PLAIN_UTF8)
                .body(result.getSource().orElse(""));
        }
        return ResponseEntity.status(result.getHttpStatus()).build();
    }
}
