/**
 * Loads the playground source of a gist from the gist API.
 * Metadata responses are cached per gist id for a fixed window to stay inside the API's hourly
 * rate limit; truncated files are completed from their raw URL with a second, uncached call.
 */
package net.fiddleserver.service.gist;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Ticker;
import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.handler.timeout.WriteTimeoutException;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import net.fiddleserver.config.CacheFactory;
import net.fiddleserver.config.GistProperties;
import net.fiddleserver.domain.gist.GistFile;
import net.fiddleserver.domain.gist.GistMetadataResponse;
import net.fiddleserver.domain.gist.GistPayload;
import net.fiddleserver.util.ExternalApiLogger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.codec.CodecException;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

@Service
@Slf4j
public class GistFetcher {

    private static final String API_NAME = "GistApi";

    private final WebClient webClient;
    private final GistProperties properties;
    private final Cache<String, GistMetadataResponse> metadataCache;

    /**
     * Constructs GistFetcher with required dependencies
     *
     * @param webClient client bound to the gist API base URL
     * @param properties gist API settings
     * @param cacheFactory factory for the metadata cache
     */
    @Autowired
    public GistFetcher(@Qualifier("gistWebClient") WebClient webClient,
                       GistProperties properties,
                       CacheFactory cacheFactory) {
        this(webClient, properties, cacheFactory, Ticker.systemTicker());
    }

    GistFetcher(WebClient webClient, GistProperties properties, CacheFactory cacheFactory, Ticker ticker) {
        this.webClient = Objects.requireNonNull(webClient, "webClient must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.metadataCache = cacheFactory.createCacheWithTtl(
            "gist-metadata", properties.getApi().getCacheTtl(), ticker);
    }

    /**
     * Resolves a gist into the source text to pre-load.
     *
     * @param gistId gist identifier as supplied by the caller
     * @return the source, a not-found outcome, or the upstream status to propagate
     */
    public Mono<GistFetchResult> fetch(String gistId) {
        return fetchMetadata(gistId)
            .flatMap(metadata -> {
                if (!metadata.isOk()) {
                    log.info("Gist API answered {} for gist {}; propagating status", metadata.status(), gistId);
                    return Mono.just(GistFetchResult.upstreamError(metadata.status()));
                }
                Optional<GistFile> selected = GistFileSelector.select(
                    metadata.payload().filesInApiOrder(), properties.getSourceExtension());
                if (selected.isEmpty()) {
                    log.debug("Gist {} has no files to load", gistId);
                    return Mono.just(GistFetchResult.notFound());
                }
                return resolveSource(gistId, selected.get())
                    .map(GistFetchResult::success)
                    .defaultIfEmpty(GistFetchResult.notFound());
            })
            .onErrorResume(GistFetcher::isUpstreamFailure, error -> {
                int status = upstreamStatusFor(error);
                log.warn("Gist {} could not be loaded; answering {}", gistId, status, error);
                return Mono.just(GistFetchResult.upstreamError(status));
            });
    }

    /**
     * Returns the metadata response for {@code gistId}, from cache when one was stored within the
     * configured window. Concurrent first calls for one id may each reach the API.
     */
    Mono<GistMetadataResponse> fetchMetadata(String gistId) {
        return Mono.defer(() -> {
            GistMetadataResponse cached = metadataCache.getIfPresent(gistId);
            if (cached != null) {
                ExternalApiLogger.logCacheHit(log, API_NAME, "GET_GIST", gistId);
                return Mono.just(cached);
            }
            return requestMetadata(gistId).doOnNext(response -> metadataCache.put(gistId, response));
        });
    }

    private Mono<GistMetadataResponse> requestMetadata(String gistId) {
        boolean authenticated = properties.getApi().hasCredentials();
        ExternalApiLogger.logApiCallAttempt(log, API_NAME, "GET_GIST", gistId, authenticated);
        return webClient.get()
            .uri("/gists/{gistId}", gistId)
            .headers(this::applyCredentials)
            .exchangeToMono(response -> {
                int status = response.statusCode().value();
                ExternalApiLogger.logApiCallCompleted(log, API_NAME, "GET_GIST", gistId, status);
                if (status != HttpStatus.OK.value()) {
                    return response.releaseBody().thenReturn(GistMetadataResponse.status(status));
                }
                return response.bodyToMono(GistPayload.class)
                    .defaultIfEmpty(new GistPayload(null))
                    .map(GistMetadataResponse::ok);
            })
            .timeout(timeout())
            .doOnError(error -> ExternalApiLogger.logApiCallFailure(
                log, API_NAME, "GET_GIST", gistId, String.valueOf(error.getMessage())));
    }

    private Mono<String> resolveSource(String gistId, GistFile file) {
        if (!file.truncated()) {
            return Mono.justOrEmpty(file.content());
        }
        if (file.rawUrl() == null || file.rawUrl().isBlank()) {
            log.warn("Gist {} has a truncated file without raw_url", gistId);
            return Mono.empty();
        }
        return fetchRaw(gistId, file.rawUrl());
    }

    /**
     * Fetches the full body of a truncated file. Not cached. Any status other than 200 yields empty.
     */
    private Mono<String> fetchRaw(String gistId, String rawUrl) {
        return Mono.defer(() -> {
                URI uri;
                try {
                    uri = URI.create(rawUrl);
                } catch (IllegalArgumentException e) {
                    log.warn("Gist {} has an invalid raw_url '{}'", gistId, rawUrl, e);
                    return Mono.<String>empty();
                }
                ExternalApiLogger.logApiCallAttempt(log, API_NAME, "GET_RAW", rawUrl, false);
                return webClient.get()
                    .uri(uri)
                    .exchangeToMono(response -> {
                        int status = response.statusCode().value();
                        ExternalApiLogger.logApiCallCompleted(log, API_NAME, "GET_RAW", rawUrl, status);
                        if (status != HttpStatus.OK.value()) {
                            return response.releaseBody().then(Mono.<String>empty());
                        }
                        return response.bodyToMono(String.class).defaultIfEmpty("");
                    });
            })
            .timeout(timeout())
            .doOnError(error -> ExternalApiLogger.logApiCallFailure(
                log, API_NAME, "GET_RAW", rawUrl, String.valueOf(error.getMessage())));
    }

    private void applyCredentials(HttpHeaders headers) {
        GistProperties.Api api = properties.getApi();
        if (api.hasCredentials()) {
            headers.setBasicAuth(api.getClientId(), api.getClientSecret());
        }
    }

    private Duration timeout() {
        return properties.getApi().getTimeout();
    }

    // DataBufferLimitException: body larger than the client's in-memory codec limit
    private static boolean isUpstreamFailure(Throwable error) {
        return error instanceof TimeoutException
            || error instanceof WebClientRequestException
            || error instanceof CodecException
            || error instanceof DataBufferLimitException;
    }

    /**
     * Timeouts map to 504, every other transport or decoding failure to 502.
     */
    static int upstreamStatusFor(Throwable error) {
        if (error instanceof TimeoutException) {
            return HttpStatus.GATEWAY_TIMEOUT.value();
        }
        Throwable cause = error.getCause();
        if (cause instanceof ReadTimeoutException || cause instanceof WriteTimeoutException) {
            return HttpStatus.GATEWAY_TIMEOUT.value();
        }
        return HttpStatus.BAD_GATEWAY.value();
    }
}
