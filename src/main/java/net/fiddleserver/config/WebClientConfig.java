/**
 * Configuration for WebClient
 * - Defines the client used for gist API calls
 * - Sets up connect, read, write and response timeouts from the gist settings
 */
package net.fiddleserver.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

@Configuration
public class WebClientConfig {

    private static final String USER_AGENT = "fiddle-server";
    private static final String GITHUB_JSON = "application/vnd.github+json";

    /**
     * Creates the WebClient bound to the gist API
     * - Every timeout equals the configured gist timeout
     * - Redirects are followed so raw URLs behind a CDN resolve
     * - 10MB in-memory limit covers the largest raw gist files
     *
     * @param gistProperties gist API settings
     * @return WebClient with the gist API as base URL
     */
    @Bean
    public WebClient gistWebClient(GistProperties gistProperties) {
        Duration timeout = gistProperties.getApi().getTimeout();
        HttpClient httpClient = HttpClient.create()
            .followRedirect(true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeout.toMillis())
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(timeout.toMillis(), TimeUnit.MILLISECONDS))
                .addHandlerLast(new WriteTimeoutHandler(timeout.toMillis(), TimeUnit.MILLISECONDS))
            )
            .responseTimeout(timeout);

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(10 * 1024 * 1024)) // 10MB
            .build();

        return WebClient.builder()
            .baseUrl(gistProperties.getApi().getBaseUrl())
            .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
            .defaultHeader(HttpHeaders.ACCEPT, GITHUB_JSON, MediaType.APPLICATION_JSON_VALUE, MediaType.TEXT_PLAIN_VALUE)
            .exchangeStrategies(exchangeStrategies)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .build();
    }
}
