package net.fiddleserver.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Strongly typed configuration for the gist API integration.
 */
@Component
@ConfigurationProperties(prefix = "gist")
public class GistProperties {

    /**
     * Suffix of the file preferred when a gist holds several files.
     */
    private String sourceExtension = ".cljs";

    private final Api api = new Api();

    public String getSourceExtension() {
        return sourceExtension;
    }

    public void setSourceExtension(String sourceExtension) {
        this.sourceExtension = sourceExtension;
    }

    public Api getApi() {
        return api;
    }

    public static class Api {

        /**
         * Root of the gist API; metadata is read from {@code {baseUrl}/gists/{id}}.
         */
        private String baseUrl = "https://api.github.com";

        /**
         * Basic-auth user; sent only together with {@link #clientSecret}.
         */
        private String clientId;

        private String clientSecret;

        /**
         * Timeout applied to each outbound gist call, metadata and raw content alike.
         */
        private Duration timeout = Duration.ofSeconds(10);

        /**
         * How long a metadata response is reused for the same gist id.
         */
        private Duration cacheTtl = Duration.ofSeconds(30);

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getClientId() {
            return clientId;
        }

        public void setClientId(String clientId) {
            this.clientId = clientId;
        }

        public String getClientSecret() {
            return clientSecret;
        }

        public void setClientSecret(String clientSecret) {
            this.clientSecret = clientSecret;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Duration getCacheTtl() {
            return cacheTtl;
        }

        public void setCacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
        }

        public boolean hasCredentials() {
            return StringUtils.hasText(clientId) && StringUtils.hasText(clientSecret);
        }
    }
}
