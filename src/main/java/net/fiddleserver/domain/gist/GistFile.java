package net.fiddleserver.domain.gist;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.lang.Nullable;

/**
 * A single file entry of a gist as returned by the gist API.
 *
 * @param content   inline body; withheld or partial when {@code truncated} is set
 * @param truncated whether the API cut the inline body because of its size
 * @param rawUrl    location of the full body
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GistFile(@Nullable String content,
                       boolean truncated,
                       @JsonProperty("raw_url") @Nullable String rawUrl) {
}
