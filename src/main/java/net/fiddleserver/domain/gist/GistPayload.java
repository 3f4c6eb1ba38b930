package net.fiddleserver.domain.gist;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.lang.Nullable;

/**
 * Body of a successful gist metadata response.
 *
 * <p>The {@code files} mapping keeps the order in which the API listed the files; file selection
 * falls back to the first entry and therefore depends on that order.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GistPayload(@Nullable LinkedHashMap<String, GistFile> files) {

    public Map<String, GistFile> filesInApiOrder() {
        return files == null ? Map.of() : Collections.unmodifiableMap(files);
    }
}
