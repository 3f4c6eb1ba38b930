package net.fiddleserver.application.sandbox;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import net.fiddleserver.service.sandbox.CachedObjectReader;
import net.fiddleserver.service.sandbox.SandboxContext;
import net.fiddleserver.support.template.PlaceholderTemplateRenderer;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.util.HtmlUtils;

/**
 * Renders a sandbox version's {@code index.html} into the playground page.
 *
 * <p>Template variables:
 * <ul>
 *   <li>{@code sandbox-version} - the version being served</li>
 *   <li>{@code opts} - {@code {"latest": <default version>}}, plus {@code "gist_id"} when a gist is requested</li>
 *   <li>{@code anti-forgery} - hidden form field carrying the request's anti-forgery token</li>
 * </ul>
 */
@Service
@Slf4j
public class SandboxPageUseCase {

    static final String INDEX_FILE = "index.html";
    static final String ANTI_FORGERY_FIELD = "__anti-forgery-token";

    private final SandboxContext sandboxContext;
    private final PlaceholderTemplateRenderer templateRenderer;
    private final AntiForgeryTokenProvider antiForgeryTokenProvider;

    public SandboxPageUseCase(SandboxContext sandboxContext,
                              PlaceholderTemplateRenderer templateRenderer,
                              AntiForgeryTokenProvider antiForgeryTokenProvider) {
        this.sandboxContext = Objects.requireNonNull(sandboxContext, "sandboxContext must not be null");
        this.templateRenderer = Objects.requireNonNull(templateRenderer, "templateRenderer must not be null");
        this.antiForgeryTokenProvider =
            Objects.requireNonNull(antiForgeryTokenProvider, "antiForgeryTokenProvider must not be null");
    }

    /**
     * Renders the page for {@code requestedVersion}, or for the latest version when none is given.
     *
     * @return the HTML document, or empty when the version or its {@code index.html} is unknown
     */
    public Optional<String> render(@Nullable String requestedVersion, @Nullable String gistId) {
        Optional<String> version = StringUtils.hasText(requestedVersion)
            ? Optional.of(requestedVersion)
            : sandboxContext.defaultVersion();
        if (version.isEmpty()) {
            log.warn("No sandbox version requested and no default version is available");
            return Optional.empty();
        }

        Optional<CachedObjectReader> reader = sandboxContext.registry().reader(version.get());
        if (reader.isEmpty()) {
            log.debug("Unknown sandbox version '{}'", version.get());
            return Optional.empty();
        }

        return reader.get().get(INDEX_FILE)
            .map(index -> new String(index.body(), StandardCharsets.UTF_8))
            .map(template -> templateRenderer.render(template, variables(version.get(), gistId)));
    }

    private Map<String, Object> variables(String version, @Nullable String gistId) {
        Map<String, Object> opts = new LinkedHashMap<>();
        opts.put("latest", sandboxContext.latestVersion());
        if (StringUtils.hasText(gistId)) {
            opts.put("gist_id", gistId);
        }

        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("sandbox-version", version);
        variables.put("opts", opts);
        variables.put("anti-forgery", antiForgeryField(antiForgeryTokenProvider.currentToken()));
        return variables;
    }

    static String antiForgeryField(String token) {
        String value = token == null ? "" : HtmlUtils.htmlEscape(token);
        return "<input id=\"" + ANTI_FORGERY_FIELD + "\" name=\"" + ANTI_FORGERY_FIELD
            + "\" type=\"hidden\" value=\"" + value + "\">";
    }
}
