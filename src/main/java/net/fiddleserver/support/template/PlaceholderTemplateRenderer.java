package net.fiddleserver.support.template;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Renders the {@code {{name}}} placeholders used by bundle templates.
 *
 * <p>Supported forms:
 * <ul>
 *   <li>{@code {{name}}} - value as text, HTML-escaped</li>
 *   <li>{@code {{name|safe}}} - value as text, unescaped</li>
 *   <li>{@code {{name|json}}} - value encoded as JSON, HTML-escaped unless {@code safe} follows</li>
 * </ul>
 * Unknown variables render as an empty string. Any other template syntax is copied through.</p>
 */
@Component
@Slf4j
public class PlaceholderTemplateRenderer {

    private static final Pattern PLACEHOLDER =
        Pattern.compile("\\{\\{\\s*([A-Za-z0-9_-]+)((?:\\s*\\|\\s*[A-Za-z]+)*)\\s*}}");

    private static final String FILTER_SAFE = "safe";
    private static final String FILTER_JSON = "json";

    private final ObjectMapper objectMapper;

    public PlaceholderTemplateRenderer(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public String render(String template, Map<String, ?> variables) {
        if (template == null || template.isEmpty()) {
            return "";
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder rendered = new StringBuilder(template.length());
        while (matcher.find()) {
            String name = matcher.group(1);
            List<String> filters = parseFilters(matcher.group(2));
            String value = resolve(name, variables.get(name), filters);
            matcher.appendReplacement(rendered, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(rendered);
        return rendered.toString();
    }

    private String resolve(String name, Object value, List<String> filters) {
        boolean safe = false;
        Object current = value;
        for (String filter : filters) {
            switch (filter) {
                case FILTER_JSON -> current = toJson(name, current);
                case FILTER_SAFE -> safe = true;
                default -> log.warn("Ignoring unknown template filter '{}' on variable '{}'", filter, name);
            }
        }
        String text = current == null ? "" : current.toString();
        return safe ? text : HtmlUtils.htmlEscape(text);
    }

    private String toJson(String name, Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to encode template variable '" + name + "' as JSON", e);
        }
    }

    private static List<String> parseFilters(String filterGroup) {
        List<String> filters = new ArrayList<>();
        if (filterGroup == null || filterGroup.isBlank()) {
            return filters;
        }
        for (String part : filterGroup.split("\\|")) {
            String filter = part.trim();
            if (!filter.isEmpty()) {
                filters.add(filter);
            }
        }
        return filters;
    }
}
