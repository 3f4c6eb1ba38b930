package net.fiddleserver.service.sandbox;

import java.util.Objects;
import java.util.Optional;
import org.springframework.lang.Nullable;

/**
 * Read-only startup context handed to every sandbox request handler.
 *
 * @param registry      versions known at startup
 * @param latestVersion default version, resolved once from {@code registry}; {@code null} when the
 *                      bucket holds no versions
 */
public record SandboxContext(SandboxRegistry registry, @Nullable String latestVersion) {

    public SandboxContext {
        Objects.requireNonNull(registry, "registry must not be null");
    }

    public static SandboxContext from(SandboxRegistry registry) {
        return new SandboxContext(registry, registry.latestVersion().orElse(null));
    }

    public Optional<String> defaultVersion() {
        return Optional.ofNullable(latestVersion);
    }
}
