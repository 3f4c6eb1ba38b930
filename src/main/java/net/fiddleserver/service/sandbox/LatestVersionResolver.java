package net.fiddleserver.service.sandbox;

import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;

/**
 * Picks the default sandbox version: the lexicographically greatest identifier.
 * Identifiers are compared as plain strings, so {@code "10.0"} sorts before {@code "9.0"}.
 */
public final class LatestVersionResolver {

    private LatestVersionResolver() {
    }

    public static Optional<String> resolve(Collection<String> versions) {
        if (versions == null) {
            return Optional.empty();
        }
        return versions.stream()
            .filter(version -> version != null && !version.isEmpty())
            .max(Comparator.naturalOrder());
    }
}
